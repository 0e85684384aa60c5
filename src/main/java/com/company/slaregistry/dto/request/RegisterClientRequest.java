package com.company.slaregistry.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterClientRequest {
    @NotBlank(message = "Client name is required")
    @Size(max = 200)
    private String name;

    @NotBlank(message = "Owner reference is required")
    private String ownerRef;
}
