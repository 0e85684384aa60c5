package com.company.slaregistry.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateTargetRequest {
    @NotNull(message = "New target is required")
    private Long target;

    @NotBlank(message = "Reason is required")
    private String reason;
}
