package com.company.slaregistry.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolveAlertRequest {
    @Size(max = 1000)
    private String resolutionNote;
}
