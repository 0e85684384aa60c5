package com.company.slaregistry.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportMetricRequest {
    @NotNull(message = "Observed value is required")
    private Long observed;

    // Becomes the alert reason when the report breaches the SLA
    @Size(max = 1000)
    private String note;
}
