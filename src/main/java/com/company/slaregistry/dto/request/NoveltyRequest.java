package com.company.slaregistry.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pause or resume an SLA
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NoveltyRequest {
    @NotBlank(message = "Reason is required")
    private String reason;
}
