package com.company.slaregistry.dto.request;

import com.company.slaregistry.domain.enums.ComparatorKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * SLA term to attach to a contract, standalone or as part of a contract batch
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaDefinitionRequest {
    @NotBlank(message = "SLA name is required")
    @Size(max = 200)
    private String name;

    private String description;

    @NotNull(message = "Target is required")
    private Long target;

    @NotNull(message = "Comparator is required (LT, LE, EQ, NE, GE, GT)")
    private ComparatorKind comparator;

    // Optional, defaults to 0
    @PositiveOrZero
    private Long windowSeconds;
}
