package com.company.slaregistry.dto.request;

import com.company.slaregistry.domain.enums.ComparatorKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateParamsRequest {
    @NotNull(message = "Comparator is required (LT, LE, EQ, NE, GE, GT)")
    private ComparatorKind comparator;

    @NotNull(message = "Window seconds is required")
    @PositiveOrZero
    private Long windowSeconds;

    @NotBlank(message = "Reason is required")
    private String reason;
}
