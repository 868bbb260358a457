package com.minicrm.support.source.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ConfigureWeightsRequest(
        @NotNull(message = "weights_required") List<@NotNull(message = "weight_entry_required") @Valid Entry> weights
) {
    public record Entry(
            @NotBlank(message = "operator_id_required") String operator_id,
            @NotNull(message = "weight_required")
            @Min(value = 1, message = "weight_out_of_range")
            @Max(value = 100, message = "weight_out_of_range") Integer weight
    ) {
    }
}
