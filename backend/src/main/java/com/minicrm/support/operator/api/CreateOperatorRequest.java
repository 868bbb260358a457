package com.minicrm.support.operator.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record CreateOperatorRequest(
        @NotBlank(message = "name_required") String name,
        @NotNull(message = "max_load_limit_required") @Positive(message = "max_load_limit_invalid") Integer max_load_limit
) {
}
