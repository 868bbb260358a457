package com.minicrm.support.source.api;

import jakarta.validation.constraints.NotBlank;

public record CreateSourceRequest(
        @NotBlank(message = "name_required") String name,
        @NotBlank(message = "identifier_required") String identifier
) {
}
