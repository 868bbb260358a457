package com.minicrm.support.request.api;

import jakarta.validation.constraints.NotBlank;

public record CreateRequestRequest(
        @NotBlank(message = "user_identifier_required") String user_identifier,
        @NotBlank(message = "source_id_required") String source_id,
        @NotBlank(message = "message_required") String message
) {
}
