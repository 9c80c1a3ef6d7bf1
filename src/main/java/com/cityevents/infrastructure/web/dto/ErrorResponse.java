package com.cityevents.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Error body shared by validation failures and server errors:
 * {@code {"detail": [{"loc": [...], "msg": "...", "type": "..."}]}}.
 */
public record ErrorResponse(
        List<ErrorDetail> detail
) {
    public static ErrorResponse of(String message) {
        return new ErrorResponse(List.of(new ErrorDetail(null, message, null)));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorDetail(
            List<String> loc,
            String msg,
            String type
    ) {}
}
