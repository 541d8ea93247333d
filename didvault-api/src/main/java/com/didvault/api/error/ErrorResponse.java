package com.didvault.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Error body returned by every failing endpoint.
 *
 * {@code numericCode} is set only for registry rejections.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String code,
    Integer numericCode,
    String message,
    Map<String, String> details
) {
    public static ErrorResponse of(String code, Integer numericCode, String message) {
        return new ErrorResponse(code, numericCode, message, null);
    }
}
