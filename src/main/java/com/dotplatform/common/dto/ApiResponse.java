package com.dotplatform.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Common response wrapper for every REST endpoint.
 *
 * <pre>
 *   success: {"success": true, "data": {...}}
 * </pre>
 *
 * Errors are rendered as ProblemDetail by the global handler.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean success,
        T data
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data);
    }
}
