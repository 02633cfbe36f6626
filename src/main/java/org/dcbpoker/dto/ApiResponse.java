package org.dcbpoker.dto;

/**
 * Uniform error/success body for the REST layer.
 */
public record ApiResponse<T>(int code, String message, T data) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, message, null);
    }

    public static <T> ApiResponse<T> conflict(String message, T data) {
        return new ApiResponse<>(409, message, data);
    }
}
