package com.userservice.exception;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Error body: {@code {"error": {"message": "...", "code": 404}}}.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private ErrorDetail error;

    public static ErrorResponse of(String message, int code) {
        return ErrorResponse.builder()
                .error(new ErrorDetail(message, code))
                .build();
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorDetail {
        private String message;
        private int code;
    }
}
