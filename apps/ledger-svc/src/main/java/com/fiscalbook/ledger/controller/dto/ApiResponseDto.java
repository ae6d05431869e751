package com.fiscalbook.ledger.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponseDto<T>(boolean success, String message, T data, PaginationDto pagination) {

    public static <T> ApiResponseDto<T> ok(T data) {
        return new ApiResponseDto<>(true, null, data, null);
    }

    public static <T> ApiResponseDto<T> ok(String message, T data) {
        return new ApiResponseDto<>(true, message, data, null);
    }

    public static <T> ApiResponseDto<T> page(T data, PaginationDto pagination) {
        return new ApiResponseDto<>(true, null, data, pagination);
    }
}
