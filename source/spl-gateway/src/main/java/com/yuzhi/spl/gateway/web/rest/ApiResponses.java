package com.yuzhi.spl.gateway.web.rest;

public final class ApiResponses {

    static final String INVALID_REQUEST_CODE = "spl-req-0001";
    static final String DATASOURCE_DOWN_CODE = "spl-ds-0001";

    private ApiResponses() {}

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(ResultStatus.SUCCESS.getCode(), "OK", null, data);
    }

    public static <T> ApiResponse<T> error(String code, String message) {
        return new ApiResponse<>(ResultStatus.ERROR.getCode(), message, code, null);
    }

    public static <T> ApiResponse<T> error(String code, String message, T data) {
        return new ApiResponse<>(ResultStatus.ERROR.getCode(), message, code, data);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(ResultStatus.BAD_REQUEST.getCode(), message, INVALID_REQUEST_CODE, null);
    }
}
