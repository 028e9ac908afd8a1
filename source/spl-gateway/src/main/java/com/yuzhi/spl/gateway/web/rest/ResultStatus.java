package com.yuzhi.spl.gateway.web.rest;

public enum ResultStatus {
    SUCCESS(200),
    ERROR(-1),
    BAD_REQUEST(400);

    private final int code;

    ResultStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
