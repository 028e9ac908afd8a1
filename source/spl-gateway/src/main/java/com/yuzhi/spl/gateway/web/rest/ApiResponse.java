package com.yuzhi.spl.gateway.web.rest;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope for every gateway response.
 *
 * @param status {@link ResultStatus} code
 * @param code optional machine-readable error code, e.g. spl-req-0001
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(int status, String message, String code, T data) {
    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS.getCode();
    }
}
