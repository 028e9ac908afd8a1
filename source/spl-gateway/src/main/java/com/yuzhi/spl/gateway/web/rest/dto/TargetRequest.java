package com.yuzhi.spl.gateway.web.rest.dto;

import jakarta.validation.constraints.NotBlank;

public record TargetRequest(@NotBlank String refId, String queryText, boolean hide) {}
