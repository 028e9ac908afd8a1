package com.yuzhi.spl.gateway.web.rest.dto;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

public record VariableQueryRequest(@NotBlank String queryText, Map<String, Object> scopedVars) {}
