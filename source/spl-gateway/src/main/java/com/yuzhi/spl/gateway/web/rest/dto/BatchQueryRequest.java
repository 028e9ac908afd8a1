package com.yuzhi.spl.gateway.web.rest.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

public record BatchQueryRequest(@NotNull @Valid List<TargetRequest> targets, TimeRangeRequest range, Map<String, Object> scopedVars) {}
