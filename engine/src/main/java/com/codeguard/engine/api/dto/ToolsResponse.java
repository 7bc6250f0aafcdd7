package com.codeguard.engine.api.dto;

import java.util.List;

/** Response body for GET /tools. */
public record ToolsResponse(
        List<String> tools,
        String       documentation
) {}
