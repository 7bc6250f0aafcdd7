package com.codeguard.engine.api.dto;

/** Request body for POST /responses/validate: the agent's final answer, verbatim. */
public record ValidateResponseRequest(String response) {}
