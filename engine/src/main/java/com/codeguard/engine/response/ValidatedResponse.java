package com.codeguard.engine.response;

/**
 * Code that passed the response gate.
 *
 * @param code           the code to release, with any missing def colons restored
 * @param source         where the code was taken from
 * @param colonsRepaired true when the gate had to insert missing colons
 */
public record ValidatedResponse(String code, CodeSource source, boolean colonsRepaired) {}
