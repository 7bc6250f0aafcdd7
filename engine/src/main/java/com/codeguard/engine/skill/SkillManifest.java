package com.codeguard.engine.skill;

/**
 * Identity and documentation contract for a skill.
 *
 * @param name        Unique identifier used to look up the skill in the registry
 *                    and to call it over HTTP (e.g. "rename_symbol").
 * @param version     Semantic version; lets callers detect incompatible changes.
 * @param signature   Python-style signature shown to the agent in its tool
 *                    documentation, e.g. "add_import(snippet: str, module: str) -> str".
 * @param description One-sentence docstring injected verbatim into the tool documentation.
 * @param kind        Whether the skill edits the snippet or only reports on it.
 */
public record SkillManifest(
        String    name,
        String    version,
        String    signature,
        String    description,
        SkillKind kind) {}
