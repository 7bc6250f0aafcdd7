package com.codeguard.engine.api;

import com.codeguard.engine.api.dto.ToolsResponse;
import com.codeguard.engine.skill.SkillRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /tools: registered tool names and the documentation block an
 * orchestrator puts in its agent's prompt.
 */
@RestController
public class ToolController {

    private final SkillRegistry skillRegistry;

    public ToolController(SkillRegistry skillRegistry) {
        this.skillRegistry = skillRegistry;
    }

    @GetMapping("/tools")
    public ToolsResponse listTools() {
        return new ToolsResponse(skillRegistry.skillNames(), skillRegistry.buildToolDocumentation());
    }
}
