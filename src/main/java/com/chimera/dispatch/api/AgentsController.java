package com.chimera.dispatch.api;

import com.chimera.core.agent.AgentRegistry;
import com.chimera.core.model.Agent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/agents")
public class AgentsController {

    private final AgentRegistry agentRegistry;

    public AgentsController(AgentRegistry agentRegistry) {
        this.agentRegistry = agentRegistry;
    }

    @GetMapping
    public List<Agent> list() {
        return agentRegistry.list();
    }
}
