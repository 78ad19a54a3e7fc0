package com.chimera.core.agent;

import com.chimera.core.model.Agent;
import com.chimera.core.model.AgentStatus;

/**
 * A liveness transition found by {@link AgentRegistry#sweep}.
 */
public record LivenessChange(Agent agent, AgentStatus previous) {

    public boolean becameDead() {
        return agent.status() == AgentStatus.DEAD;
    }
}
