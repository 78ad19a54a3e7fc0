package com.chimera.core.agent;

import com.chimera.core.model.Agent;

/**
 * Result of registering a beacon with the {@link AgentRegistry}.
 *
 * @param agent   the agent after the beacon was applied
 * @param created true when this beacon was the agent's first contact
 * @param revived true when the agent had been declared DEAD before this beacon
 */
public record Registration(Agent agent, boolean created, boolean revived) {}
