package com.chimera.dispatch.api;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/operations.
 *
 * @param name      display name; nullable, defaults to the adversary's name
 * @param adversary adversary profile id
 * @param group     agent group to recruit; nullable, recruits every agent
 * @param facts     seed facts
 */
public record OperationRequest(
    String name,
    String adversary,
    String group,
    Map<String, String> facts
) {}
