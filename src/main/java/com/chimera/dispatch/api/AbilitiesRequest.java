package com.chimera.dispatch.api;

import java.util.List;

/**
 * Inbound JSON body for PUT /api/v1/operations/{id}/abilities: the complete new ability list.
 */
public record AbilitiesRequest(List<String> abilities) {}
