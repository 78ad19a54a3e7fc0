package com.chimera.core.scheduler;

import com.chimera.core.model.Link;

import java.util.List;

/**
 * Outcome of one frontier evaluation.
 *
 * @param created   links created by this evaluation, in tie-break order
 * @param blocked   frontier pairs that remain ineligible
 * @param evaluated false when the evaluation was skipped because nothing changed
 */
public record SchedulingResult(List<Link> created, List<BlockedPair> blocked, boolean evaluated) {}
