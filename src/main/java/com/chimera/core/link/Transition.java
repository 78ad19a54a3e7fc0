package com.chimera.core.link;

import com.chimera.core.model.Fact;
import com.chimera.core.model.Link;

import java.util.List;

/**
 * A terminal transition applied by the {@link LinkStateMachine}.
 *
 * @param link      the link in its new terminal state
 * @param retry     fresh QUEUED link created by the retry policy, null if none
 * @param committed facts committed because the link succeeded
 */
public record Transition(Link link, Link retry, List<Fact> committed) {}
