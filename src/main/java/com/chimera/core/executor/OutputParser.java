package com.chimera.core.executor;

import com.chimera.core.model.OutputRule;

import java.util.List;

/**
 * Turns normalized output into candidate facts according to one {@link OutputRule}.
 * Implementations must be pure.
 */
public interface OutputParser {

    /** Parser tag referenced by {@link OutputRule#parser()}. */
    String name();

    List<ParsedFact> parse(String output, OutputRule rule);
}
