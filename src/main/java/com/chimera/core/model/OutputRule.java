package com.chimera.core.model;

import java.io.Serializable;

/**
 * Extracts facts from an ability's raw output.
 *
 * @param parser  parser tag: line, regex, key_value or json
 * @param factKey key the extracted values are stored under ("*" lets key_value keep the output's keys)
 * @param pattern regex for the regex parser, dotted path for the json parser; nullable otherwise
 */
public record OutputRule(
    String parser,
    String factKey,
    String pattern
) implements Serializable {}
