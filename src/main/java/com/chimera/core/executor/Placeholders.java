package com.chimera.core.executor;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code #{key}} placeholder handling for command templates.
 */
public final class Placeholders {

    private static final Pattern PLACEHOLDER = Pattern.compile("#\\{([A-Za-z0-9_.\\-]+)}");

    private Placeholders() {}

    /** Keys referenced by the template, in order of first appearance. */
    public static Set<String> keysIn(String template) {
        var keys = new LinkedHashSet<String>();
        if (template == null) return keys;
        Matcher m = PLACEHOLDER.matcher(template);
        while (m.find()) {
            keys.add(m.group(1));
        }
        return keys;
    }

    public static boolean hasUnresolved(String command) {
        return command != null && PLACEHOLDER.matcher(command).find();
    }

    /**
     * Replaces every placeholder with its value.
     *
     * @throws MissingFactException if a referenced key has no value
     */
    public static String substitute(String template, Map<String, String> values) {
        Matcher m = PLACEHOLDER.matcher(template);
        var sb = new StringBuilder();
        while (m.find()) {
            String key = m.group(1);
            String value = values.get(key);
            if (value == null) {
                throw new MissingFactException(key);
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
