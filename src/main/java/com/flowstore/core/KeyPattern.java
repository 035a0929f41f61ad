package com.flowstore.core;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Glob-style key pattern. {@code *} matches any substring, {@code ?} matches a
 * single character, everything else is literal. Matching is anchored on the
 * whole key.
 */
public final class KeyPattern {

    private static final KeyPattern ALL = new KeyPattern("*", null);

    private final String glob;
    private final Pattern regex; // null matches everything

    private KeyPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    /**
     * Compile a glob pattern.
     *
     * @param glob the pattern; null or empty is treated as {@code *}
     * @return the compiled pattern
     */
    public static KeyPattern compile(String glob) {
        if (glob == null || glob.isEmpty() || "*".equals(glob)) {
            return ALL;
        }
        StringBuilder sb = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    sb.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                sb.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            sb.append(Pattern.quote(literal.toString()));
        }
        return new KeyPattern(glob, Pattern.compile(sb.toString(), Pattern.DOTALL));
    }

    public boolean matches(String key) {
        Objects.requireNonNull(key, "key");
        return regex == null || regex.matcher(key).matches();
    }

    public boolean matchesAll() {
        return regex == null;
    }

    @Override
    public String toString() {
        return glob;
    }
}
