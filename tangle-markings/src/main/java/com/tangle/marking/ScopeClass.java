package com.tangle.marking;

/**
 * Scope class of a name. {@link #FREE} is only meaningful for indirect accesses.
 */
public enum ScopeClass {
    LOCAL("local", 'l'),
    NONLOCAL("nonlocal", 'n'),
    GLOBAL("global", 'g'),
    UNKNOWN("unknown", 'u'),
    FREE("free", 'f');

    private final String tag;
    private final char code;

    ScopeClass(String tag, char code) {
        this.tag = tag;
        this.code = code;
    }

    public String getTag() {
        return tag;
    }

    /** One-letter code used by interactive updates. */
    public char getCode() {
        return code;
    }

    /**
     * Parses a one-letter code or a full tag.
     *
     * @throws IllegalArgumentException if unrecognised
     */
    public static ScopeClass fromValue(String value) {
        if (value != null) {
            String v = value.trim();
            for (ScopeClass s : values()) {
                if (s.tag.equals(v) || (v.length() == 1 && v.charAt(0) == s.code)) return s;
            }
        }
        throw new IllegalArgumentException("Unknown scope class: " + value);
    }

    @Override
    public String toString() {
        return tag;
    }
}
