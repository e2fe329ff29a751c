package com.tangle.marking;

import java.util.Optional;

/**
 * Ways a statement may transfer control out of the normal linear sequence.
 */
public enum BreakType {
    EXCEPT("except"),
    RETURN("return"),
    BREAK("break"),
    CONTINUE("continue"),
    YIELD("yield");

    private final String tag;

    BreakType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /** Break type for the given tag, or empty if the tag is not recognised. */
    public static Optional<BreakType> parse(String tag) {
        if (tag == null) return Optional.empty();
        for (BreakType t : values()) {
            if (t.tag.equals(tag.trim())) return Optional.of(t);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return tag;
    }
}
