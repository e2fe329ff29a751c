package com.tangle.marking;

import java.util.regex.Pattern;

/**
 * Identifier validation for variable names.
 */
public final class Identifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{Nd}_]*");

    private Identifiers() {
    }

    public static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    /**
     * Returns the name if it is an identifier.
     *
     * @throws InvalidNameException otherwise
     */
    public static String requireIdentifier(String name) {
        if (!isIdentifier(name)) throw new InvalidNameException(name);
        return name;
    }
}
