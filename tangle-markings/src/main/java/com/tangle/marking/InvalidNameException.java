package com.tangle.marking;

/**
 * Thrown when a variable name is not a valid identifier.
 */
public class InvalidNameException extends IllegalArgumentException {

    private final String name;

    public InvalidNameException(String name) {
        super("Not a valid identifier: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
