package com.tangle.branch;

/**
 * Thrown when an entry does not fit a collection's type constraint. The collection is unchanged.
 */
public class BranchTypeViolationException extends IllegalArgumentException {

    private final String collection;
    private final EntryType expected;

    public BranchTypeViolationException(String collection, EntryType expected, String message) {
        super(message);
        this.collection = collection;
        this.expected = expected;
    }

    public String getCollection() {
        return collection;
    }

    public EntryType getExpected() {
        return expected;
    }
}
