package com.tangle.branch;

import com.tangle.marking.Identifiers;
import com.tangle.marking.InvalidNameException;
import com.tangle.tree.node.TreeNode;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Simple statement that raises one of {@code exceptionTypes} ({@code raises} true) or is known
 * not to raise. Type names may be dotted, e.g. {@code errors.ParseError}; an empty set means
 * any exception.
 */
public record ExceptionEntry(TreeNode statement, boolean raises, SortedSet<String> exceptionTypes) implements BranchEntry {

    /**
     * @throws InvalidNameException if a type name is not a (dotted) identifier
     */
    public ExceptionEntry {
        Objects.requireNonNull(statement, "statement");
        SortedSet<String> names = new TreeSet<>();
        if (exceptionTypes != null) {
            for (String name : exceptionTypes) names.add(requireTypeName(name));
        }
        exceptionTypes = Collections.unmodifiableSortedSet(names);
    }

    public static ExceptionEntry raising(TreeNode statement, Set<String> exceptionTypes) {
        return new ExceptionEntry(statement, true, new TreeSet<>(exceptionTypes));
    }

    public static ExceptionEntry nonRaising(TreeNode statement) {
        return new ExceptionEntry(statement, false, new TreeSet<>());
    }

    @Override
    public EntryType type() {
        return EntryType.EXCEPTION;
    }

    @Override
    public TreeNode node() {
        return statement;
    }

    private static String requireTypeName(String name) {
        if (name == null) throw new InvalidNameException(null);
        for (String part : name.split("\\.", -1)) {
            if (!Identifiers.isIdentifier(part)) throw new InvalidNameException(name);
        }
        return name;
    }
}
