package com.tangle.tree.node;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.Map;

/**
 * Fixed set of node kinds a front end may supply. Structured kinds carry the tag of the
 * Python AST class they mirror; {@link #NODE_LIST}, {@link #EMPTY} and {@link #ATOMIC} describe
 * the non-structured shapes. JSON uses the tag as string; an unknown tag is rejected with
 * {@link UnknownNodeKindException} rather than mapped to a catch-all value.
 */
public enum NodeKind {
    MODULE("Module", NodeGroup.ROOT),
    INTERACTIVE("Interactive", NodeGroup.ROOT),
    EXPRESSION("Expression", NodeGroup.ROOT),

    FUNCTION_DEF("FunctionDef", NodeGroup.STATEMENT, true),
    CLASS_DEF("ClassDef", NodeGroup.STATEMENT, true),
    RETURN("Return", NodeGroup.STATEMENT),
    DELETE("Delete", NodeGroup.STATEMENT),
    ASSIGN("Assign", NodeGroup.STATEMENT),
    AUG_ASSIGN("AugAssign", NodeGroup.STATEMENT),
    FOR("For", NodeGroup.STATEMENT, true),
    WHILE("While", NodeGroup.STATEMENT, true),
    IF("If", NodeGroup.STATEMENT, true),
    WITH("With", NodeGroup.STATEMENT, true),
    RAISE("Raise", NodeGroup.STATEMENT),
    TRY_EXCEPT("TryExcept", NodeGroup.STATEMENT, true),
    TRY_FINALLY("TryFinally", NodeGroup.STATEMENT, true),
    ASSERT("Assert", NodeGroup.STATEMENT),
    IMPORT("Import", NodeGroup.STATEMENT),
    IMPORT_FROM("ImportFrom", NodeGroup.STATEMENT),
    GLOBAL("Global", NodeGroup.STATEMENT),
    NONLOCAL("Nonlocal", NodeGroup.STATEMENT),
    EXPR("Expr", NodeGroup.STATEMENT),
    PASS("Pass", NodeGroup.STATEMENT),
    BREAK("Break", NodeGroup.STATEMENT),
    CONTINUE("Continue", NodeGroup.STATEMENT),

    BOOL_OP("BoolOp", NodeGroup.EXPRESSION),
    BIN_OP("BinOp", NodeGroup.EXPRESSION),
    UNARY_OP("UnaryOp", NodeGroup.EXPRESSION),
    LAMBDA("Lambda", NodeGroup.EXPRESSION),
    IF_EXP("IfExp", NodeGroup.EXPRESSION),
    DICT("Dict", NodeGroup.EXPRESSION),
    SET("Set", NodeGroup.EXPRESSION),
    LIST_COMP("ListComp", NodeGroup.EXPRESSION),
    SET_COMP("SetComp", NodeGroup.EXPRESSION),
    DICT_COMP("DictComp", NodeGroup.EXPRESSION),
    GENERATOR_EXP("GeneratorExp", NodeGroup.EXPRESSION),
    YIELD("Yield", NodeGroup.EXPRESSION),
    COMPARE("Compare", NodeGroup.EXPRESSION),
    CALL("Call", NodeGroup.EXPRESSION),
    NUM("Num", NodeGroup.EXPRESSION),
    STR("Str", NodeGroup.EXPRESSION),
    BYTES("Bytes", NodeGroup.EXPRESSION),
    ELLIPSIS("Ellipsis", NodeGroup.EXPRESSION),
    ATTRIBUTE("Attribute", NodeGroup.EXPRESSION),
    SUBSCRIPT("Subscript", NodeGroup.EXPRESSION),
    STARRED("Starred", NodeGroup.EXPRESSION),
    NAME("Name", NodeGroup.EXPRESSION),
    LIST("List", NodeGroup.EXPRESSION),
    TUPLE("Tuple", NodeGroup.EXPRESSION),

    LOAD("Load", NodeGroup.CONTEXT),
    STORE("Store", NodeGroup.CONTEXT),
    DEL("Del", NodeGroup.CONTEXT),
    AUG_LOAD("AugLoad", NodeGroup.CONTEXT),
    AUG_STORE("AugStore", NodeGroup.CONTEXT),
    PARAM("Param", NodeGroup.CONTEXT),

    SLICE("Slice", NodeGroup.SLICE),
    EXT_SLICE("ExtSlice", NodeGroup.SLICE),
    INDEX("Index", NodeGroup.SLICE),

    AND("And", NodeGroup.OPERATOR),
    OR("Or", NodeGroup.OPERATOR),
    ADD("Add", NodeGroup.OPERATOR),
    SUB("Sub", NodeGroup.OPERATOR),
    MULT("Mult", NodeGroup.OPERATOR),
    DIV("Div", NodeGroup.OPERATOR),
    MOD("Mod", NodeGroup.OPERATOR),
    POW("Pow", NodeGroup.OPERATOR),
    L_SHIFT("LShift", NodeGroup.OPERATOR),
    R_SHIFT("RShift", NodeGroup.OPERATOR),
    BIT_OR("BitOr", NodeGroup.OPERATOR),
    BIT_XOR("BitXor", NodeGroup.OPERATOR),
    BIT_AND("BitAnd", NodeGroup.OPERATOR),
    FLOOR_DIV("FloorDiv", NodeGroup.OPERATOR),
    INVERT("Invert", NodeGroup.OPERATOR),
    NOT("Not", NodeGroup.OPERATOR),
    U_ADD("UAdd", NodeGroup.OPERATOR),
    U_SUB("USub", NodeGroup.OPERATOR),
    EQ("Eq", NodeGroup.OPERATOR),
    NOT_EQ("NotEq", NodeGroup.OPERATOR),
    LT("Lt", NodeGroup.OPERATOR),
    LT_E("LtE", NodeGroup.OPERATOR),
    GT("Gt", NodeGroup.OPERATOR),
    GT_E("GtE", NodeGroup.OPERATOR),
    IS("Is", NodeGroup.OPERATOR),
    IS_NOT("IsNot", NodeGroup.OPERATOR),
    IN("In", NodeGroup.OPERATOR),
    NOT_IN("NotIn", NodeGroup.OPERATOR),

    COMPREHENSION("comprehension", NodeGroup.HELPER),
    EXCEPT_HANDLER("ExceptHandler", NodeGroup.HELPER, true),
    ARGUMENTS("arguments", NodeGroup.HELPER),
    ARG("arg", NodeGroup.HELPER),
    KEYWORD("keyword", NodeGroup.HELPER),
    ALIAS("alias", NodeGroup.HELPER),

    /** Ordered list of nodes (statement bodies, argument lists, ...). */
    NODE_LIST("list", NodeGroup.STRUCTURAL),
    /** Missing optional child. */
    EMPTY("empty", NodeGroup.STRUCTURAL),
    /** String, integer, float or byte-sequence leaf. */
    ATOMIC("atomic", NodeGroup.STRUCTURAL);

    private static final Map<String, NodeKind> BY_TAG = new HashMap<>();

    static {
        for (NodeKind k : values()) {
            BY_TAG.put(k.tag, k);
        }
    }

    private final String tag;
    private final NodeGroup group;
    private final boolean compound;

    NodeKind(String tag, NodeGroup group) {
        this(tag, group, false);
    }

    NodeKind(String tag, NodeGroup group, boolean compound) {
        this.tag = tag;
        this.group = group;
        this.compound = compound;
    }

    /** Tag used by the front end and in JSON (e.g. "FunctionDef", "list"). */
    @JsonValue
    public String getTag() {
        return tag;
    }

    public NodeGroup getGroup() {
        return group;
    }

    /** True if the kind carries a nested body (body, orelse, finalbody or handlers). */
    public boolean isCompound() {
        return compound;
    }

    public boolean isStatement() {
        return group == NodeGroup.STATEMENT;
    }

    public boolean isExpression() {
        return group == NodeGroup.EXPRESSION;
    }

    /** Shape of nodes of this kind. Every kind except the three structural ones is {@link NodeCategory#STRUCTURED}. */
    public NodeCategory getCategory() {
        return switch (this) {
            case NODE_LIST -> NodeCategory.LIST;
            case EMPTY -> NodeCategory.EMPTY;
            case ATOMIC -> NodeCategory.ATOMIC;
            default -> NodeCategory.STRUCTURED;
        };
    }

    /**
     * Resolves a front-end tag (exact match, e.g. "Assign") or enum name (e.g. "AUG_ASSIGN").
     *
     * @throws UnknownNodeKindException if the value names no kind
     */
    @JsonCreator
    public static NodeKind fromValue(String value) {
        if (value == null || value.isBlank()) throw new UnknownNodeKindException(String.valueOf(value));
        String trimmed = value.trim();
        NodeKind byTag = BY_TAG.get(trimmed);
        if (byTag != null) return byTag;
        for (NodeKind k : values()) {
            if (k.name().equals(trimmed)) return k;
        }
        throw new UnknownNodeKindException(trimmed);
    }
}
