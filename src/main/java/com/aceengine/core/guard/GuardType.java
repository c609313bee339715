package com.aceengine.core.guard;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which guard layer decided a {@link GuardResult}.
 *
 * PARSE, AST_EQUIV and CST_APPLY name the first failing layer.
 * ALL means every layer passed; NON_PYTHON is a pass-through for files the
 * guard does not understand; READ means the original could not be read.
 */
public enum GuardType {
    PARSE("parse"),
    AST_EQUIV("ast_equiv"),
    CST_APPLY("cst_apply"),
    ALL("all"),
    NON_PYTHON("non-python"),
    READ("read");

    private final String wireName;

    GuardType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
