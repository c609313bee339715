package com.aceengine.core.edit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EditOp {
    REPLACE,
    INSERT,
    DELETE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EditOp fromWireName(String value) {
        return EditOp.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
