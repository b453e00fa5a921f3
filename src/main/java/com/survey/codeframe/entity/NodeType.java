package com.survey.codeframe.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Taxonomy node kinds and the tree level each one lives on.
 */
public enum NodeType {
    CATEGORY(0),
    THEME(1),
    CODE(2),
    SUBCODE(3);

    private final int level;

    NodeType(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
