package com.codeabbrev.core.syntax;

/**
 * Statement kinds that own nested statement sequences and count towards
 * nesting depth.
 */
public enum BlockKind {
    FUNCTION_DEF("FunctionDef"),
    CLASS_DEF("ClassDef"),
    IF("If"),
    WHILE("While"),
    FOR("For"),
    TRY("Try"),
    WITH("With");

    private final String displayName;

    BlockKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() { return displayName; }
}
