package com.renflow.renflow_backend.model.domain;

public enum BlockType {
    // Structure
    START,       // entry marker: declares its own label, has no input port
    LABEL,
    JUMP,
    CALL,
    RETURN,

    // Dialogue and text
    SAY,
    NARRATION,
    MENU,
    VOICE,
    CENTER,
    TEXT,

    // Control flow
    IF,          // two outputs: true / false
    ELIF,
    ELSE,
    WHILE,       // one output: loop body
    FOR,         // one output: loop body

    // Stage
    SCENE,
    SHOW,
    HIDE,
    IMAGE,       // definition only
    PAUSE,
    TRANSITION,
    WITH,

    // Audio
    SOUND,
    MUSIC,
    STOP_MUSIC,
    STOP_SOUND,
    QUEUE_MUSIC,
    QUEUE_SOUND,

    // Variables and code
    SET_VAR,
    DEFAULT,
    DEFINE,
    PYTHON,

    // Definitions
    CHARACTER,   // definition only
    STYLE;

    /** Rendered in the definitions preamble, never inline in a scene flow. */
    public boolean isDefinitionOnly() {
        return this == IMAGE || this == CHARACTER;
    }

    /** Blocks whose successors are rendered as nested bodies instead of a sequential continuation. */
    public boolean isBranching() {
        return this == IF || this == WHILE || this == FOR;
    }

    public boolean hasInputPort() {
        return this != START;
    }
}
