package com.vidnyan.pyguard.domain.traversal;

/**
 * Lexical region kinds pushed by the walker.
 */
public enum FrameKind {
    MODULE,
    FUNCTION,       // def, async def and lambda bodies
    CLASS,
    LOOP,
    GUARDED,        // try body
    HANDLER,        // except body
    FINALLY,
    BRANCH,         // if / elif / else, with and case bodies
    COMPREHENSION;

    /**
     * Frames that count towards control-block nesting depth.
     */
    public boolean isControlBlock() {
        return this == LOOP || this == GUARDED || this == HANDLER || this == FINALLY || this == BRANCH;
    }
}
