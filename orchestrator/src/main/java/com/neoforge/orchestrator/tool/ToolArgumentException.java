package com.neoforge.orchestrator.tool;

/**
 * Thrown when a tool call's arguments do not match its parameter list.
 * The dispatcher turns it into an error result for the model.
 */
public class ToolArgumentException extends RuntimeException {

    public ToolArgumentException(String message) {
        super(message);
    }
}
