package com.neoforge.orchestrator.llm;

/**
 * Failure reported by the model endpoint, classified by how the engine reacts to it.
 */
public class ModelApiException extends RuntimeException {

    public enum Kind {
        /** Per-key rate limit. Recovered by rotating keys and backing off. */
        RATE_LIMITED,
        /** The model produced a tool call the endpoint could not decode. Recovered by a corrective message. */
        MALFORMED_TOOL_CALL,
        /** Anything else. Not retried. */
        FATAL
    }

    private final Kind kind;
    private final int  statusCode;

    public ModelApiException(Kind kind, int statusCode, String message) {
        super(message);
        this.kind       = kind;
        this.statusCode = statusCode;
    }

    public ModelApiException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind       = kind;
        this.statusCode = -1;
    }

    /**
     * Classify an error response. A 429 or a "rate_limit_exceeded" code is a rate
     * limit; a "tool_use_failed" code is a malformed tool call.
     */
    public static ModelApiException fromResponse(int statusCode, String body) {
        String text = body == null ? "" : body;
        Kind kind;
        if (statusCode == 429 || text.contains("rate_limit_exceeded")) {
            kind = Kind.RATE_LIMITED;
        } else if (text.contains("tool_use_failed")) {
            kind = Kind.MALFORMED_TOOL_CALL;
        } else {
            kind = Kind.FATAL;
        }
        return new ModelApiException(kind, statusCode, "Model API error %d: %s".formatted(statusCode, text));
    }

    public Kind kind()       { return kind; }
    public int statusCode()  { return statusCode; }
}
