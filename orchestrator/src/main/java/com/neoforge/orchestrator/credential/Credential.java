package com.neoforge.orchestrator.credential;

/**
 * One API key. The secret never appears in {@link #toString()} or logs.
 */
public record Credential(String secret) {

    public Credential {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Credential secret must not be blank");
        }
    }

    /** First 8 and last 4 characters, e.g. "gsk_abcd...wxyz". */
    public String masked() {
        if (secret.length() <= 12) {
            return "****" + secret.substring(Math.max(0, secret.length() - 2));
        }
        return secret.substring(0, 8) + "..." + secret.substring(secret.length() - 4);
    }

    @Override
    public String toString() {
        return "Credential[" + masked() + "]";
    }
}
