package com.neoforge.orchestrator.credential;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, immutable set of API keys used round-robin.
 *
 * The pool never drops or disables a key: a rate-limited key is expected to
 * recover after the engine's backoff. Rotation state lives in a
 * {@link RotationCursor}, one per run, so runs never share a cursor.
 */
public final class CredentialPool {

    private static final Logger log = LoggerFactory.getLogger(CredentialPool.class);

    /** Values starting with this prefix are template placeholders, not keys. */
    static final String PLACEHOLDER_PREFIX = "your_";

    private final List<Credential> credentials;

    private CredentialPool(List<Credential> credentials) {
        this.credentials = List.copyOf(credentials);
    }

    /**
     * Read every variable in {@code variables} from {@code source} and keep the usable ones.
     *
     * @throws CredentialConfigurationException if no usable key is found
     */
    public static CredentialPool build(CredentialSource source, List<String> variables) {
        List<Credential> found = new ArrayList<>();
        for (String variable : variables) {
            String raw = source.get(variable);
            if (raw == null) {
                continue;
            }
            String value = raw.strip();
            if (value.isEmpty() || value.startsWith(PLACEHOLDER_PREFIX)) {
                continue;
            }
            found.add(new Credential(value));
        }
        if (found.isEmpty()) {
            throw new CredentialConfigurationException(
                    "No valid API keys found. Set one of " + variables + " (placeholder values are ignored).");
        }
        log.info("API key pool initialized with {} key(s)", found.size());
        for (int i = 0; i < found.size(); i++) {
            log.info("  Key {}: {}", i + 1, found.get(i).masked());
        }
        return new CredentialPool(found);
    }

    public static CredentialPool of(List<Credential> credentials) {
        if (credentials.isEmpty()) {
            throw new CredentialConfigurationException("Credential pool requires at least one key");
        }
        return new CredentialPool(credentials);
    }

    /** Round-robin successor of {@code index}, wrapping to 0. */
    public int nextAfter(int index) {
        return (index + 1) % credentials.size();
    }

    public Credential get(int index) {
        return credentials.get(index);
    }

    public int size() {
        return credentials.size();
    }

    /** A fresh cursor positioned on the first key. */
    public RotationCursor newCursor() {
        return new RotationCursor(this);
    }
}
