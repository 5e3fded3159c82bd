package com.neoforge.orchestrator.credential;

/**
 * Looks up a raw credential value by variable name; returns null when unset.
 */
@FunctionalInterface
public interface CredentialSource {

    String get(String variable);
}
