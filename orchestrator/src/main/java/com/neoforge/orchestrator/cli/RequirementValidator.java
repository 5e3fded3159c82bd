package com.neoforge.orchestrator.cli;

import java.util.Optional;

/**
 * Checks the requirement text before anything is created on disk.
 */
public class RequirementValidator {

    private final int maxLength;

    public RequirementValidator(int maxLength) {
        this.maxLength = maxLength;
    }

    /**
     * @return a message describing the problem, or empty when the requirement is usable
     */
    public Optional<String> problem(String requirement) {
        if (requirement == null || requirement.isBlank()) {
            return Optional.of("Requirement cannot be empty.");
        }
        int length = requirement.strip().length();
        if (length > maxLength) {
            return Optional.of("Requirement too long (max %d chars, got %d).".formatted(maxLength, length));
        }
        return Optional.empty();
    }
}
