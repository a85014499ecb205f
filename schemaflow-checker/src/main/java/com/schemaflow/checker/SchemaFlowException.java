package com.schemaflow.checker;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when violations must stop the caller: fail-fast checking, {@link Violations#requireNone(List)},
 * or a checked stage configured to refuse inconsistent input.
 */
public final class SchemaFlowException extends RuntimeException {

    private final List<Violation> violations;

    public SchemaFlowException(List<Violation> violations) {
        super(violations != null && !violations.isEmpty()
                ? violations.stream().map(Violation::toString).collect(Collectors.joining("; "))
                : "Schema flow check failed");
        this.violations = violations != null ? List.copyOf(violations) : List.of();
    }

    public List<Violation> getViolations() {
        return violations;
    }
}
