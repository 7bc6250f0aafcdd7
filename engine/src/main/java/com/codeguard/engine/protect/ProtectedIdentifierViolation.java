package com.codeguard.engine.protect;

import com.codeguard.engine.GuardException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An edit removed (or asked to rename) identifiers the session baseline protects.
 */
public class ProtectedIdentifierViolation extends GuardException {

    private final List<Violation> violations;

    public ProtectedIdentifierViolation(List<Violation> violations) {
        this("edit removes protected identifiers: "
                + violations.stream().map(Violation::toString).collect(Collectors.joining(", ")),
                violations);
    }

    public ProtectedIdentifierViolation(String message, List<Violation> violations) {
        super(Kind.PROTECTED_IDENTIFIER, message);
        this.violations = List.copyOf(violations);
    }

    public List<Violation> getViolations() { return violations; }
}
