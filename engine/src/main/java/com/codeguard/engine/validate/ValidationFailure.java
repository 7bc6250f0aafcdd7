package com.codeguard.engine.validate;

import com.codeguard.engine.GuardException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A snippet parsed but broke one or more static rules.
 */
public class ValidationFailure extends GuardException {

    private final List<Finding> findings;

    public ValidationFailure(List<Finding> findings) {
        super(Kind.VALIDATION, findings.stream().map(Finding::toString).collect(Collectors.joining("; ")));
        this.findings = List.copyOf(findings);
    }

    public List<Finding> getFindings() { return findings; }
}
