package com.codeguard.engine.guard;

import com.codeguard.engine.GuardException;
import com.codeguard.engine.protect.ProtectedIdentifierViolation;
import com.codeguard.engine.protect.Violation;
import com.codeguard.engine.syntax.SyntaxFailure;
import com.codeguard.engine.validate.Finding;
import com.codeguard.engine.validate.ValidationFailure;

import java.util.List;

/**
 * Outcome of one tool call as the orchestrator sees it: the edit went through,
 * or it was refused and the session's snippet is what it was before.
 */
public interface EditResult {

    boolean applied();

    /**
     * @param snippet the snippet after the call (unchanged for validators)
     * @param result  the validator's report; null for editors
     */
    record Applied(String snippet, String result) implements EditResult {
        @Override public boolean applied() { return true; }
    }

    record Rejected(
            GuardException.Kind kind,
            String              message,
            List<Violation>     violations,
            List<Finding>       findings) implements EditResult {

        public Rejected {
            violations = violations == null ? List.of() : List.copyOf(violations);
            findings   = findings   == null ? List.of() : List.copyOf(findings);
        }

        @Override public boolean applied() { return false; }
    }

    static Rejected rejected(GuardException e) {
        List<Violation> violations = e instanceof ProtectedIdentifierViolation v ? v.getViolations() : List.of();
        List<Finding>   findings   = e instanceof ValidationFailure f ? f.getFindings() : List.of();
        if (e instanceof SyntaxFailure s) {
            findings = List.of(new Finding("syntax", s.getDetail(), s.getLine(), s.getColumn()));
        }
        return new Rejected(e.getKind(), e.getMessage(), violations, findings);
    }
}
