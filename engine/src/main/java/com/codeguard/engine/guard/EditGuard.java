package com.codeguard.engine.guard;

import com.codeguard.engine.protect.ProtectedIdentifierViolation;
import com.codeguard.engine.protect.ProtectedSymbolRegistry;
import com.codeguard.engine.protect.Violation;
import com.codeguard.engine.syntax.SyntaxFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * Validate-then-release wrapper around one session's editors.
 *
 * <p>The first snippet that parses arms the baseline. Every edited snippet is
 * then collected again and diffed against it; if anything protected went
 * missing the edit is refused with a {@link ProtectedIdentifierViolation} and
 * the edited text never leaves this class. An edited snippet that does not
 * parse is refused with its {@link SyntaxFailure}.
 */
public class EditGuard {

    private static final Logger log = LoggerFactory.getLogger(EditGuard.class);

    private final ProtectedSymbolRegistry registry;

    public EditGuard(ProtectedSymbolRegistry registry) {
        this.registry = registry;
    }

    public ProtectedSymbolRegistry registry() {
        return registry;
    }

    /**
     * Run {@code edit} on {@code input} and release its result only if it
     * keeps every protected identifier.
     *
     * @throws ProtectedIdentifierViolation when the edit removed protected identifiers
     * @throws SyntaxFailure                when the edited snippet does not parse
     */
    public String apply(String input, Supplier<String> edit) {
        if (!registry.isArmed()) {
            try {
                registry.ensure(input);
            } catch (SyntaxFailure e) {
                // the edit may be the one that fixes it; arm from its output instead
                log.debug("Baseline not armed, input does not parse: {}", e.getMessage());
            }
        }

        String edited = edit.get();

        if (!registry.isArmed()) {
            registry.ensure(edited);
            return edited;
        }
        List<Violation> violations = registry.validate(edited);
        if (!violations.isEmpty()) {
            log.info("Edit refused, {} protected identifier(s) missing: {}", violations.size(), violations);
            throw new ProtectedIdentifierViolation(violations);
        }
        return edited;
    }

    public void reset() {
        registry.reset();
    }
}
