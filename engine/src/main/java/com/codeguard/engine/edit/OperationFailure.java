package com.codeguard.engine.edit;

import com.codeguard.engine.GuardException;

/**
 * An editor could not carry out the requested operation: target text absent
 * or ambiguous, malformed diff hunk, invalid index request and the like. The
 * input snippet is never partially modified when this is thrown.
 */
public class OperationFailure extends GuardException {

    public OperationFailure(String message) {
        super(Kind.OPERATION, message);
    }

    public OperationFailure(String message, Throwable cause) {
        super(Kind.OPERATION, message, cause);
    }
}
