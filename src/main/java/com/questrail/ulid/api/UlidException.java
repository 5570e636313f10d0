package com.questrail.ulid.api;

import java.util.Objects;

/**
 * Indicates that a ULID could not be constructed, decoded or generated.
 *
 * <p>All failures are synchronous and final: nothing in this library retries,
 * and no partially built value is ever returned alongside this exception.</p>
 */
public final class UlidException extends IllegalArgumentException
{
    private static final long serialVersionUID = 1L;

    private final UlidErrorKind kind;

    public UlidException(UlidErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public UlidException(UlidErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /**
     * Returns the failure classification.
     */
    public UlidErrorKind kind() {
        return kind;
    }

    @Override
    public String toString() {
        return "UlidException[" + kind + "]: " + getMessage();
    }
}
