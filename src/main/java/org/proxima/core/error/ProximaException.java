package org.proxima.core.error;

import lombok.Getter;

import java.util.Objects;

/**
 * Base contract exception with deterministic reason codes.
 *
 * <p>Callers branch on {@link #getReasonCode()} rather than on message text. Subclasses
 * group reason codes into the failure classes surfaced by the core.</p>
 */
@Getter
public class ProximaException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public ProximaException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public ProximaException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
