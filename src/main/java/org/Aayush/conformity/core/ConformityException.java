package org.Aayush.conformity.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Conformity contract exception with deterministic reason codes.
 *
 * <p>Messages are prefixed with the reason code, and every failure is classified by
 * {@link ErrorKind} so callers can tell bad input from bad upstream data.</p>
 */
@Getter
@Accessors(fluent = true)
public final class ConformityException extends RuntimeException {
    private final String reasonCode;
    private final ErrorKind errorKind;

    /**
     * Creates a reason-coded conformity failure.
     *
     * @param errorKind failure classification.
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public ConformityException(ErrorKind errorKind, String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind");
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded conformity failure with a cause.
     *
     * @param errorKind failure classification.
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public ConformityException(ErrorKind errorKind, String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind");
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Rejected caller input; raised before any graph access.
     */
    public static ConformityException invalidArgument(String reasonCode, String message) {
        return new ConformityException(ErrorKind.INVALID_ARGUMENT, reasonCode, message);
    }

    /**
     * Malformed or inconsistent data from the snapshot provider or path oracle.
     */
    public static ConformityException upstream(String reasonCode, String message) {
        return new ConformityException(ErrorKind.UPSTREAM_DATA_ERROR, reasonCode, message);
    }

    /**
     * Upstream failure with the provider's own exception attached.
     */
    public static ConformityException upstream(String reasonCode, String message, Throwable cause) {
        return new ConformityException(ErrorKind.UPSTREAM_DATA_ERROR, reasonCode, message, cause);
    }

    /**
     * Guardrail, budget, interruption or worker failure during computation.
     */
    public static ConformityException execution(String reasonCode, String message) {
        return new ConformityException(ErrorKind.EXECUTION_FAILURE, reasonCode, message);
    }

    /**
     * Execution failure with its underlying cause.
     */
    public static ConformityException execution(String reasonCode, String message, Throwable cause) {
        return new ConformityException(ErrorKind.EXECUTION_FAILURE, reasonCode, message, cause);
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

    /**
     * Failure classification.
     */
    public enum ErrorKind {
        /** Caller input violates a request contract. */
        INVALID_ARGUMENT,
        /** Snapshot provider or path oracle returned unusable data. */
        UPSTREAM_DATA_ERROR,
        /** Numeric guardrail, budget, interruption or worker failure. */
        EXECUTION_FAILURE
    }
}
