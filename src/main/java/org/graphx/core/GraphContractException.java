package org.graphx.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Raised when a caller breaks one of the graph contracts named by the {@code REASON_*}
 * constants on the class that throws it.
 *
 * <p>The reason code names which contract failed and is repeated in brackets at the start of
 * the message, e.g. {@code [G2_CAPACITY_EXCEEDED] ...}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class GraphContractException extends RuntimeException {
    private final String reasonCode;

    /**
     * @param reasonCode stable code such as {@code G1_INVALID_KEY_SHAPE}; must be non-blank.
     * @param message what went wrong, without the code.
     */
    public GraphContractException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
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
