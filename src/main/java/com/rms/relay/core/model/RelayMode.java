package com.rms.relay.core.model;

import java.util.Optional;

/**
 * =====================================================================
 * RelayMode
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Defines the **direction(s)** in which traffic on one local channel is
 * mirrored between the local bus and the cloud channel.
 *
 * DIRECTION MODEL
 * ---------------
 *
 *   TO_LOCAL      : cloud → local bus        (publish handle)
 *   TO_CLOUD      : local bus → cloud        (subscription)
 *   BIDIRECTIONAL : both of the above
 *
 * WIRE CODES
 * ----------
 * The numeric codes are part of the desired-state and persisted-state
 * contract and MUST NOT change:
 *
 *   1 = TO_LOCAL, 2 = TO_CLOUD, 3 = BIDIRECTIONAL
 *
 * MERGE RULE
 * ----------
 * {@link #BIDIRECTIONAL} dominates. Once a channel is bidirectional it is
 * never downgraded implicitly by a later registration.
 */
public enum RelayMode {

    /**
     * Cloud-originated messages are published on the local bus.
     */
    TO_LOCAL(1, "RELAY_MODE_TO_ROS"),

    /**
     * Local-bus messages are forwarded to the cloud channel.
     */
    TO_CLOUD(2, "RELAY_MODE_TO_IOT_HUB"),

    /**
     * Both directions.
     */
    BIDIRECTIONAL(3, "RELAY_MODE_BIDIRECTIONAL");

    private final int code;
    private final String symbol;

    RelayMode(int code, String symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    /** Numeric wire code (1..3). */
    public int code() {
        return code;
    }

    /** Symbolic wire name used by desired-state documents. */
    public String symbol() {
        return symbol;
    }

    /** True when the mode needs a local subscription. */
    public boolean subscribesLocally() {
        return this == TO_CLOUD || this == BIDIRECTIONAL;
    }

    /** True when the mode needs a local publish handle. */
    public boolean publishesLocally() {
        return this == TO_LOCAL || this == BIDIRECTIONAL;
    }

    public static Optional<RelayMode> fromCode(long code) {
        for (RelayMode m : values()) {
            if (m.code == code) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a symbolic wire name or an enum constant name.
     *
     * Matching is exact (case-sensitive) for the wire symbols, which is how
     * the cloud side emits them.
     */
    public static Optional<RelayMode> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        for (RelayMode m : values()) {
            if (m.symbol.equals(symbol) || m.name().equals(symbol)) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }
}
