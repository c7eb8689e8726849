package io.pbft.core.node;

import java.util.Locale;
import java.util.Random;

/** How a node behaves when it receives protocol messages. */
public enum FaultMode {
    /** Follows the protocol. */
    HONEST,
    /** Starts rounds on fabricated blocks and never votes for anyone else's. */
    FORK_SILENTLY,
    /** Per message: obey, vote for a fabricated block, or stay silent. */
    RANDOM;

    public boolean isFaulty() {
        return this != HONEST;
    }

    public NodeBehavior newBehavior(Random random) {
        switch (this) {
            case HONEST:
                return HonestBehavior.INSTANCE;
            case FORK_SILENTLY:
                return ByzantineForkBehavior.INSTANCE;
            case RANDOM:
                return new RandomFaultBehavior(random);
            default:
                throw new IllegalStateException("Unhandled mode " + this);
        }
    }

    /** Accepts enum names and the short CLI forms "honest", "fork", "random". */
    public static FaultMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("fault mode is empty");
        }
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        switch (v) {
            case "honest":
                return HONEST;
            case "fork":
            case "fork_silently":
                return FORK_SILENTLY;
            case "random":
                return RANDOM;
            default:
                throw new IllegalArgumentException("Unknown fault mode: " + value);
        }
    }
}
