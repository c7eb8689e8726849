package io.pbft.core.consensus;

/** Round phases in protocol order. */
public enum Phase {
    INITIAL,
    PREPREPARED,
    PREPARED,
    COMMITTED;

    /** The later of the two phases; a round never moves backwards. */
    public Phase advanceTo(Phase next) {
        return next.compareTo(this) > 0 ? next : this;
    }
}
