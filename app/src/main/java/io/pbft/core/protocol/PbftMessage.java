package io.pbft.core.protocol;

import java.util.Objects;

/**
 * One protocol message. senderId is the voter for PREPARE/COMMIT;
 * for PRE_PREPARE it is the proposing leader, or 0 when injected by a driver.
 */
public record PbftMessage(MessageType type, Block block, int senderId) {
    public static final int NO_SENDER = 0;

    public PbftMessage {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(block, "block");
    }

    public static PbftMessage prePrepare(Block block) {
        return new PbftMessage(MessageType.PRE_PREPARE, block, NO_SENDER);
    }

    public static PbftMessage prePrepare(Block block, int leaderId) {
        return new PbftMessage(MessageType.PRE_PREPARE, block, leaderId);
    }

    public static PbftMessage prepare(Block block, int senderId) {
        return new PbftMessage(MessageType.PREPARE, block, senderId);
    }

    public static PbftMessage commit(Block block, int senderId) {
        return new PbftMessage(MessageType.COMMIT, block, senderId);
    }

    @Override public String toString() {
        return type + "(" + Hashes.shortHex(block.hash()) + (senderId == NO_SENDER ? "" : ", from=" + senderId) + ")";
    }
}
