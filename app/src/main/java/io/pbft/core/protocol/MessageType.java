package io.pbft.core.protocol;

public enum MessageType {
    PRE_PREPARE,
    PREPARE,
    COMMIT
}
