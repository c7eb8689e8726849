package io.pbft.core.node;

import java.util.List;
import java.util.Objects;

/** Result of handling one inbound message: the updated node and what it sends next. */
public record Delivery(Node node, List<Outbound> outbound) {
    public Delivery {
        Objects.requireNonNull(node, "node");
        outbound = outbound == null ? List.of() : List.copyOf(outbound);
    }

    public static Delivery of(Node node) {
        return new Delivery(node, List.of());
    }
}
