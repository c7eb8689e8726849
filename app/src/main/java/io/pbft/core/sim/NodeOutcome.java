package io.pbft.core.sim;

import io.pbft.core.consensus.Phase;
import io.pbft.core.node.FaultMode;
import io.pbft.core.node.Node;
import io.pbft.core.protocol.Block;

import java.util.ArrayList;
import java.util.List;

/** Final, read-only view of one node after a round. */
public record NodeOutcome(int id,
                          boolean byzantine,
                          FaultMode mode,
                          Phase phase,
                          int ledgerHeight,
                          List<String> blockHashes,
                          List<String> blockData,
                          boolean chainValid) {

    public NodeOutcome {
        blockHashes = List.copyOf(blockHashes);
        blockData = List.copyOf(blockData);
    }

    public static NodeOutcome from(Node node) {
        List<String> data = new ArrayList<>(node.ledger().size());
        for (Block b : node.ledger().blocks()) {
            data.add(b.dataAsString());
        }
        return new NodeOutcome(
                node.id(),
                node.isByzantine(),
                node.behavior().mode(),
                node.phase(),
                node.ledger().size(),
                node.ledger().hashes(),
                data,
                node.ledger().isValid());
    }
}
