package io.pbft.core.node;

import io.pbft.core.consensus.ConsensusState;
import io.pbft.core.consensus.Phase;
import io.pbft.core.ledger.Ledger;
import io.pbft.core.p2p.PeerDirectory;
import io.pbft.core.p2p.PeerHandle;
import io.pbft.core.protocol.PbftMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * One PBFT participant: ledger, consensus state, peer directory and a fixed behavior.
 *
 * Immutable. {@link #deliver(PbftMessage)} is the only state transition; the caller keeps the
 * returned node and routes its outbound messages with {@link #dispatch(List)}.
 */
public final class Node {
    private final int id;
    private final Ledger ledger;
    private final ConsensusState consensus;
    private final PeerDirectory peers;
    private final NodeBehavior behavior;

    private Node(int id, Ledger ledger, ConsensusState consensus, PeerDirectory peers, NodeBehavior behavior) {
        this.id = id;
        this.ledger = ledger;
        this.consensus = consensus;
        this.peers = peers;
        this.behavior = behavior;
    }

    /**
     * Build a node with a genesis ledger and no connected peers.
     * @throws io.pbft.core.consensus.ConfigurationException if {@code totalNodes <= 3f}
     */
    public static Node create(int id, int totalNodes, int f, boolean byzantine) {
        return create(byzantine ? NodeConfig.byzantine(id, totalNodes, f) : NodeConfig.honest(id, totalNodes, f));
    }

    public static Node create(NodeConfig config) {
        return create(config, config.faultMode.newBehavior(new Random()));
    }

    public static Node create(NodeConfig config, NodeBehavior behavior) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(behavior, "behavior");
        return new Node(
                config.nodeId,
                Ledger.genesis(),
                ConsensusState.initial(config.nodeId, config.totalNodes, config.faultTolerance).withView(config.view),
                PeerDirectory.initial(config.nodeId, config.totalNodes),
                behavior);
    }

    public Delivery deliver(PbftMessage message) {
        Objects.requireNonNull(message, "message");
        return behavior.handle(this, message);
    }

    public Node connect(int peerId, PeerHandle handle) {
        return new Node(id, ledger, consensus, peers.connect(peerId, handle), behavior);
    }

    /**
     * Send each outbound message through this node's peer directory.
     * @return how many were handed to a peer; the rest were dropped
     */
    public int dispatch(List<Outbound> outbound) {
        int delivered = 0;
        for (Outbound out : outbound) {
            if (peers.send(out.to(), out.message())) {
                delivered++;
            }
        }
        return delivered;
    }

    /** One copy of {@code message} for every other known peer. */
    public List<Outbound> broadcast(PbftMessage message) {
        List<Integer> targets = peers.others();
        List<Outbound> out = new ArrayList<>(targets.size());
        for (Integer peerId : targets) {
            out.add(new Outbound(peerId, message));
        }
        return out;
    }

    Node withConsensus(ConsensusState next) {
        return new Node(id, ledger, next, peers, behavior);
    }

    Node withLedger(Ledger next) {
        return new Node(id, next, consensus, peers, behavior);
    }

    public int id() { return id; }
    public Ledger ledger() { return ledger; }
    public ConsensusState consensus() { return consensus; }
    public Phase phase() { return consensus.phase(); }
    public PeerDirectory peers() { return peers; }
    public NodeBehavior behavior() { return behavior; }
    public boolean isByzantine() { return behavior.mode().isFaulty(); }

    @Override public String toString() {
        return "Node{id=" + id + ", mode=" + behavior.mode() + ", phase=" + phase() + ", ledger=" + ledger.size() + "}";
    }
}
