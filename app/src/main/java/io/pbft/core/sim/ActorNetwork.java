package io.pbft.core.sim;

import io.pbft.core.consensus.ConsensusRules;
import io.pbft.core.metrics.ConsensusMetrics;
import io.pbft.core.node.Delivery;
import io.pbft.core.node.Node;
import io.pbft.core.node.NodeActor;
import io.pbft.core.p2p.LocalNettyTransport;
import io.pbft.core.p2p.PeerHandle;
import io.pbft.core.protocol.Block;
import io.pbft.core.protocol.PbftMessage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * Concurrent runtime: one {@link NodeActor} per node, messages travel either straight into the
 * peer's mailbox or over an in-VM Netty channel. Every message in transit is counted; a round is
 * over once the count drops to zero.
 */
public final class ActorNetwork implements NodeActor.Listener, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(ActorNetwork.class.getName());

    public enum Transport { IN_MEMORY, NETTY_LOCAL }

    private final SimulationConfig config;
    private final Transport transport;
    private final ConsensusMetrics metrics;
    private final SimulationListener listener;
    private final Map<Integer, NodeActor> actors = new TreeMap<>();
    private final InFlight inFlight = new InFlight();
    private final List<RuntimeException> failures = new CopyOnWriteArrayList<>();
    private LocalNettyTransport netty;
    private boolean ran;

    private ActorNetwork(SimulationConfig config, Transport transport, ConsensusMetrics metrics, SimulationListener listener) {
        this.config = config;
        this.transport = transport;
        this.metrics = metrics;
        this.listener = listener;
        for (Node node : Roster.build(config)) {
            actors.put(node.id(), new NodeActor(node, this));
        }
    }

    public static ActorNetwork create(SimulationConfig config, Transport transport) {
        return create(config, transport, new ConsensusMetrics(), SimulationListener.NONE);
    }

    /**
     * @throws io.pbft.core.consensus.ConfigurationException before any actor starts if the config is invalid
     */
    public static ActorNetwork create(SimulationConfig config, Transport transport,
                                      ConsensusMetrics metrics, SimulationListener listener) {
        Objects.requireNonNull(config, "config").validate();
        return new ActorNetwork(config,
                Objects.requireNonNull(transport, "transport"),
                Objects.requireNonNull(metrics, "metrics"),
                listener == null ? SimulationListener.NONE : listener);
    }

    /**
     * Wire the peers, inject the proposal and wait until every message has been handled.
     * @throws IllegalStateException if the round is still busy after {@code timeout} or a node failed
     */
    public SimulationReport run(Duration timeout) {
        if (ran) {
            throw new IllegalStateException("Network already ran");
        }
        ran = true;
        SimulationReport report = metrics.recordRound(() -> runRound(timeout));
        listener.onFinished(report);
        return report;
    }

    private SimulationReport runRound(Duration timeout) {
        List<Node> roster = new ArrayList<>();
        for (NodeActor actor : actors.values()) roster.add(actor.node());
        listener.onRoster(roster);
        connectAll();

        int leaderId = ConsensusRules.rotateLeader(config.view, config.totalNodes);
        Node leader = actors.get(leaderId).node();
        Block proposal = Block.create(config.blockData, leader.ledger().tail().orElseThrow().hash());
        LOG.info(() -> "Leader for view " + config.view + " is node " + leaderId + "; proposing " + proposal
                + " over " + transport);
        listener.onProposal(proposal, leaderId, config.view);

        for (NodeActor actor : actors.values()) {
            inFlight.increment();
            actor.submit(PbftMessage.prePrepare(proposal, leaderId));
        }
        for (NodeActor actor : actors.values()) {
            actor.start();
        }

        boolean quiet;
        try {
            quiet = inFlight.awaitZero(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the round to finish", e);
        }
        if (!failures.isEmpty()) {
            throw new IllegalStateException(failures.size() + " message(s) failed during the round", failures.get(0));
        }
        if (!quiet) {
            throw new IllegalStateException("Round still had " + inFlight.count() + " message(s) in flight after " + timeout);
        }

        List<Node> finalNodes = new ArrayList<>();
        for (NodeActor actor : actors.values()) finalNodes.add(actor.node());
        return SimulationReport.from(config, leaderId, proposal.hash(), finalNodes, metrics);
    }

    private void connectAll() {
        if (transport == Transport.NETTY_LOCAL) {
            netty = new LocalNettyTransport();
            for (NodeActor actor : actors.values()) {
                netty.listen(actor.id(), actor::submit);
            }
        }
        for (NodeActor from : actors.values()) {
            for (NodeActor to : actors.values()) {
                if (Roster.linked(config, from.id(), to.id())) {
                    from.connect(to.id(), counted(rawHandle(from.id(), to)));
                }
            }
        }
    }

    private PeerHandle rawHandle(int fromId, NodeActor to) {
        if (transport == Transport.NETTY_LOCAL) {
            return netty.connect(fromId, to.id(), message -> inFlight.decrement());
        }
        return to::submit;
    }

    private PeerHandle counted(PeerHandle raw) {
        return message -> {
            inFlight.increment();
            try {
                raw.deliver(message);
            } catch (RuntimeException e) {
                inFlight.decrement();
                throw e;
            }
        };
    }

    @Override
    public void onProcessed(NodeActor actor, PbftMessage message, Node before, Delivery delivery, int dropped) {
        try {
            metrics.recordDelivered(message.type());
            if (dropped > 0) {
                metrics.recordDropped(dropped);
                listener.onDropped(actor.id(), dropped);
            }
            Simulation.observe(before, delivery.node(), listener, metrics);
        } finally {
            inFlight.decrement();
        }
    }

    @Override
    public void onFailed(NodeActor actor, PbftMessage message, RuntimeException error) {
        failures.add(error);
        inFlight.decrement();
    }

    public Map<Integer, NodeActor> actors() {
        return actors;
    }

    @Override
    public void close() {
        for (NodeActor actor : actors.values()) {
            actor.close();
        }
        if (netty != null) {
            netty.close();
        }
    }

    /** Messages accepted for delivery but not yet handled. */
    static final class InFlight {
        private long count;

        synchronized void increment() {
            count++;
        }

        synchronized void decrement() {
            count--;
            if (count <= 0) {
                notifyAll();
            }
        }

        synchronized long count() {
            return count;
        }

        synchronized boolean awaitZero(long timeoutMillis) throws InterruptedException {
            long deadline = System.currentTimeMillis() + timeoutMillis;
            while (count > 0) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    return false;
                }
                wait(remaining);
            }
            return true;
        }
    }
}
