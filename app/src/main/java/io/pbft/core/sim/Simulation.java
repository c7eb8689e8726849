package io.pbft.core.sim;

import io.pbft.core.ledger.Ledger;
import io.pbft.core.metrics.ConsensusMetrics;
import io.pbft.core.node.Delivery;
import io.pbft.core.node.Node;
import io.pbft.core.protocol.Block;
import io.pbft.core.protocol.PbftMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Single-threaded driver for one block round.
 *
 * Builds and fully connects the nodes, injects one PrePrepare per node for the leader's proposal,
 * then delivers queued messages one at a time until nothing is left. Delivery is FIFO unless
 * {@link SimulationConfig#shuffleDelivery} is set, in which case the next message is picked at
 * random (seeded when {@link SimulationConfig#seed} is given).
 */
public final class Simulation {
    private static final Logger LOG = Logger.getLogger(Simulation.class.getName());

    private record Envelope(int to, PbftMessage message) {}

    private final SimulationConfig config;
    private final ConsensusMetrics metrics;
    private final SimulationListener listener;
    private final Map<Integer, Node> nodes = new TreeMap<>();
    private final List<Envelope> pending = new ArrayList<>();
    private final Random order;
    private boolean ran;

    private Simulation(SimulationConfig config, ConsensusMetrics metrics, SimulationListener listener) {
        this.config = config;
        this.metrics = metrics;
        this.listener = listener;
        this.order = !config.shuffleDelivery ? null
                : config.seed != null ? new Random(config.seed) : new Random();
        for (Node node : Roster.build(config)) {
            nodes.put(node.id(), node);
        }
    }

    /**
     * @throws io.pbft.core.consensus.ConfigurationException before any node is built if the config is invalid
     */
    public static Simulation create(SimulationConfig config) {
        return create(config, new ConsensusMetrics(), SimulationListener.NONE);
    }

    public static Simulation create(SimulationConfig config, ConsensusMetrics metrics, SimulationListener listener) {
        Objects.requireNonNull(config, "config").validate();
        return new Simulation(config,
                Objects.requireNonNull(metrics, "metrics"),
                listener == null ? SimulationListener.NONE : listener);
    }

    /** Run the round to quiescence. A simulation can only be run once. */
    public SimulationReport run() {
        if (ran) {
            throw new IllegalStateException("Simulation already ran");
        }
        ran = true;
        SimulationReport report = metrics.recordRound(this::runRound);
        listener.onFinished(report);
        return report;
    }

    private SimulationReport runRound() {
        listener.onRoster(List.copyOf(nodes.values()));
        connectAll();

        Node leader = nodes.get(nodes.values().iterator().next().consensus().leader());
        Ledger leaderLedger = leader.ledger();
        Block proposal = Block.create(config.blockData, leaderLedger.tail().orElseThrow().hash());
        LOG.info(() -> "Leader for view " + config.view + " is node " + leader.id() + "; proposing " + proposal);
        listener.onProposal(proposal, leader.id(), config.view);

        // Every node sees the proposal before any vote is delivered.
        for (Integer id : new ArrayList<>(nodes.keySet())) {
            deliver(new Envelope(id, PbftMessage.prePrepare(proposal, leader.id())));
        }
        pump();

        LOG.info(() -> "Round finished: " + metrics.deliveredCount() + " delivered, "
                + metrics.droppedCount() + " dropped, " + metrics.committedCount() + " commits");
        return SimulationReport.from(config, leader.id(), proposal.hash(), nodes.values(), metrics);
    }

    private void connectAll() {
        for (Integer from : new ArrayList<>(nodes.keySet())) {
            Node node = nodes.get(from);
            for (Integer to : nodes.keySet()) {
                if (Roster.linked(config, from, to)) {
                    int target = to;
                    node = node.connect(target, message -> pending.add(new Envelope(target, message)));
                }
            }
            nodes.put(from, node);
        }
    }

    private void pump() {
        int deliveries = 0;
        while (!pending.isEmpty()) {
            if (++deliveries > config.maxDeliveries) {
                throw new IllegalStateException("Round did not quiesce within " + config.maxDeliveries + " deliveries");
            }
            deliver(next());
        }
    }

    private void deliver(Envelope envelope) {
        Node before = nodes.get(envelope.to());
        Delivery delivery = before.deliver(envelope.message());
        Node after = delivery.node();
        nodes.put(after.id(), after);
        metrics.recordDelivered(envelope.message().type());

        int dropped = delivery.outbound().size() - after.dispatch(delivery.outbound());
        if (dropped > 0) {
            metrics.recordDropped(dropped);
            listener.onDropped(after.id(), dropped);
        }
        observe(before, after, listener, metrics);
    }

    private Envelope next() {
        if (order == null) {
            return pending.remove(0);
        }
        Collections.swap(pending, order.nextInt(pending.size()), pending.size() - 1);
        return pending.remove(pending.size() - 1);
    }

    /** Report phase changes and ledger growth between two snapshots of the same node. */
    static void observe(Node before, Node after, SimulationListener listener, ConsensusMetrics metrics) {
        if (before.phase() != after.phase()) {
            listener.onPhaseChange(after.id(), before.phase(), after.phase());
        }
        if (after.ledger().size() > before.ledger().size()) {
            metrics.recordCommitted();
            listener.onCommitted(after.id(), after.ledger().tail().orElseThrow(), after.ledger().size() - 1);
        }
    }

    public Map<Integer, Node> nodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public SimulationConfig config() {
        return config;
    }
}
