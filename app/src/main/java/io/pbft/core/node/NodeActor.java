package io.pbft.core.node;

import io.pbft.core.p2p.PeerHandle;
import io.pbft.core.protocol.PbftMessage;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one {@link Node} on its own single-threaded mailbox. Only the mailbox thread replaces the
 * node, so messages are handled strictly one at a time and no locking is needed around node state.
 *
 * The mailbox is held closed until {@link #start()}, so connects and initial messages can be queued
 * on every actor before any of them runs.
 */
public final class NodeActor implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(NodeActor.class.getName());

    public interface Listener {
        /** Called on the mailbox thread after a message has been handled and its output dispatched. */
        void onProcessed(NodeActor actor, PbftMessage message, Node before, Delivery delivery, int dropped);

        /** Called on the mailbox thread when handling a message threw. */
        void onFailed(NodeActor actor, PbftMessage message, RuntimeException error);
    }

    private final int id;
    private final ExecutorService mailbox;
    private final Listener listener;
    private final CountDownLatch started = new CountDownLatch(1);
    private volatile Node node;

    public NodeActor(Node node, Listener listener) {
        this.node = Objects.requireNonNull(node, "node");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.id = node.id();
        this.mailbox = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "pbft-node-" + id);
            t.setDaemon(true);
            return t;
        });
        mailbox.execute(this::awaitStart);
    }

    public void start() {
        started.countDown();
    }

    private void awaitStart() {
        try {
            started.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warning(() -> "Node " + id + " interrupted before start");
        }
    }

    /** Queued behind any messages already in the mailbox. */
    public void connect(int peerId, PeerHandle handle) {
        mailbox.execute(() -> node = node.connect(peerId, handle));
    }

    public void submit(PbftMessage message) {
        Objects.requireNonNull(message, "message");
        mailbox.execute(() -> process(message));
    }

    private void process(PbftMessage message) {
        Node before = node;
        Delivery delivery;
        try {
            delivery = node.deliver(message);
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Node " + id + " failed to handle " + message, e);
            listener.onFailed(this, message, e);
            return;
        }
        node = delivery.node();
        int sent = node.dispatch(delivery.outbound());
        listener.onProcessed(this, message, before, delivery, delivery.outbound().size() - sent);
    }

    public int id() { return id; }

    /** Latest node snapshot; consistent once the network is quiescent. */
    public Node node() { return node; }

    @Override
    public void close() {
        started.countDown();
        mailbox.shutdown();
        try {
            if (!mailbox.awaitTermination(5, TimeUnit.SECONDS)) {
                mailbox.shutdownNow();
            }
        } catch (InterruptedException e) {
            mailbox.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
