package io.pbft.core.p2p;

import io.pbft.core.protocol.PbftMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Known peers of one node and the handles used to reach them.
 *
 * A peer can be known without a handle (disconnected); sends to it are dropped and logged.
 * Immutable: {@link #connect} returns a new directory.
 */
public final class PeerDirectory {
    private static final Logger LOG = Logger.getLogger(PeerDirectory.class.getName());

    private final int selfId;
    private final Set<Integer> knownPeers;
    private final Map<Integer, PeerHandle> handles;

    private PeerDirectory(int selfId, Set<Integer> knownPeers, Map<Integer, PeerHandle> handles) {
        this.selfId = selfId;
        this.knownPeers = knownPeers;
        this.handles = handles;
    }

    /** Directory that knows ids 1..totalNodes, none of them connected yet. */
    public static PeerDirectory initial(int selfId, int totalNodes) {
        Set<Integer> known = new TreeSet<>();
        for (int id = 1; id <= totalNodes; id++) {
            known.add(id);
        }
        return new PeerDirectory(selfId, Collections.unmodifiableSet(known), Collections.emptyMap());
    }

    /** Register or overwrite one peer. A null handle marks the peer disconnected. */
    public PeerDirectory connect(int peerId, PeerHandle handle) {
        Set<Integer> known = knownPeers;
        if (!known.contains(peerId)) {
            Set<Integer> copy = new TreeSet<>(knownPeers);
            copy.add(peerId);
            known = Collections.unmodifiableSet(copy);
        }
        Map<Integer, PeerHandle> copy = new HashMap<>(handles);
        if (handle == null) {
            copy.remove(peerId);
        } else {
            copy.put(peerId, handle);
        }
        return new PeerDirectory(selfId, known, Collections.unmodifiableMap(copy));
    }

    /**
     * Deliver one message to one peer.
     * @return false when the peer is unknown, disconnected, or its handle failed; the message is dropped
     */
    public boolean send(int peerId, PbftMessage message) {
        PeerHandle handle = handles.get(peerId);
        if (handle == null) {
            LOG.warning(() -> "Node " + peerId + " disconnected. Message " + message + " from node " + selfId + " dropped.");
            return false;
        }
        try {
            handle.deliver(message);
            return true;
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Delivery of " + message + " from node " + selfId + " to node " + peerId + " failed", e);
            return false;
        }
    }

    /** Every known peer except this node, in ascending id order. */
    public List<Integer> others() {
        List<Integer> out = new ArrayList<>(knownPeers.size());
        for (Integer id : knownPeers) {
            if (id != selfId) out.add(id);
        }
        return out;
    }

    public Optional<PeerHandle> handle(int peerId) {
        return Optional.ofNullable(handles.get(peerId));
    }

    public boolean isConnected(int peerId) {
        return handles.containsKey(peerId);
    }

    public int selfId() { return selfId; }
    public Set<Integer> knownPeers() { return knownPeers; }
    public int connectedCount() { return handles.size(); }

    @Override public String toString() {
        return "PeerDirectory{self=" + selfId + ", known=" + knownPeers + ", connected=" + new TreeSet<>(handles.keySet()) + "}";
    }
}
