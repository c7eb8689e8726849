package io.pbft.core.p2p;

import io.pbft.core.protocol.Block;
import io.pbft.core.protocol.PbftMessage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeerDirectoryTest {

    private final PbftMessage message = PbftMessage.prepare(Block.create("b", 1L, "0"), 1);

    @Test
    void knowsEveryIdButConnectsNone() {
        PeerDirectory peers = PeerDirectory.initial(2, 4);

        assertEquals(List.of(1, 3, 4), peers.others());
        assertEquals(0, peers.connectedCount());
        assertFalse(peers.isConnected(1));
        assertEquals(2, peers.selfId());
    }

    @Test
    void sendReachesConnectedHandle() {
        List<PbftMessage> received = new ArrayList<>();
        PeerDirectory peers = PeerDirectory.initial(1, 4).connect(2, received::add);

        assertTrue(peers.send(2, message));
        assertEquals(List.of(message), received);
    }

    @Test
    void sendToDisconnectedPeerIsDropped() {
        PeerDirectory peers = PeerDirectory.initial(1, 4);

        assertFalse(peers.send(3, message));
        assertFalse(peers.send(99, message));
    }

    @Test
    void failingHandleCountsAsDropped() {
        PeerDirectory peers = PeerDirectory.initial(1, 4).connect(2, m -> {
            throw new IllegalStateException("boom");
        });

        assertFalse(peers.send(2, message));
    }

    @Test
    void connectOverwritesAndNullDisconnects() {
        List<PbftMessage> first = new ArrayList<>();
        List<PbftMessage> second = new ArrayList<>();
        PeerDirectory peers = PeerDirectory.initial(1, 4).connect(2, first::add);
        PeerDirectory replaced = peers.connect(2, second::add);

        replaced.send(2, message);
        assertTrue(first.isEmpty());
        assertEquals(1, second.size());

        PeerDirectory removed = replaced.connect(2, null);
        assertFalse(removed.isConnected(2));
        assertTrue(removed.knownPeers().contains(2));
        assertTrue(replaced.isConnected(2), "original directory is unchanged");
    }

    @Test
    void connectingUnknownIdAddsIt() {
        PeerDirectory peers = PeerDirectory.initial(1, 4).connect(9, m -> { });

        assertTrue(peers.knownPeers().contains(9));
        assertEquals(List.of(2, 3, 4, 9), peers.others());
        assertTrue(peers.handle(9).isPresent());
        assertTrue(peers.handle(2).isEmpty());
    }
}
