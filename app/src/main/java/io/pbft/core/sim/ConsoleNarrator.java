package io.pbft.core.sim;

import io.pbft.core.consensus.Phase;
import io.pbft.core.node.Node;
import io.pbft.core.protocol.Block;
import io.pbft.core.protocol.Hashes;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/** Phase-by-phase console narration of a round. Colours are optional ANSI escapes. */
public final class ConsoleNarrator implements SimulationListener {
    private static final String RESET = "\u001B[0m";
    private static final String RED = "\u001B[31m";
    private static final String GREEN = "\u001B[32m";
    private static final String YELLOW = "\u001B[33m";
    private static final String BLUE = "\u001B[34m";
    private static final String MAGENTA = "\u001B[35m";
    private static final String CYAN = "\u001B[36m";

    private final PrintStream out;
    private final boolean color;
    private List<Node> roster = List.of();

    public ConsoleNarrator(PrintStream out, boolean color) {
        this.out = Objects.requireNonNull(out, "out");
        this.color = color;
    }

    @Override
    public synchronized void onRoster(List<Node> nodes) {
        this.roster = List.copyOf(nodes);
        out.println(paint(YELLOW, "\n--- Byzantine node information ---"));
        for (Node node : nodes) {
            if (node.isByzantine()) {
                out.println(paint(RED, "Node " + node.id() + " is a byzantine node (" + node.behavior().mode() + ")."));
            } else {
                out.println("Node " + node.id() + " is an honest node.");
            }
        }
    }

    @Override
    public synchronized void onProposal(Block proposal, int leaderId, long view) {
        banner(GREEN, "Pre-Prepare phase: " + proposal.dataAsString());
        out.println("View " + view + ", leader is node " + leaderId + ", block " + Hashes.shortHex(proposal.hash()));
        for (Node node : roster) {
            out.println("Node " + node.id() + " receives the block: " + proposal.dataAsString());
        }
    }

    @Override
    public synchronized void onPhaseChange(int nodeId, Phase from, Phase to) {
        switch (to) {
            case PREPARED:
                out.println(paint(BLUE, "Node " + nodeId + " reached the prepare quorum"));
                break;
            case COMMITTED:
                out.println(paint(MAGENTA, "Node " + nodeId + " reached the commit quorum"));
                break;
            default:
                out.println("Node " + nodeId + ": " + from + " -> " + to);
        }
    }

    @Override
    public synchronized void onCommitted(int nodeId, Block block, int height) {
        out.println(paint(MAGENTA, "Node " + nodeId + " appended " + block.dataAsString()
                + " (" + Hashes.shortHex(block.hash()) + ") at height " + height));
    }

    @Override
    public synchronized void onDropped(int nodeId, int count) {
        out.println(paint(RED, "Node " + nodeId + ": " + count + " message(s) dropped"));
    }

    @Override
    public synchronized void onFinished(SimulationReport report) {
        banner(CYAN, "Checking final consensus");
        for (NodeOutcome node : report.nodes()) {
            String label = "Node " + node.id() + (node.byzantine() ? " [byzantine]" : "");
            out.println(paint(node.byzantine() ? RED : MAGENTA, label)
                    + " phase=" + node.phase()
                    + " height=" + node.ledgerHeight()
                    + " chainValid=" + node.chainValid()
                    + " blocks=" + node.blockData());
        }
        out.println();
        out.println("Quorum threshold: " + report.quorumThreshold()
                + " | honest agreement: " + report.honestAgreement()
                + " | proposal committed by all honest: " + report.proposalCommittedByAllHonest()
                + " | foreign blocks in honest ledgers: " + report.foreignBlocksInHonestLedgers());
    }

    private void banner(String colour, String title) {
        String rule = "-".repeat(title.length() + 6);
        out.println(paint(colour, "\n" + rule));
        out.println(paint(colour, "-- " + title + " --"));
        out.println(paint(colour, rule));
    }

    private String paint(String colour, String text) {
        return color ? colour + text + RESET : text;
    }
}
