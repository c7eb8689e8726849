package io.pbft.core;

import io.pbft.core.consensus.ConfigurationException;
import io.pbft.core.metrics.ConsensusMetrics;
import io.pbft.core.node.FaultMode;
import io.pbft.core.sim.ActorNetwork;
import io.pbft.core.sim.ConsoleNarrator;
import io.pbft.core.sim.Simulation;
import io.pbft.core.sim.SimulationConfig;
import io.pbft.core.sim.SimulationListener;
import io.pbft.core.sim.SimulationReport;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        SimulationConfig config;
        try {
            config = options.toConfig().validate();
        } catch (ConfigurationException e) {
            System.err.println("Configuration error: " + e.getMessage());
            System.exit(1);
            return;
        }
        LOG.info(() -> "Starting PBFT round with " + config + " on runtime " + options.runtime());

        ConsensusMetrics metrics = new ConsensusMetrics();
        SimulationListener listener = options.json()
                ? SimulationListener.NONE
                : new ConsoleNarrator(System.out, options.color());

        SimulationReport report = run(options, config, metrics, listener);

        if (options.json()) {
            System.out.println(report.toJson());
        }
        if (options.printMetrics()) {
            System.out.println("=== Metrics ===\n" + metrics.scrape());
        }
        if (!report.honestAgreement()) {
            LOG.warning("Honest nodes disagree on the ledger");
        }
    }

    static SimulationReport run(CliOptions options, SimulationConfig config,
                                ConsensusMetrics metrics, SimulationListener listener) {
        switch (options.runtime()) {
            case "actors":
            case "netty": {
                ActorNetwork.Transport transport = "netty".equals(options.runtime())
                        ? ActorNetwork.Transport.NETTY_LOCAL
                        : ActorNetwork.Transport.IN_MEMORY;
                try (ActorNetwork network = ActorNetwork.create(config, transport, metrics, listener)) {
                    return network.run(Duration.ofMillis(options.timeoutMillis()));
                }
            }
            default:
                return Simulation.create(config, metrics, listener).run();
        }
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not load logging.properties", e);
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path configFile,
            Integer totalNodes,
            Integer faultTolerance,
            List<Integer> byzantineIds,
            List<Integer> disconnectedIds,
            String blockData,
            Long view,
            FaultMode faultMode,
            Long seed,
            boolean shuffle,
            String runtime,
            long timeoutMillis,
            boolean json,
            boolean color,
            boolean printMetrics
    ) {
        static CliOptions parse(String[] args) {
            Path configFile = null;
            Integer totalNodes = envInt("PBFT_NODES");
            Integer faultTolerance = envInt("PBFT_FAULTY");
            List<Integer> byzantineIds = null;
            List<Integer> disconnectedIds = null;
            String blockData = null;
            Long view = null;
            FaultMode faultMode = null;
            Long seed = null;
            boolean shuffle = false;
            String runtime = "sync";
            long timeoutMillis = 10_000L;
            boolean json = false;
            boolean color = System.getenv("NO_COLOR") == null;
            boolean printMetrics = false;
            boolean showHelp = false;
            String error = null;

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--config=")) {
                            configFile = Path.of(arg.substring("--config=".length()));
                        } else if (arg.startsWith("--nodes=")) {
                            totalNodes = parseInt(arg.substring("--nodes=".length()), "--nodes");
                        } else if (arg.startsWith("--faulty=")) {
                            faultTolerance = parseInt(arg.substring("--faulty=".length()), "--faulty");
                        } else if (arg.startsWith("--byzantine=")) {
                            byzantineIds = parseIds(arg.substring("--byzantine=".length()), "--byzantine");
                        } else if (arg.startsWith("--disconnected=")) {
                            disconnectedIds = parseIds(arg.substring("--disconnected=".length()), "--disconnected");
                        } else if (arg.startsWith("--block-data=")) {
                            blockData = arg.substring("--block-data=".length());
                        } else if (arg.startsWith("--view=")) {
                            view = (long) parseInt(arg.substring("--view=".length()), "--view");
                        } else if (arg.startsWith("--fault-mode=")) {
                            faultMode = FaultMode.parse(arg.substring("--fault-mode=".length()));
                        } else if (arg.startsWith("--seed=")) {
                            seed = parseLong(arg.substring("--seed=".length()), "--seed");
                        } else if (arg.equals("--shuffle")) {
                            shuffle = true;
                        } else if (arg.startsWith("--runtime=")) {
                            runtime = parseRuntime(arg.substring("--runtime=".length()));
                        } else if (arg.startsWith("--timeout-ms=")) {
                            timeoutMillis = parseLong(arg.substring("--timeout-ms=".length()), "--timeout-ms");
                            if (timeoutMillis <= 0) {
                                throw new IllegalArgumentException("--timeout-ms must be > 0");
                            }
                        } else if (arg.equals("--json")) {
                            json = true;
                        } else if (arg.equals("--no-color")) {
                            color = false;
                        } else if (arg.equals("--metrics")) {
                            printMetrics = true;
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        if (error == null) {
                            error = ex.getMessage();
                        }
                    }
                }
            }

            return new CliOptions(showHelp, error, configFile, totalNodes, faultTolerance,
                    byzantineIds == null ? null : List.copyOf(byzantineIds),
                    disconnectedIds == null ? null : List.copyOf(disconnectedIds),
                    blockData, view, faultMode, seed, shuffle, runtime, timeoutMillis, json, color, printMetrics);
        }

        /** File (or defaults) first, then any flag given on the command line. */
        SimulationConfig toConfig() {
            SimulationConfig base = configFile != null ? SimulationConfig.load(configFile) : SimulationConfig.defaultLocal();
            SimulationConfig.Builder builder = base.toBuilder();
            if (totalNodes != null) builder.totalNodes(totalNodes);
            if (faultTolerance != null) {
                builder.faultTolerance(faultTolerance);
                if (byzantineIds == null) {
                    builder.byzantineIds(null);
                }
            }
            if (byzantineIds != null) builder.byzantineIds(byzantineIds);
            if (disconnectedIds != null) builder.disconnectedIds(disconnectedIds);
            if (blockData != null) builder.blockData(blockData);
            if (view != null) builder.view(view);
            if (faultMode != null) builder.faultMode(faultMode);
            if (seed != null) builder.seed(seed);
            if (shuffle) builder.shuffleDelivery(true);
            return builder.build();
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: pbft-ledger [options]

Runs one PBFT round in which a leader proposes a block and every node votes on it.

Options:
  --help, -h                 Show this help message and exit
  --config=<file.json>       Load the simulation config from JSON (flags below override it)
  --nodes=<n>                Total nodes (default 7, env PBFT_NODES)
  --faulty=<f>               Tolerated byzantine nodes; requires n > 3f (default 2, env PBFT_FAULTY)
  --byzantine=<id,id,...>    Byzantine node ids (default: the first f nodes)
  --disconnected=<id,...>    Nodes no peer can reach; their messages are dropped
  --block-data=<text>        Payload of the proposed block (default "Block 1")
  --view=<v>                 View number; the leader is (v mod n) + 1 (default 0)
  --fault-mode=<mode>        fork (default) or random
  --seed=<long>              Seed for random fault choices and shuffled delivery
  --shuffle                  Deliver queued messages in random order
  --runtime=<sync|actors|netty>
                             Single-threaded queue (default), one thread per node,
                             or one thread per node over in-VM Netty channels
  --timeout-ms=<ms>          Max wait for the concurrent runtimes (default 10000)
  --json                     Print the final report as JSON instead of narration
  --no-color                 Disable ANSI colours (also honours NO_COLOR)
  --metrics                  Print Micrometer counters after the round
""");
        }

        private static Integer envInt(String key) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return null;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                LOG.warning(() -> "Ignoring non-numeric " + key + "=" + value);
                return null;
            }
        }

        private static int parseInt(String value, String flag) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(flag + " must be an integer: " + value);
            }
        }

        private static long parseLong(String value, String flag) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(flag + " must be an integer: " + value);
            }
        }

        private static List<Integer> parseIds(String value, String flag) {
            List<Integer> ids = new ArrayList<>();
            if (value.isBlank()) {
                return ids;
            }
            for (String part : value.split(",")) {
                if (!part.isBlank()) {
                    ids.add(parseInt(part, flag));
                }
            }
            return ids;
        }

        private static String parseRuntime(String value) {
            String v = value.trim();
            if (v.equals("sync") || v.equals("actors") || v.equals("netty")) {
                return v;
            }
            throw new IllegalArgumentException("--runtime must be sync, actors or netty: " + value);
        }
    }
}
