package io.deedchain.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.deedchain.core.metrics.RegistryMetrics;
import io.deedchain.core.model.PropertyInfo;
import io.deedchain.core.model.PropertyStatus;
import io.deedchain.core.node.Node;
import io.deedchain.core.node.NodeConfig;
import io.deedchain.core.node.ProducedBlock;
import io.deedchain.core.protocol.CallReceipt;
import io.deedchain.core.protocol.JsonCodec;
import io.deedchain.core.protocol.Operation;
import io.deedchain.core.protocol.RegistryCall;
import io.deedchain.core.registry.RegistryConfig;
import io.deedchain.core.rpc.RpcServer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final ObjectMapper JSON = JsonCodec.newMapper();
    static final String REGISTRY_CONFIG_FILE = "registry-config.json";

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        Path dataPath = options.dataDir().toAbsolutePath().normalize();
        if (options.resetData()) {
            resetRegistryData(dataPath);
        }
        Files.createDirectories(dataPath);

        RegistryConfig registryConfig = loadRegistryConfig(dataPath.resolve(REGISTRY_CONFIG_FILE));
        NodeConfig config = NodeConfig.defaultLocal()
                .withBlocks(options.maxCallsPerBlock(), options.blockIntervalMillis())
                .withRegistry(registryConfig);
        Node node = options.inMemory()
                ? Node.inMemory(config)
                : Node.rocks(config, dataPath.resolve("registry").toString());

        RpcServer rpcServer = null;
        CountDownLatch shutdownLatch = null;
        ScheduledExecutorService producer = null;

        try {
            node.start();

            if (options.demo()) {
                runDemoFlow(node);
            } else {
                LOG.info("Demo flow disabled (--no-demo)");
            }

            if (options.enableRpc()) {
                rpcServer = new RpcServer(
                        node,
                        options.rpcBind(),
                        options.rpcPort(),
                        options.rpcToken()
                );
                rpcServer.start();
            }

            boolean keepAlive = options.keepAlive() || options.enableRpc();
            if (keepAlive) {
                shutdownLatch = new CountDownLatch(1);
                CountDownLatch latchRef = shutdownLatch;
                Runtime.getRuntime().addShutdownHook(new Thread(latchRef::countDown, "deedchain-shutdown"));
                producer = startProducer(node, config.blockIntervalMillis);
            }

            if (keepAlive) {
                LOG.info("Registry node running. Press CTRL+C to exit.");
                shutdownLatch.await();
            } else if (options.demoDurationMillis() > 0) {
                try {
                    Thread.sleep(options.demoDurationMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        } finally {
            if (producer != null) {
                producer.shutdownNow();
            }
            if (rpcServer != null) {
                rpcServer.stop();
            }
            node.close();
        }
    }

    static ScheduledExecutorService startProducer(Node node, long intervalMillis) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "deedchain-block-producer");
            t.setDaemon(true);
            return t;
        });
        Runnable task = () -> {
            try {
                node.tick();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Background block production failed", e);
            }
        };
        executor.scheduleAtFixedRate(task, 0, intervalMillis, TimeUnit.MILLISECONDS);
        return executor;
    }

    private static void runDemoFlow(Node node) {
        RegistryCall register = RegistryCall.builder()
                .operation(Operation.REGISTER)
                .caller("alice")
                .arg("title", "Lot 7")
                .arg("description", "Corner lot with frontage on Main Street")
                .arg("location", "Springfield, block 12")
                .arg("category", "residential")
                .arg("totalArea", 1000)
                .arg("areaUnit", "sqft")
                .arg("initialOwner", "alice")
                .build();
        node.submit(register);
        node.tick();

        Optional<CallReceipt> registered = node.receipt(register.idHex());
        if (registered.isEmpty() || !registered.get().ok()) {
            LOG.warning("Demo registration failed: " + registered.map(CallReceipt::error).orElse(null));
            return;
        }
        long propertyId = registered.get().value().asLong();
        LOG.info("Registered property " + propertyId + " for alice");

        node.submit(RegistryCall.builder()
                .operation(Operation.TRANSFER)
                .caller("alice")
                .arg("propertyId", propertyId)
                .arg("newOwner", "bob")
                .arg("reason", "sale")
                .arg("amount", 500)
                .build());
        node.submit(RegistryCall.builder()
                .operation(Operation.VERIFY)
                .caller("county-inspector")
                .arg("propertyId", propertyId)
                .arg("notes", "boundaries surveyed")
                .build());
        node.submit(RegistryCall.builder()
                .operation(Operation.ADD_DOCUMENT)
                .caller("bob")
                .arg("propertyId", propertyId)
                .arg("title", "Deed of sale")
                .arg("documentType", "deed")
                .arg("hash", "9f86d081884c7d659a2feaa0c55ad015a3bf4f1b2b0b822cd15d6c15b0f00a08")
                .arg("description", "Signed deed")
                .build());
        node.submit(RegistryCall.builder()
                .operation(Operation.GRANT_ACCESS)
                .caller("bob")
                .arg("propertyId", propertyId)
                .arg("accessor", "bank")
                .arg("level", 2)
                .build());
        node.submit(RegistryCall.builder()
                .operation(Operation.CHANGE_STATUS)
                .caller("bob")
                .arg("propertyId", propertyId)
                .arg("status", PropertyStatus.PENDING.code())
                .arg("reason", "mortgage pending")
                .build());

        Optional<ProducedBlock> block = node.tick();
        block.ifPresent(b -> b.receipts().forEach(r -> LOG.info(
                "  " + r.operation().wireName() + " by " + r.caller() + " -> "
                        + (r.ok() ? "ok " + r.value() : "error " + r.error().code()))));

        PropertyInfo info = node.registry().getPropertyInfo(propertyId).value();
        LOG.info("Property " + propertyId + " owner=" + info.owner()
                + " status=" + info.metadata().status()
                + " verified=" + info.verification().verified());
        LOG.info("Statistics: " + node.registry().getSystemStatistics());
        LOG.info("=== Metrics ===\n" + RegistryMetrics.scrapeMetrics());
    }

    static RegistryConfig loadRegistryConfig(Path path) {
        RegistryConfig config = RegistryConfig.defaults();
        if (!Files.exists(path)) {
            return config;
        }
        try {
            JsonNode json = JSON.readTree(path.toFile());
            if (json.has("statusChangeRequiresOwner")) {
                config = config.withStatusChangeRequiresOwner(json.get("statusChangeRequiresOwner").asBoolean());
            }
            if (json.has("enforceGrantExpiry")) {
                config = config.withEnforceGrantExpiry(json.get("enforceGrantExpiry").asBoolean());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read registry config from " + path, e);
        }
        LOG.info("Loaded " + config + " from " + path);
        return config;
    }

    private static void resetRegistryData(Path dataPath) {
        if (!Files.exists(dataPath)) {
            return;
        }
        Path configFile = dataPath.resolve(REGISTRY_CONFIG_FILE).normalize();
        try (Stream<Path> stream = Files.walk(dataPath)) {
            stream.sorted(Comparator.reverseOrder())
                    .filter(path -> !path.equals(dataPath))
                    .filter(path -> !path.normalize().equals(configFile))
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            throw new IllegalStateException("Failed to delete " + path, e);
                        }
                    });
        } catch (IOException e) {
            throw new IllegalStateException("Failed to reset registry data in " + dataPath, e);
        }
        LOG.info("Cleared registry data under " + dataPath + " (" + REGISTRY_CONFIG_FILE + " preserved).");
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            boolean inMemory,
            boolean resetData,
            boolean keepAlive,
            boolean demo,
            long demoDurationMillis,
            boolean enableRpc,
            String rpcBind,
            int rpcPort,
            String rpcToken,
            long blockIntervalMillis,
            int maxCallsPerBlock
    ) {
        static CliOptions parse(String[] args) {
            return parse(args, System.getenv());
        }

        static CliOptions parse(String[] args, Map<String, String> env) {
            Path dataDir = envPath(env, "DEEDCHAIN_DATA_DIR", Path.of("./data/registry"));
            boolean inMemory = "true".equalsIgnoreCase(env.get("DEEDCHAIN_IN_MEMORY"));
            boolean reset = false;
            boolean keepAlive = false;
            boolean demo = true;
            long demoDurationMillis = 5_000L;
            boolean enableRpc = "true".equalsIgnoreCase(env.get("DEEDCHAIN_ENABLE_RPC"));
            String rpcBind = envOrDefault(env, "DEEDCHAIN_RPC_BIND", "127.0.0.1");
            int rpcPort = 9090;
            String rpcToken = env.get("DEEDCHAIN_RPC_TOKEN");
            boolean showHelp = false;
            String error = null;

            String portEnv = env.get("DEEDCHAIN_RPC_PORT");
            if (portEnv != null && !portEnv.isBlank()) {
                try {
                    rpcPort = parsePort(portEnv, "DEEDCHAIN_RPC_PORT");
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    error = ex.getMessage();
                }
            }

            NodeConfig defaults = NodeConfig.defaultLocal();
            long blockIntervalMillis = defaults.blockIntervalMillis;
            int maxCallsPerBlock = defaults.maxCallsPerBlock;
            String intervalEnv = env.get("DEEDCHAIN_BLOCK_INTERVAL_MS");
            if (intervalEnv != null && !intervalEnv.isBlank()) {
                try {
                    blockIntervalMillis = parsePositiveLong(intervalEnv, "DEEDCHAIN_BLOCK_INTERVAL_MS");
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    error = ex.getMessage();
                }
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.equals("--in-memory")) {
                        inMemory = true;
                    } else if (arg.equals("--reset-data")) {
                        reset = true;
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (arg.equals("--demo")) {
                        demo = true;
                    } else if (arg.equals("--no-demo")) {
                        demo = false;
                    } else if (arg.startsWith("--demo-duration-ms=")) {
                        try {
                            demoDurationMillis = parseNonNegativeLong(arg.substring("--demo-duration-ms=".length()), "--demo-duration-ms");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.equals("--enable-rpc")) {
                        enableRpc = true;
                    } else if (arg.startsWith("--rpc-bind=")) {
                        rpcBind = arg.substring("--rpc-bind=".length());
                    } else if (arg.startsWith("--rpc-port=")) {
                        try {
                            rpcPort = parsePort(arg.substring("--rpc-port=".length()), "--rpc-port");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--rpc-token=")) {
                        rpcToken = arg.substring("--rpc-token=".length());
                    } else if (arg.startsWith("--block-interval-ms=")) {
                        try {
                            blockIntervalMillis = parsePositiveLong(arg.substring("--block-interval-ms=".length()), "--block-interval-ms");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--max-calls-per-block=")) {
                        try {
                            maxCallsPerBlock = (int) Math.min(Integer.MAX_VALUE,
                                    parsePositiveLong(arg.substring("--max-calls-per-block=".length()), "--max-calls-per-block"));
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (!arg.startsWith("--")) {
                        dataDir = Path.of(arg);
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (rpcToken == null || rpcToken.isBlank()) {
                rpcToken = env.get("DEEDCHAIN_RPC_TOKEN");
            }

            keepAlive = keepAlive || enableRpc || "true".equalsIgnoreCase(env.get("DEEDCHAIN_KEEP_ALIVE"));

            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    inMemory,
                    reset,
                    keepAlive,
                    demo,
                    demoDurationMillis,
                    enableRpc,
                    rpcBind,
                    rpcPort,
                    rpcToken,
                    blockIntervalMillis,
                    maxCallsPerBlock
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: deedchain [options]

Options:
  --help, -h                   Show this help message and exit
  --data-dir=<path>            Path for registry data (default ./data/registry)
  --in-memory                  Keep registry state in memory only
  --reset-data                 Delete registry data (registry-config.json is preserved)
  --keep-alive                 Keep the node running until interrupted
  --demo / --no-demo           Enable (default) or disable the demo registry flow
  --demo-duration-ms=<ms>      How long to keep the JVM alive when not using --keep-alive (default 5000)
  --enable-rpc                 Start the RPC server (default bind 127.0.0.1:9090)
  --rpc-bind=<host>            Bind address for the RPC server
  --rpc-port=<port>            Port for the RPC server (default 9090)
  --rpc-token=<token>          Require Bearer/X-API-Key token for the RPC server
  --block-interval-ms=<ms>     Time between produced blocks (default 1000)
  --max-calls-per-block=<n>    Calls executed per block at most (default 500)

Registry policy is read from <data-dir>/registry-config.json when present:
  { "statusChangeRequiresOwner": false, "enforceGrantExpiry": true }

Environment overrides:
  DEEDCHAIN_DATA_DIR           Override --data-dir
  DEEDCHAIN_IN_MEMORY          Set to "true" to use an in-memory store
  DEEDCHAIN_RPC_TOKEN          Token for RPC auth (if --rpc-token not supplied)
  DEEDCHAIN_ENABLE_RPC         Set to "true" to enable RPC without CLI flag
  DEEDCHAIN_RPC_BIND           Bind address for the RPC server
  DEEDCHAIN_RPC_PORT           Port for the RPC server
  DEEDCHAIN_BLOCK_INTERVAL_MS  Time between produced blocks
  DEEDCHAIN_KEEP_ALIVE         Set to "true" to force keep-alive mode
""");
        }

        private static Path envPath(Map<String, String> env, String key, Path fallback) {
            String value = env.get(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(Map<String, String> env, String key, String fallback) {
            String value = env.get(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static long parseNonNegativeLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed < 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }

        private static long parsePositiveLong(String value, String flag) {
            long parsed = parseNonNegativeLong(value, flag);
            if (parsed == 0) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
            return parsed;
        }
    }
}
