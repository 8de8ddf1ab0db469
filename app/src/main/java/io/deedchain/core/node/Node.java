package io.deedchain.core.node;

import io.deedchain.core.mempool.CallPool;
import io.deedchain.core.mempool.CallValidator;
import io.deedchain.core.protocol.CallReceipt;
import io.deedchain.core.protocol.RegistryCall;
import io.deedchain.core.registry.PropertyRegistry;
import io.deedchain.core.state.InMemoryRegistryStore;
import io.deedchain.core.state.RegistryStore;
import io.deedchain.core.storage.RocksDBRegistryStore;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires the store, registry, call pool and block producer.
 * Start once, then call tick() periodically to execute pending calls.
 */
public final class Node {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    private final RegistryStore store;
    private final PropertyRegistry registry;
    private final CallPool pool;
    private final ReceiptLog receipts;
    private final BlockProducer producer;
    private final NodeConfig config;

    public Node(RegistryStore store, CallValidator validator, NodeConfig config) {
        this.store = store;
        this.config = config;
        this.registry = new PropertyRegistry(store, config.registry);
        this.receipts = new ReceiptLog(config.receiptCapacity);
        this.pool = new CallPool(validator, receipts::contains);
        this.producer = new BlockProducer(registry, pool, receipts, config.maxCallsPerBlock);
    }

    /** Convenience factory for an in-memory local node. */
    public static Node inMemory(NodeConfig config) {
        return new Node(new InMemoryRegistryStore(), new CallValidator(), config);
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static Node rocks(NodeConfig config, String dataDir) {
        return new Node(RocksDBRegistryStore.open(dataDir), new CallValidator(), config);
    }

    /** Report where the registry resumes. Safe to call multiple times. */
    public void start() {
        LOG.info(() -> "Registry at height " + registry.currentHeight() + " with "
                + registry.getPropertyCount() + " properties (" + config.registry + ")");
    }

    /**
     * Validate and queue a call; false if the identical call is pending or has a receipt.
     * Replays are recognised while the receipt is retained, i.e. for the last
     * {@code receiptCapacity} executed calls. Once a receipt is evicted its id is forgotten.
     */
    public boolean submit(RegistryCall call) {
        return pool.add(call);
    }

    /** Try to produce one block (returns it if any calls were pending). */
    public Optional<ProducedBlock> tick() {
        return producer.tick();
    }

    public Optional<CallReceipt> receipt(String callId) {
        return receipts.find(callId);
    }

    /** Close underlying resources if any (e.g., RocksDB). */
    public void close() {
        if (store instanceof AutoCloseable) {
            try {
                ((AutoCloseable) store).close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Failed to close registry store", e);
            }
        }
    }

    public RegistryStore store() { return store; }
    public PropertyRegistry registry() { return registry; }
    public CallPool pool() { return pool; }
    public NodeConfig config() { return config; }
}
