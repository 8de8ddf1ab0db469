package io.deedchain.core.node;

import io.deedchain.core.registry.RegistryConfig;

/** Simple config holder for a local registry node. */
public final class NodeConfig {
    public final int maxCallsPerBlock;
    public final long blockIntervalMillis;
    public final int receiptCapacity;
    public final RegistryConfig registry;

    public NodeConfig(int maxCallsPerBlock, long blockIntervalMillis, int receiptCapacity, RegistryConfig registry) {
        if (maxCallsPerBlock <= 0) {
            throw new IllegalArgumentException("maxCallsPerBlock must be > 0");
        }
        if (blockIntervalMillis <= 0) {
            throw new IllegalArgumentException("blockIntervalMillis must be > 0");
        }
        this.maxCallsPerBlock = maxCallsPerBlock;
        this.blockIntervalMillis = blockIntervalMillis;
        this.receiptCapacity = receiptCapacity;
        this.registry = registry != null ? registry : RegistryConfig.defaults();
    }

    public static NodeConfig defaultLocal() {
        return new NodeConfig(
                500,          // calls per block
                1_000L,       // one block per second
                10_000,       // receipts kept for /receipt lookups
                RegistryConfig.defaults()
        );
    }

    public NodeConfig withRegistry(RegistryConfig registry) {
        return new NodeConfig(this.maxCallsPerBlock, this.blockIntervalMillis, this.receiptCapacity, registry);
    }

    public NodeConfig withBlocks(int maxCallsPerBlock, long blockIntervalMillis) {
        return new NodeConfig(maxCallsPerBlock, blockIntervalMillis, this.receiptCapacity, this.registry);
    }
}
