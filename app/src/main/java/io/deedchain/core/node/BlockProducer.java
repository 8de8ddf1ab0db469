package io.deedchain.core.node;

import io.deedchain.core.mempool.CallPool;
import io.deedchain.core.metrics.RegistryMetrics;
import io.deedchain.core.protocol.CallReceipt;
import io.deedchain.core.protocol.RegistryCall;
import io.deedchain.core.registry.PropertyRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Takes a batch of pending calls, advances the registry one height and executes the calls
 * there in submission order. Each call commits or fails on its own; its receipt says which.
 */
public final class BlockProducer {
    private static final Logger LOG = Logger.getLogger(BlockProducer.class.getName());

    private final PropertyRegistry registry;
    private final CallPool pool;
    private final CallDispatcher dispatcher;
    private final ReceiptLog receipts;
    private final int maxCallsPerBlock;

    public BlockProducer(PropertyRegistry registry, CallPool pool, ReceiptLog receipts, int maxCallsPerBlock) {
        this.registry = registry;
        this.pool = pool;
        this.dispatcher = new CallDispatcher(registry);
        this.receipts = receipts;
        this.maxCallsPerBlock = maxCallsPerBlock;
    }

    /** One production attempt: returns the block if there were calls to execute. */
    public Optional<ProducedBlock> tick() {
        List<RegistryCall> calls = pool.getBatch(maxCallsPerBlock);
        if (calls.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(RegistryMetrics.recordBlock(() -> produce(calls)));
    }

    private ProducedBlock produce(List<RegistryCall> calls) {
        long height = registry.currentHeight() + 1L;
        List<CallReceipt> executed = new ArrayList<>(calls.size());
        int next = 0;
        try {
            registry.advanceTo(height);
            for (; next < calls.size(); next++) {
                CallReceipt receipt = dispatcher.dispatch(calls.get(next), height);
                executed.add(receipt);
                receipts.record(receipt);
                pool.complete(receipt.callId());
                RegistryMetrics.recordCall(receipt.operation().wireName(),
                        receipt.ok() ? "ok" : receipt.error().name());
            }
        } catch (RuntimeException e) {
            // calls before 'next' are committed; the rest go back to the pool
            pool.requeue(calls.subList(next, calls.size()));
            LOG.warning("Block " + height + " aborted after " + next + " of " + calls.size()
                    + " calls: " + e.getMessage());
            throw e;
        }
        RegistryMetrics.incrementBlocks();
        ProducedBlock block = new ProducedBlock(height, executed);
        LOG.info(() -> "Produced block " + height + " with " + executed.size() + " calls ("
                + block.failedCalls() + " failed)");
        return block;
    }
}
