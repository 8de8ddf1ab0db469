package io.deedchain.core.node;

import io.deedchain.core.protocol.CallReceipt;

import java.util.List;

/** A block of executed calls: the height they ran at and their receipts in execution order. */
public record ProducedBlock(long height, List<CallReceipt> receipts) {

    public ProducedBlock {
        receipts = List.copyOf(receipts);
    }

    public long failedCalls() {
        return receipts.stream().filter(r -> !r.ok()).count();
    }
}
