package io.deedchain.core.node;

import io.deedchain.core.protocol.CallReceipt;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Recent receipts by call id. Oldest entries are evicted once capacity is reached.
 */
public final class ReceiptLog {
    private final int capacity;
    private final Map<String, CallReceipt> receipts;

    public ReceiptLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.receipts = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CallReceipt> eldest) {
                return size() > ReceiptLog.this.capacity;
            }
        };
    }

    public synchronized void record(CallReceipt receipt) {
        receipts.put(receipt.callId(), receipt);
    }

    public synchronized Optional<CallReceipt> find(String callId) {
        return Optional.ofNullable(receipts.get(callId));
    }

    public synchronized boolean contains(String callId) {
        return receipts.containsKey(callId);
    }

    public synchronized int size() {
        return receipts.size();
    }
}
