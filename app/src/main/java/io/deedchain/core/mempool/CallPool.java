package io.deedchain.core.mempool;

import io.deedchain.core.protocol.RegistryCall;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Pending calls waiting for the next block:
 * - FIFO by submission, so calls from one caller execute in the order they were sent
 * - a call id is held from {@link #add} until {@link #complete}, so it cannot be queued twice
 *   while waiting or executing
 * - ids the executed check recognises are refused outright
 */
public final class CallPool {

    private final Deque<RegistryCall> fifo = new ArrayDeque<>();
    private final Set<String> inFlight = new HashSet<>();
    private final CallValidator validator;
    private final Predicate<String> executed;

    public CallPool(CallValidator validator) {
        this(validator, callId -> false);
    }

    public CallPool(CallValidator validator, Predicate<String> executed) {
        this.validator = validator;
        this.executed = executed;
    }

    /** Validate and add a call. Returns false if the same call is pending or already executed. */
    public synchronized boolean add(RegistryCall call) {
        validator.validate(call);
        String id = call.idHex();
        if (inFlight.contains(id) || executed.test(id)) {
            return false;
        }
        inFlight.add(id);
        fifo.addLast(call);
        return true;
    }

    /** Pull up to max calls in submission order. Their ids stay held until completed. */
    public synchronized List<RegistryCall> getBatch(int max) {
        List<RegistryCall> out = new ArrayList<>(Math.max(0, Math.min(max, fifo.size())));
        for (int i = 0; i < max && !fifo.isEmpty(); i++) {
            out.add(fifo.removeFirst());
        }
        return out;
    }

    /** Put calls back at the head of the queue, keeping their relative order. */
    public synchronized void requeue(Collection<RegistryCall> calls) {
        List<RegistryCall> reversed = new ArrayList<>(calls);
        for (int i = reversed.size() - 1; i >= 0; i--) {
            RegistryCall call = reversed.get(i);
            inFlight.add(call.idHex());
            fifo.addFirst(call);
        }
    }

    /** Release a call id once its receipt is recorded. */
    public synchronized void complete(String callId) {
        inFlight.remove(callId);
    }

    public synchronized int size() { return fifo.size(); }
}
