package io.deedchain.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public class RegistryMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksProduced = registry.counter("registry.blocks.produced");
    private static final Timer blockTime = registry.timer("registry.block.time");

    public static <T> T recordBlock(Supplier<T> blockProductionLogic) {
        return blockTime.record(blockProductionLogic);
    }

    public static void incrementBlocks() {
        blocksProduced.increment();
    }

    /** Count one executed call; outcome is "ok" or the error name. */
    public static void recordCall(String operation, String outcome) {
        Counter.builder("registry.calls")
                .description("Registry calls executed")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public static Timer.Sample startRequest() {
        return Timer.start(registry);
    }

    /** Stop an RPC request timer; one series per method, path and response status. */
    public static void stopRequest(Timer.Sample sample, String method, String path, int status) {
        sample.stop(Timer.builder("http.server.requests")
                .tag("method", method)
                .tag("path", path)
                .tag("status", String.valueOf(status))
                .register(registry));
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                m.getId().getTags().forEach(t -> sb.append(',').append(t.getKey()).append('=').append(t.getValue()));
                sb.append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
