package io.deedchain.core.protocol;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * Shared Jackson setup for stored values, receipts and RPC bodies.
 * Jdk8Module is needed for the OptionalLong fields of transfers and grants.
 */
public final class JsonCodec {
    private JsonCodec(){}

    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .registerModule(new Jdk8Module())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
