package io.deedchain.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.deedchain.core.model.PropertyDetails;
import io.deedchain.core.model.PropertyStatus;
import io.deedchain.core.protocol.CallReceipt;
import io.deedchain.core.protocol.JsonCodec;
import io.deedchain.core.protocol.RegistryCall;
import io.deedchain.core.registry.CallContext;
import io.deedchain.core.registry.PropertyRegistry;
import io.deedchain.core.registry.Result;

import java.util.OptionalLong;

/**
 * Routes a queued call to the matching registry operation and turns the outcome into a receipt.
 */
public final class CallDispatcher {

    private final PropertyRegistry registry;
    private final ObjectMapper mapper = JsonCodec.newMapper();

    public CallDispatcher(PropertyRegistry registry) {
        this.registry = registry;
    }

    public CallReceipt dispatch(RegistryCall call, long height) {
        Result<?> result = execute(call, CallContext.of(call.caller(), height));
        JsonNode value = result.isOk() ? mapper.valueToTree(result.value()) : null;
        return new CallReceipt(call.idHex(), call.operation(), call.caller(), height, value, result.error());
    }

    private Result<?> execute(RegistryCall call, CallContext ctx) {
        ObjectNode args = call.args();
        switch (call.operation()) {
            case REGISTER:
                return registry.register(ctx, details(args), text(args, "initialOwner"));
            case UPDATE_METADATA:
                return registry.updateMetadata(ctx, propertyId(args), details(args));
            case TRANSFER:
                return registry.transfer(ctx, propertyId(args), text(args, "newOwner"),
                        text(args, "reason"), optionalLong(args, "amount"));
            case VERIFY:
                return registry.verify(ctx, propertyId(args), text(args, "notes"));
            case ADD_DOCUMENT:
                return registry.addDocument(ctx, propertyId(args), text(args, "title"),
                        text(args, "documentType"), text(args, "hash"), text(args, "description"));
            case CHANGE_STATUS:
                PropertyStatus target = PropertyStatus.fromCode(args.path("status").asLong(0)).orElse(null);
                return registry.changeStatus(ctx, propertyId(args), target, text(args, "reason"));
            case GRANT_ACCESS:
                return registry.grant(ctx, propertyId(args), text(args, "accessor"),
                        args.path("level").asLong(0), optionalLong(args, "expiresAt"));
            case REVOKE_ACCESS:
                return registry.revoke(ctx, propertyId(args), text(args, "accessor"));
            default:
                throw new IllegalArgumentException("Unsupported operation " + call.operation());
        }
    }

    private static PropertyDetails details(ObjectNode args) {
        return new PropertyDetails(
                text(args, "title"),
                text(args, "description"),
                text(args, "location"),
                text(args, "category"),
                args.path("totalArea").asLong(0),
                text(args, "areaUnit")
        );
    }

    private static long propertyId(ObjectNode args) {
        return args.path("propertyId").asLong(0);
    }

    private static String text(ObjectNode args, String name) {
        JsonNode node = args.get(name);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static OptionalLong optionalLong(ObjectNode args, String name) {
        JsonNode node = args.get(name);
        return node == null || node.isNull() ? OptionalLong.empty() : OptionalLong.of(node.asLong());
    }
}
