package io.deedchain.core.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.deedchain.core.metrics.RegistryMetrics;
import io.deedchain.core.model.StatusChange;
import io.deedchain.core.model.SystemStatistics;
import io.deedchain.core.node.Node;
import io.deedchain.core.protocol.CallReceipt;
import io.deedchain.core.protocol.JsonCodec;
import io.deedchain.core.protocol.Operation;
import io.deedchain.core.protocol.RegistryCall;
import io.deedchain.core.registry.PropertyRegistry;
import io.deedchain.core.registry.RegistryError;
import io.deedchain.core.registry.Result;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class RpcServer {
    private static final Logger LOG = Logger.getLogger(RpcServer.class.getName());
    private static final byte[] OPENAPI_SPEC = """
{
  "openapi": "3.0.3",
  "info": {
    "title": "Deedchain Registry RPC API",
    "version": "1.0.0"
  },
  "paths": {
    "/status": {
      "get": {
        "summary": "Registry height, pending calls and statistics",
        "responses": { "200": { "description": "Status response" }, "401": { "description": "Auth required" } }
      }
    },
    "/call": {
      "post": {
        "summary": "Submit a registry call for the next block",
        "requestBody": {
          "required": true,
          "content": {
            "application/json": {
              "schema": { "$ref": "#/components/schemas/CallRequest" }
            }
          }
        },
        "responses": {
          "202": { "description": "Call queued" },
          "400": { "description": "Invalid call" },
          "409": { "description": "Identical call already pending" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/receipt": {
      "get": {
        "summary": "Receipt of an executed call",
        "parameters": [ { "name": "id", "in": "query", "required": true, "schema": { "type": "string" } } ],
        "responses": { "200": { "description": "Receipt" }, "404": { "description": "Unknown or pending call" } }
      }
    },
    "/property": {
      "get": {
        "summary": "Owner, metadata and verification of a property",
        "parameters": [ { "name": "id", "in": "query", "required": true, "schema": { "type": "integer" } } ],
        "responses": { "200": { "description": "Property info" }, "404": { "description": "PropertyNotFound" } }
      }
    },
    "/owner": {
      "get": {
        "summary": "Current owner of a property",
        "parameters": [ { "name": "id", "in": "query", "required": true, "schema": { "type": "integer" } } ],
        "responses": { "200": { "description": "Owner" }, "404": { "description": "PropertyNotFound" } }
      }
    },
    "/owns": {
      "get": {
        "summary": "Whether an account currently owns a property",
        "parameters": [
          { "name": "id", "in": "query", "required": true, "schema": { "type": "integer" } },
          { "name": "owner", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": { "200": { "description": "Ownership flag" } }
      }
    },
    "/membership": {
      "get": {
        "summary": "Membership table lookup for (owner, property)",
        "parameters": [
          { "name": "owner", "in": "query", "required": true, "schema": { "type": "string" } },
          { "name": "id", "in": "query", "required": true, "schema": { "type": "integer" } }
        ],
        "responses": { "200": { "description": "Membership flag" } }
      }
    },
    "/verification": {
      "get": {
        "summary": "Verification record of a property",
        "parameters": [ { "name": "id", "in": "query", "required": true, "schema": { "type": "integer" } } ],
        "responses": { "200": { "description": "Verification" }, "404": { "description": "PropertyNotFound" } }
      }
    },
    "/transfer": {
      "get": {
        "summary": "One transfer of a property",
        "parameters": [
          { "name": "id", "in": "query", "required": true, "schema": { "type": "integer" } },
          { "name": "seq", "in": "query", "required": true, "schema": { "type": "integer" } }
        ],
        "responses": { "200": { "description": "Transfer record" }, "404": { "description": "PropertyNotFound or TransferNotFound" } }
      }
    },
    "/document": {
      "get": {
        "summary": "One document attached to a property",
        "parameters": [
          { "name": "id", "in": "query", "required": true, "schema": { "type": "integer" } },
          { "name": "seq", "in": "query", "required": true, "schema": { "type": "integer" } }
        ],
        "responses": { "200": { "description": "Document record" }, "404": { "description": "PropertyNotFound or DocumentNotFound" } }
      }
    },
    "/status-history": {
      "get": {
        "summary": "Status changes of a property, oldest first",
        "parameters": [ { "name": "id", "in": "query", "required": true, "schema": { "type": "integer" } } ],
        "responses": { "200": { "description": "Status history" }, "404": { "description": "PropertyNotFound" } }
      }
    },
    "/grant": {
      "get": {
        "summary": "Access grant of one accessor",
        "parameters": [
          { "name": "id", "in": "query", "required": true, "schema": { "type": "integer" } },
          { "name": "accessor", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": { "200": { "description": "Grant" }, "404": { "description": "PropertyNotFound or GrantNotFound" } }
      }
    },
    "/access": {
      "get": {
        "summary": "Access check at the current height",
        "parameters": [
          { "name": "id", "in": "query", "required": true, "schema": { "type": "integer" } },
          { "name": "accessor", "in": "query", "required": true, "schema": { "type": "string" } },
          { "name": "level", "in": "query", "required": true, "schema": { "type": "integer" } }
        ],
        "responses": { "200": { "description": "Access flag" } }
      }
    },
    "/stats": {
      "get": {
        "summary": "System statistics",
        "responses": { "200": { "description": "Counters" } }
      }
    },
    "/metrics": {
      "get": {
        "summary": "Metrics scrape",
        "responses": { "200": { "description": "Metrics as plain text" }, "401": { "description": "Auth required" } }
      }
    },
    "/openapi.json": {
      "get": {
        "summary": "OpenAPI description of this RPC API",
        "responses": { "200": { "description": "OpenAPI specification" }, "401": { "description": "Auth required" } }
      }
    }
  },
  "components": {
    "schemas": {
      "CallRequest": {
        "type": "object",
        "required": ["operation", "caller", "args"],
        "properties": {
          "operation": {
            "type": "string",
            "enum": ["register", "update-metadata", "transfer", "verify", "add-document",
                     "change-status", "grant-access", "revoke-access"]
          },
          "caller": { "type": "string" },
          "args": { "type": "object" },
          "timestamp": { "type": "integer", "format": "int64" }
        }
      }
    }
  }
}
""".getBytes(StandardCharsets.UTF_8);

    private final Node node;
    private final PropertyRegistry registry;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private HttpServer server;
    private ExecutorService executor;

    public RpcServer(Node node, String bindAddress, int port, String authToken) {
        this.node = node;
        this.registry = node.registry();
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = JsonCodec.newMapper();
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("RPC server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/status", new StatusHandler());
        server.createContext("/call", new CallHandler());
        server.createContext("/receipt", new ReceiptHandler());
        server.createContext("/property", new PropertyHandler());
        server.createContext("/owner", new OwnerHandler());
        server.createContext("/owns", new OwnsHandler());
        server.createContext("/membership", new MembershipHandler());
        server.createContext("/verification", new VerificationHandler());
        server.createContext("/transfer", new TransferHandler());
        server.createContext("/document", new DocumentHandler());
        server.createContext("/status-history", new StatusHistoryHandler());
        server.createContext("/grant", new GrantHandler());
        server.createContext("/access", new AccessHandler());
        server.createContext("/stats", new StatsHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/openapi.json", new OpenApiHandler());
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "RPC server listening on http://" + bindAddress + ':' + port + (authToken != null ? " (auth required)" : ""));
    }

    /** Bound port; differs from the configured one when started on port 0. */
    public int port() {
        return server != null ? server.getAddress().getPort() : port;
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    private int ensureAuthorized(HttpExchange exchange) throws IOException {
        if (authToken == null) {
            return -1;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return -1;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (apiKey != null && apiKey.equals(authToken)) {
            return -1;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        return sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
    }

    /**
     * GET endpoint skeleton: method check, auth, metrics and error mapping.
     * Subclasses only build the response.
     */
    abstract class QueryHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = RegistryMetrics.startRequest();
            int status = 500;
            try {
                if (!"GET".equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use GET for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = respond(exchange, exchange.getRequestURI());
            } catch (BadParameterException e) {
                status = sendError(exchange, 400, e.code, e.getMessage());
            } catch (Exception e) {
                LOG.log(Level.WARNING, path + " handler failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                RegistryMetrics.stopRequest(sample, method, path, status);
                exchange.close();
            }
        }

        abstract int respond(HttpExchange exchange, URI uri) throws IOException;
    }

    final class StatusHandler extends QueryHandler {
        @Override
        int respond(HttpExchange exchange, URI uri) throws IOException {
            SystemStatistics stats = registry.getSystemStatistics();
            ObjectNode resp = mapper.createObjectNode();
            resp.put("height", stats.height());
            resp.put("pendingCalls", node.pool().size());
            resp.set("statistics", mapper.valueToTree(stats));
            return sendJson(exchange, 200, resp);
        }
    }

    final class CallHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = RegistryMetrics.startRequest();
            int status = 500;
            try {
                if (!"POST".equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use POST for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                CallRequest req;
                try {
                    req = mapper.readValue(exchange.getRequestBody(), CallRequest.class);
                } catch (JsonProcessingException e) {
                    status = sendError(exchange, 400, "invalid_json", "Failed to parse call request");
                    return;
                }
                if (req == null || req.operation == null || req.caller == null) {
                    status = sendError(exchange, 400, "missing_fields", "Fields 'operation' and 'caller' are required");
                    return;
                }
                Optional<Operation> op = Operation.fromWireName(req.operation);
                if (op.isEmpty()) {
                    status = sendError(exchange, 400, "unknown_operation", "Unknown operation " + req.operation);
                    return;
                }
                try {
                    RegistryCall.Builder builder = RegistryCall.builder()
                            .operation(op.get())
                            .caller(req.caller)
                            .args(req.args);
                    if (req.timestamp != null) {
                        builder.timestamp(req.timestamp);
                    }
                    RegistryCall call = builder.build();
                    if (!node.submit(call)) {
                        status = sendError(exchange, 409, "duplicate_call", "Call " + call.idHex() + " is already pending");
                        return;
                    }
                    ObjectNode resp = mapper.createObjectNode()
                            .put("accepted", true)
                            .put("id", call.idHex());
                    status = sendJson(exchange, 202, resp);
                } catch (IllegalArgumentException e) {
                    status = sendError(exchange, 400, "invalid_call", Optional.ofNullable(e.getMessage()).orElse("Rejected call"));
                }
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Call handler failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                RegistryMetrics.stopRequest(sample, method, path, status);
                exchange.close();
            }
        }
    }

    final class ReceiptHandler extends QueryHandler {
        @Override
        int respond(HttpExchange exchange, URI uri) throws IOException {
            String id = requiredParam(uri, "id");
            Optional<CallReceipt> receipt = node.receipt(id);
            if (receipt.isEmpty()) {
                return sendError(exchange, 404, "receipt_not_found", "No receipt for call " + id);
            }
            return sendJson(exchange, 200, receiptJson(receipt.get()));
        }
    }

    final class PropertyHandler extends QueryHandler {
        @Override
        int respond(HttpExchange exchange, URI uri) throws IOException {
            return sendResult(exchange, registry.getPropertyInfo(longParam(uri, "id")));
        }
    }

    final class OwnerHandler extends QueryHandler {
        @Override
        int respond(HttpExchange exchange, URI uri) throws IOException {
            long id = longParam(uri, "id");
            Result<String> owner = registry.getOwner(id);
            if (!owner.isOk()) {
                return sendRegistryError(exchange, owner.error());
            }
            ObjectNode resp = mapper.createObjectNode()
                    .put("propertyId", id)
                    .put("owner", owner.value());
            return sendJson(exchange, 200, resp);
        }
    }

    final class OwnsHandler extends QueryHandler {
        @Override
        int respond(HttpExchange exchange, URI uri) throws IOException {
            long id = longParam(uri, "id");
            String owner = requiredParam(uri, "owner");
            ObjectNode resp = mapper.createObjectNode()
                    .put("propertyId", id)
                    .put("owner", owner)
                    .put("owns", registry.ownsProperty(id, owner));
            return sendJson(exchange, 200, resp);
        }
    }

    final class MembershipHandler extends QueryHandler {
        @Override
        int respond(HttpExchange exchange, URI uri) throws IOException {
            String owner = requiredParam(uri, "owner");
            long id = longParam(uri, "id");
            ObjectNode resp = mapper.createObjectNode()
                    .put("owner", owner)
                    .put("propertyId", id)
                    .put("member", registry.getOwnerMembership(owner, id));
            return sendJson(exchange, 200, resp);
        }
    }

    final class VerificationHandler extends QueryHandler {
        @Override
        int respond(HttpExchange exchange, URI uri) throws IOException {
            return sendResult(exchange, registry.getVerification(longParam(uri, "id")));
        }
    }

    final class TransferHandler extends QueryHandler {
        @Override
        int respond(HttpExchange exchange, URI uri) throws IOException {
            return sendResult(exchange, registry.getTransfer(longParam(uri, "id"), longParam(uri, "seq")));
        }
    }

    final class DocumentHandler extends QueryHandler {
        @Override
        int respond(HttpExchange exchange, URI uri) throws IOException {
            return sendResult(exchange, registry.getDocument(longParam(uri, "id"), longParam(uri, "seq")));
        }
    }

    final class StatusHistoryHandler extends QueryHandler {
        @Override
        int respond(HttpExchange exchange, URI uri) throws IOException {
            long id = longParam(uri, "id");
            Result<List<StatusChange>> history = registry.getStatusHistory(id);
            if (!history.isOk()) {
                return sendRegistryError(exchange, history.error());
            }
            ArrayNode changes = mapper.valueToTree(history.value());
            ObjectNode resp = mapper.createObjectNode().put("propertyId", id);
            resp.set("changes", changes);
            return sendJson(exchange, 200, resp);
        }
    }

    final class GrantHandler extends QueryHandler {
        @Override
        int respond(HttpExchange exchange, URI uri) throws IOException {
            return sendResult(exchange, registry.getAccessGrant(longParam(uri, "id"), requiredParam(uri, "accessor")));
        }
    }

    final class AccessHandler extends QueryHandler {
        @Override
        int respond(HttpExchange exchange, URI uri) throws IOException {
            long id = longParam(uri, "id");
            String accessor = requiredParam(uri, "accessor");
            long level = longParam(uri, "level");
            ObjectNode resp = mapper.createObjectNode()
                    .put("propertyId", id)
                    .put("accessor", accessor)
                    .put("level", level)
                    .put("allowed", registry.checkAccess(id, accessor, level));
            return sendJson(exchange, 200, resp);
        }
    }

    final class StatsHandler extends QueryHandler {
        @Override
        int respond(HttpExchange exchange, URI uri) throws IOException {
            ObjectNode resp = mapper.valueToTree(registry.getSystemStatistics());
            resp.put("propertyCount", registry.getPropertyCount());
            return sendJson(exchange, 200, resp);
        }
    }

    final class MetricsHandler extends QueryHandler {
        @Override
        int respond(HttpExchange exchange, URI uri) throws IOException {
            byte[] payload = RegistryMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            exchange.sendResponseHeaders(200, payload.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(payload);
            }
            return 200;
        }
    }

    final class OpenApiHandler extends QueryHandler {
        @Override
        int respond(HttpExchange exchange, URI uri) throws IOException {
            return sendJson(exchange, 200, OPENAPI_SPEC);
        }
    }

    private ObjectNode receiptJson(CallReceipt receipt) {
        ObjectNode out = mapper.createObjectNode()
                .put("callId", receipt.callId())
                .put("operation", receipt.operation().wireName())
                .put("caller", receipt.caller())
                .put("height", receipt.height())
                .put("ok", receipt.ok());
        if (receipt.ok()) {
            out.set("value", receipt.value());
        } else {
            out.putObject("error")
                    .put("name", receipt.error().name())
                    .put("code", receipt.error().code());
        }
        return out;
    }

    private int sendResult(HttpExchange exchange, Result<?> result) throws IOException {
        if (!result.isOk()) {
            return sendRegistryError(exchange, result.error());
        }
        return sendJson(exchange, 200, result.value());
    }

    private int sendRegistryError(HttpExchange exchange, RegistryError error) throws IOException {
        int status;
        if (error.isNotFound()) {
            status = 404;
        } else if (error == RegistryError.UNAUTHORIZED) {
            status = 403;
        } else if (error == RegistryError.ALREADY_VERIFIED || error == RegistryError.INVALID_STATUS) {
            status = 409;
        } else {
            status = 400;
        }
        ObjectNode body = mapper.createObjectNode();
        body.put("error", error.name());
        body.put("code", error.code());
        body.put("message", "Registry error " + error.code());
        return sendJson(exchange, status, body);
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        if (body instanceof byte[] bytes) {
            payload = bytes;
        } else if (body instanceof String str) {
            payload = str.getBytes(StandardCharsets.UTF_8);
        } else {
            payload = mapper.writeValueAsBytes(body);
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", code);
        node.put("message", message);
        return sendJson(exchange, status, node);
    }

    private static String requiredParam(URI uri, String name) {
        String value = queryParam(uri, name);
        if (value == null || value.isBlank()) {
            throw new BadParameterException("missing_" + name, "Query parameter '" + name + "' is required");
        }
        return value;
    }

    private static long longParam(URI uri, String name) {
        String value = requiredParam(uri, name);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new BadParameterException("invalid_" + name, "Query parameter '" + name + "' must be an integer");
        }
    }

    private static String queryParam(URI uri, String name) {
        String query = uri.getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] kv = pair.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String key = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (name.equals(key)) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private static final class BadParameterException extends RuntimeException {
        final String code;

        BadParameterException(String code, String message) {
            super(message);
            this.code = code;
        }
    }

    private static class CallRequest {
        public String operation;
        public String caller;
        public ObjectNode args;
        public Long timestamp;
    }
}
