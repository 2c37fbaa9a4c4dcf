package com.work.gateway.core.watch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static com.work.gateway.core.support.ValidationUtils.requireNonNull;

/**
 * JSON-RPC 2.0 订阅报文的编解码。
 * <pre>
 * 请求：{"jsonrpc":"2.0","id":7,"method":"signatureSubscribe","params":["&lt;sig&gt;",{"commitment":"confirmed"}]}
 * 应答：{"jsonrpc":"2.0","id":7,"result":4123}
 * 通知：{"jsonrpc":"2.0","method":"signatureNotification","params":{"subscription":4123,"result":{...}}}
 * </pre>
 */
public class JsonRpcSubscriptionCodec {

    private final ObjectMapper mapper;
    private final SubscriptionMethods methods;

    public JsonRpcSubscriptionCodec(ObjectMapper mapper, SubscriptionMethods methods) {
        this.mapper = requireNonNull(mapper, "mapper");
        this.methods = requireNonNull(methods, "methods");
    }

    public String subscribe(SubscriptionKind kind, long requestId, String target) {
        ObjectNode root = request(requestId, methods.subscribeMethod(kind));
        ArrayNode params = root.putArray("params");
        params.add(target);
        ObjectNode options = params.addObject();
        if (kind == SubscriptionKind.ACCOUNT) {
            options.put("encoding", "jsonParsed");
        }
        if (methods.getCommitment() != null) {
            options.put("commitment", methods.getCommitment());
        }
        return write(root);
    }

    public String unsubscribe(SubscriptionKind kind, long requestId, long serverId) {
        ObjectNode root = request(requestId, methods.unsubscribeMethod(kind));
        root.putArray("params").add(serverId);
        return write(root);
    }

    LiveMessage decode(String text) throws JsonProcessingException {
        JsonNode root = mapper.readTree(text);
        if (root == null || !root.isObject()) {
            return LiveMessage.other();
        }
        JsonNode params = root.path("params");
        if (root.hasNonNull("method") && params.path("subscription").canConvertToLong()) {
            return LiveMessage.notification(params.get("subscription").asLong(), params.path("result"));
        }
        JsonNode id = root.path("id");
        if (id.canConvertToLong() && root.path("result").canConvertToLong()) {
            return LiveMessage.ack(id.asLong(), root.get("result").asLong());
        }
        if (root.hasNonNull("error")) {
            JsonNode error = root.get("error");
            Long requestId = id.canConvertToLong() ? id.asLong() : null;
            return LiveMessage.error(requestId, error.path("message").asText(error.toString()));
        }
        return LiveMessage.other();
    }

    /**
     * 通知中 result.value.err 非空表示交易已上链但执行失败。
     */
    public boolean isFailure(JsonNode result) {
        if (result == null) {
            return false;
        }
        JsonNode err = result.path("value").path("err");
        return !err.isMissingNode() && !err.isNull();
    }

    private ObjectNode request(long requestId, String method) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.put("id", requestId);
        root.put("method", method);
        return root;
    }

    private String write(ObjectNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to encode subscription request", e);
        }
    }
}
