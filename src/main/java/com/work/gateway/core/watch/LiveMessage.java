package com.work.gateway.core.watch;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 一条解码后的入站消息。
 */
final class LiveMessage {

    enum Kind {
        /**
         * 订阅请求的应答：requestId -> serverId
         */
        ACK,
        NOTIFICATION,
        ERROR,
        OTHER
    }

    private final Kind kind;
    private final Long requestId;
    private final Long serverId;
    private final JsonNode result;
    private final String errorMessage;

    private LiveMessage(Kind kind, Long requestId, Long serverId, JsonNode result, String errorMessage) {
        this.kind = kind;
        this.requestId = requestId;
        this.serverId = serverId;
        this.result = result;
        this.errorMessage = errorMessage;
    }

    static LiveMessage ack(long requestId, long serverId) {
        return new LiveMessage(Kind.ACK, requestId, serverId, null, null);
    }

    static LiveMessage notification(long serverId, JsonNode result) {
        return new LiveMessage(Kind.NOTIFICATION, null, serverId, result, null);
    }

    static LiveMessage error(Long requestId, String errorMessage) {
        return new LiveMessage(Kind.ERROR, requestId, null, null, errorMessage);
    }

    static LiveMessage other() {
        return new LiveMessage(Kind.OTHER, null, null, null, null);
    }

    Kind getKind() {
        return kind;
    }

    Long getRequestId() {
        return requestId;
    }

    Long getServerId() {
        return serverId;
    }

    JsonNode getResult() {
        return result;
    }

    String getErrorMessage() {
        return errorMessage;
    }
}
