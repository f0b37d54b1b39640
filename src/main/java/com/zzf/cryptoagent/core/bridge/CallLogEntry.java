package com.zzf.cryptoagent.core.bridge;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One JSON-RPC request/response pair as recorded by {@link ToolBridge}.
 */
public final class CallLogEntry {
    private final long id;
    private final String type;
    private final ObjectNode request;
    private final ObjectNode response;
    private final double timestamp;

    CallLogEntry(long id, String type, ObjectNode request, ObjectNode response, double timestamp) {
        this.id = id;
        this.type = type;
        this.request = request;
        this.response = response;
        this.timestamp = timestamp;
    }

    public long getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public ObjectNode getRequest() {
        return request.deepCopy();
    }

    public ObjectNode getResponse() {
        return response.deepCopy();
    }

    /**
     * Epoch seconds, fractional.
     */
    public double getTimestamp() {
        return timestamp;
    }

    @JsonIgnore
    public boolean isError() {
        return response.has("error") || response.path("result").path("isError").asBoolean(false);
    }

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode out = mapper.createObjectNode();
        out.put("id", id);
        out.put("type", type);
        out.set("request", request.deepCopy());
        out.set("response", response.deepCopy());
        out.put("timestamp", timestamp);
        return out;
    }
}
