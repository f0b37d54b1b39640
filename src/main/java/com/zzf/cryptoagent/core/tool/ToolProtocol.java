package com.zzf.cryptoagent.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

public final class ToolProtocol {
    public static final String JSONRPC_VERSION = "2.0";
    public static final String METHOD_LIST = "tools/list";
    public static final String METHOD_CALL = "tools/call";
    public static final int METHOD_NOT_FOUND = -32601;

    private ToolProtocol() {}

    public static final class ToolSpec {
        private final String name;
        private final String description;
        private final JsonNode inputSchema;
        private final boolean rateLimited;

        public ToolSpec(String name, String description, JsonNode inputSchema, boolean rateLimited) {
            this.name = name == null ? "" : name.trim();
            this.description = description == null ? "" : description.trim();
            this.inputSchema = inputSchema;
            this.rateLimited = rateLimited;
        }

        public String getName() {
            return name;
        }

        public String getDescription() {
            return description;
        }

        public JsonNode getInputSchema() {
            return inputSchema;
        }

        public boolean isRateLimited() {
            return rateLimited;
        }

        public ObjectNode toJson(ObjectMapper mapper) {
            ObjectNode out = mapper.createObjectNode();
            out.put("name", name);
            out.put("description", description);
            out.set("inputSchema", inputSchema == null ? mapper.createObjectNode() : inputSchema.deepCopy());
            return out;
        }
    }

    /**
     * Normalized handler result. Exactly one of {@code data} (success) or {@code errorType}
     * (failure) is meaningful.
     */
    public static final class ToolOutcome {
        private final boolean success;
        private final JsonNode data;
        private final JsonNode metadata;
        private final ToolErrorType errorType;
        private final String message;
        private final long timestamp;

        private ToolOutcome(boolean success, JsonNode data, JsonNode metadata, ToolErrorType errorType, String message, long timestamp) {
            this.success = success;
            this.data = data;
            this.metadata = metadata;
            this.errorType = errorType;
            this.message = message == null ? "" : message;
            this.timestamp = timestamp;
        }

        public static ToolOutcome ok(JsonNode data) {
            return ok(data, null);
        }

        public static ToolOutcome ok(JsonNode data, JsonNode metadata) {
            return new ToolOutcome(true, data, metadata, null, "", System.currentTimeMillis());
        }

        public static ToolOutcome error(ToolErrorType type, String message) {
            ToolErrorType t = type == null ? ToolErrorType.TOOL_ERROR : type;
            return new ToolOutcome(false, null, null, t, message, System.currentTimeMillis());
        }

        public boolean isSuccess() {
            return success;
        }

        public JsonNode getData() {
            return data;
        }

        public JsonNode getMetadata() {
            return metadata;
        }

        public ToolErrorType getErrorType() {
            return errorType;
        }

        public String getMessage() {
            return message;
        }

        public long getTimestamp() {
            return timestamp;
        }

        public ObjectNode toJson(ObjectMapper mapper) {
            ObjectNode out = mapper.createObjectNode();
            out.put("success", success);
            if (success) {
                out.set("data", data == null ? mapper.nullNode() : data);
                out.put("timestamp", timestamp);
                if (metadata != null && metadata.size() > 0) {
                    out.set("metadata", metadata);
                }
                return out;
            }
            ObjectNode error = out.putObject("error");
            error.put("type", errorType.wireName());
            error.put("message", message);
            error.put("timestamp", timestamp);
            return out;
        }

        /**
         * Text rendering handed back to the model: pretty JSON of the data, or a one-line error.
         */
        public String toDisplayText(ObjectMapper mapper) {
            if (!success) {
                return "Error (" + errorType.wireName() + "): " + (message.isEmpty() ? "Unknown error" : message);
            }
            if (data == null || data.isNull()) {
                return "{}";
            }
            if (data.isTextual()) {
                return data.asText();
            }
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
            } catch (Exception e) {
                return data.toString();
            }
        }
    }
}
