package com.zzf.cryptoagent.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.cryptoagent.core.bridge.CallLogEntry;
import com.zzf.cryptoagent.core.bridge.ToolBridgeService;
import com.zzf.cryptoagent.core.util.UserIds;
import com.zzf.cryptoagent.ledger.LedgerStore;
import com.zzf.cryptoagent.model.CryptoAgentException;
import lombok.Data;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/mcp/{userId}")
public class McpController {
    private final ToolBridgeService bridgeService;
    private final LedgerStore ledgerStore;

    public McpController(ToolBridgeService bridgeService, LedgerStore ledgerStore) {
        this.bridgeService = bridgeService;
        this.ledgerStore = ledgerStore;
    }

    @GetMapping("/tools")
    public ObjectNode listTools(@PathVariable String userId) {
        return bridgeService.bridgeFor(userId).listTools().getResponse();
    }

    @PostMapping("/call")
    public ObjectNode callTool(@PathVariable String userId, @RequestBody ToolCallRequest req) {
        if (req == null || req.getName() == null || req.getName().isBlank()) {
            throw new CryptoAgentException("INVALID_REQUEST", "name is required");
        }
        return bridgeService.bridgeFor(userId).callTool(req.getName(), req.getArguments()).getResponse();
    }

    @GetMapping("/log")
    public List<CallLogEntry> sessionLog(@PathVariable String userId) {
        return bridgeService.bridgeFor(userId).getLog();
    }

    @DeleteMapping("/log")
    public Map<String, Object> clearSessionLog(@PathVariable String userId) {
        bridgeService.bridgeFor(userId).clearLog();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("user_id", userId);
        out.put("cleared", true);
        return out;
    }

    @GetMapping("/logs")
    public Map<String, Object> persistedLogs(@PathVariable String userId,
                                             @RequestParam(defaultValue = "50") int limit,
                                             @RequestParam(defaultValue = "0") int skip) {
        UserIds.requireValid(userId);
        if (limit < 1 || limit > 500 || skip < 0) {
            throw new CryptoAgentException("INVALID_REQUEST", "limit must be 1..500 and skip >= 0");
        }
        List<JsonNode> logs = ledgerStore.listCallLogs(userId, limit, skip);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("user_id", userId);
        out.put("logs", logs);
        out.put("count", logs.size());
        return out;
    }

    @DeleteMapping("/logs")
    public Map<String, Object> clearPersistedLogs(@PathVariable String userId) {
        UserIds.requireValid(userId);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("user_id", userId);
        out.put("deleted", ledgerStore.clearCallLogs(userId));
        return out;
    }

    @Data
    public static class ToolCallRequest {
        private String name;
        private JsonNode arguments;
    }
}
