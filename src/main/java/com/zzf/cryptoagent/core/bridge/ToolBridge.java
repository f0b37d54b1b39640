package com.zzf.cryptoagent.core.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.cryptoagent.core.ratelimit.RateLimiter;
import com.zzf.cryptoagent.core.tool.ToolErrorType;
import com.zzf.cryptoagent.core.tool.ToolExecutionContext;
import com.zzf.cryptoagent.core.tool.ToolHandler;
import com.zzf.cryptoagent.core.tool.ToolProtocol;
import com.zzf.cryptoagent.core.tool.ToolProtocol.ToolOutcome;
import com.zzf.cryptoagent.core.tool.ToolProtocol.ToolSpec;
import com.zzf.cryptoagent.core.tool.ToolRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-user dispatcher between the agent and the tool handlers.
 * <p>
 * Every call, including {@code tools/list} and calls to unknown tools, receives the next request
 * id, yields a JSON-RPC 2.0 response, is appended to the in-memory log and is handed to the
 * {@link CallLogSink}. Calls are serialized on the instance, so a bridge shared between threads
 * still produces a gap-free id sequence. The log and the id counter have their own lock: reading
 * or clearing the log does not wait for a call stuck on the exchange.
 */
public class ToolBridge {
    private static final Logger logger = LoggerFactory.getLogger(ToolBridge.class);
    static final String RATE_LIMIT_MESSAGE = "API rate limit exceeded. Please try again later.";

    private final String userId;
    private final ToolRegistry registry;
    private final ToolExecutionContext ctx;
    private final RateLimiter rateLimiter;
    private final CallLogSink sink;
    private final MeterRegistry meters;
    private final Counter persistFailures;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Object logLock = new Object();
    private final List<CallLogEntry> callLog = new ArrayList<>();
    private long nextId = 1;

    public ToolBridge(ToolRegistry registry, ToolExecutionContext ctx, RateLimiter rateLimiter,
                      CallLogSink sink, MeterRegistry meters, Clock clock) {
        this.userId = ctx.userId;
        this.registry = registry;
        this.ctx = ctx;
        this.rateLimiter = rateLimiter;
        this.sink = sink == null ? CallLogSink.NONE : sink;
        this.meters = meters;
        this.persistFailures = meters.counter("cryptoagent.calllog.persist.failures");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.mapper = ctx.mapper;
    }

    public synchronized CallLogEntry listTools() {
        long id = allocateId();
        ObjectNode request = mapper.createObjectNode();
        request.put("jsonrpc", ToolProtocol.JSONRPC_VERSION);
        request.put("method", ToolProtocol.METHOD_LIST);
        request.put("id", id);

        ArrayNode tools = mapper.createArrayNode();
        for (ToolSpec spec : registry.listSpecs()) {
            tools.add(spec.toJson(mapper));
        }
        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", ToolProtocol.JSONRPC_VERSION);
        response.putObject("result").set("tools", tools);
        response.put("id", id);
        return record(id, ToolProtocol.METHOD_LIST, request, response);
    }

    public synchronized CallLogEntry callTool(String name, JsonNode arguments) {
        long id = allocateId();
        String toolName = name == null ? "" : name.trim();
        JsonNode args = arguments == null || arguments.isNull() ? mapper.createObjectNode() : arguments.deepCopy();

        ObjectNode request = mapper.createObjectNode();
        request.put("jsonrpc", ToolProtocol.JSONRPC_VERSION);
        request.put("method", ToolProtocol.METHOD_CALL);
        ObjectNode params = request.putObject("params");
        params.put("name", toolName);
        params.set("arguments", args);
        request.put("id", id);

        ToolHandler handler = registry.get(toolName);
        if (handler == null) {
            logger.warn("tool.not_found userId={} id={} tool={}", userId, id, toolName);
            meters.counter("cryptoagent.tool.calls", "tool", "unknown", "outcome", "not_found").increment();
            ObjectNode response = mapper.createObjectNode();
            response.put("jsonrpc", ToolProtocol.JSONRPC_VERSION);
            ObjectNode error = response.putObject("error");
            error.put("code", ToolProtocol.METHOD_NOT_FOUND);
            error.put("message", "Tool not found: " + toolName);
            response.put("id", id);
            return record(id, ToolProtocol.METHOD_CALL, request, response);
        }

        long t0 = System.nanoTime();
        logger.info("tool.call userId={} id={} tool={}", userId, id, toolName);
        ToolOutcome outcome = invoke(handler, toolName, args);
        long tookMs = (System.nanoTime() - t0) / 1_000_000L;
        String outcomeTag = outcome.isSuccess() ? "ok" : outcome.getErrorType().wireName();
        logger.info("tool.result userId={} id={} tool={} outcome={} tookMs={}", userId, id, toolName, outcomeTag, tookMs);
        meters.counter("cryptoagent.tool.calls", "tool", toolName, "outcome", outcomeTag).increment();

        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", ToolProtocol.JSONRPC_VERSION);
        ObjectNode result = response.putObject("result");
        ObjectNode text = result.putArray("content").addObject();
        text.put("type", "text");
        text.put("text", outcome.toDisplayText(mapper));
        result.put("isError", !outcome.isSuccess());
        result.set("structuredResult", outcome.toJson(mapper));
        response.put("id", id);
        return record(id, ToolProtocol.METHOD_CALL, request, response);
    }

    public List<CallLogEntry> getLog() {
        synchronized (logLock) {
            return new ArrayList<>(callLog);
        }
    }

    public void clearLog() {
        synchronized (logLock) {
            callLog.clear();
            nextId = 1;
        }
    }

    public String getUserId() {
        return userId;
    }

    private long allocateId() {
        synchronized (logLock) {
            return nextId++;
        }
    }

    private ToolOutcome invoke(ToolHandler handler, String toolName, JsonNode args) {
        if (handler.spec().isRateLimited() && !rateLimiter.admit()) {
            logger.warn("tool.rate_limited userId={} tool={}", userId, toolName);
            return ToolOutcome.error(ToolErrorType.RATE_LIMIT_EXCEEDED, RATE_LIMIT_MESSAGE);
        }
        try {
            ToolOutcome outcome = handler.execute(args, ctx);
            if (outcome == null) {
                return ToolOutcome.error(ToolErrorType.TOOL_ERROR, "Tool returned no result");
            }
            return outcome;
        } catch (Exception e) {
            logger.warn("tool.fail userId={} tool={} err={}", userId, toolName, e.toString());
            String msg = e.getMessage();
            return ToolOutcome.error(ToolErrorType.TOOL_ERROR,
                    msg == null || msg.isBlank() ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + msg);
        }
    }

    private CallLogEntry record(long id, String type, ObjectNode request, ObjectNode response) {
        CallLogEntry entry = new CallLogEntry(id, type, request, response, clock.millis() / 1000.0);
        synchronized (logLock) {
            callLog.add(entry);
        }
        try {
            sink.persist(userId, entry);
        } catch (Exception e) {
            persistFailures.increment();
            logger.warn("calllog.persist.fail userId={} id={} type={} err={}", userId, id, type, e.toString());
        }
        return entry;
    }
}
