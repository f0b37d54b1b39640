package com.zzf.cryptoagent.core.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.cryptoagent.config.CryptoAgentConfig;
import com.zzf.cryptoagent.core.ratelimit.RateLimiter;
import com.zzf.cryptoagent.core.tool.ToolExecutionContext;
import com.zzf.cryptoagent.core.tool.ToolRegistry;
import com.zzf.cryptoagent.core.util.UserIds;
import com.zzf.cryptoagent.ledger.LedgerStore;
import com.zzf.cryptoagent.market.PriceOracle;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one {@link ToolBridge} per user key. All bridges share the tool table, the rate
 * limiter and the ledger; each has its own log and id counter.
 */
@Slf4j
@Service
public class ToolBridgeService {
    private final ToolRegistry registry = ToolRegistry.builtIn();
    private final ConcurrentHashMap<String, ToolBridge> bridges = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final PriceOracle oracle;
    private final LedgerStore ledger;
    private final RateLimiter rateLimiter;
    private final MeterRegistry meterRegistry;
    private final CryptoAgentConfig config;
    private final Clock clock;

    public ToolBridgeService(ObjectMapper objectMapper, PriceOracle oracle, LedgerStore ledger, RateLimiter rateLimiter,
                             MeterRegistry meterRegistry, CryptoAgentConfig config, Clock clock) {
        this.objectMapper = objectMapper;
        this.oracle = oracle;
        this.ledger = ledger;
        this.rateLimiter = rateLimiter;
        this.meterRegistry = meterRegistry;
        this.config = config;
        this.clock = clock;
    }

    public ToolBridge bridgeFor(String userId) {
        String key = UserIds.requireValid(userId);
        return bridges.computeIfAbsent(key, this::create);
    }

    private ToolBridge create(String userId) {
        ToolExecutionContext ctx = new ToolExecutionContext(userId, objectMapper, oracle, ledger, config.getDefaultQuote());
        CallLogSink sink = (user, entry) -> ledger.appendCallLog(user, entry.toJson(objectMapper));
        log.info("bridge.create userId={} tools={}", userId, registry.size());
        return new ToolBridge(registry, ctx, rateLimiter, sink, meterRegistry, clock);
    }
}
