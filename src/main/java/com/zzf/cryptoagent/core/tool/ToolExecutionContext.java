package com.zzf.cryptoagent.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.cryptoagent.ledger.LedgerStore;
import com.zzf.cryptoagent.market.PriceOracle;

public class ToolExecutionContext {
    public final String userId;
    public final ObjectMapper mapper;
    public final PriceOracle oracle;
    public final LedgerStore ledger;
    public final String defaultQuote;

    public ToolExecutionContext(String userId, ObjectMapper mapper, PriceOracle oracle, LedgerStore ledger, String defaultQuote) {
        this.userId = userId;
        this.mapper = mapper;
        this.oracle = oracle;
        this.ledger = ledger;
        this.defaultQuote = defaultQuote == null || defaultQuote.isBlank() ? "USDT" : defaultQuote.trim().toUpperCase();
    }
}
