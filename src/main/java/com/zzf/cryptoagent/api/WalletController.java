package com.zzf.cryptoagent.api;

import com.zzf.cryptoagent.ledger.LedgerStore;
import com.zzf.cryptoagent.ledger.TransactionRecord;
import com.zzf.cryptoagent.model.CryptoAgentException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Direct ledger reads for the UI. These bypass the bridge and are not logged as tool calls.
 */
@RestController
public class WalletController {
    private final LedgerStore ledgerStore;

    public WalletController(LedgerStore ledgerStore) {
        this.ledgerStore = ledgerStore;
    }

    @GetMapping("/api/health")
    public Map<String, Object> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/api/wallet/{userId}/balance")
    public Map<String, Object> balance(@PathVariable String userId) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("user_id", userId);
        out.put("assets", ledgerStore.readBalances(userId));
        return out;
    }

    @GetMapping("/api/wallet/{userId}/transactions")
    public Map<String, Object> transactions(@PathVariable String userId,
                                            @RequestParam(defaultValue = "20") int limit) {
        if (limit < 1 || limit > 500) {
            throw new CryptoAgentException("INVALID_REQUEST", "limit must be between 1 and 500");
        }
        List<TransactionRecord> txs = ledgerStore.listTransactions(userId, limit);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("user_id", userId);
        out.put("transactions", txs);
        return out;
    }
}
