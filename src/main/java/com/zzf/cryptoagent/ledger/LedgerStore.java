package com.zzf.cryptoagent.ledger;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Per-user wallet, transaction list and tool-call log.
 */
public interface LedgerStore {

    /**
     * Returns the wallet, creating it with the seed balance on first access. Idempotent.
     */
    Wallet ensureWallet(String userId);

    Map<String, Double> readBalances(String userId);

    /**
     * Checks the USD balance and, if sufficient, debits USD, credits {@code asset} and appends a
     * BUY record as one indivisible step. An insufficient balance leaves everything untouched.
     */
    BuyResult applyBuy(String userId, String asset, double cryptoAmount, double usdAmount, double price);

    /**
     * Newest first.
     */
    List<TransactionRecord> listTransactions(String userId, int limit);

    void appendCallLog(String userId, JsonNode entry);

    /**
     * Newest first.
     */
    List<JsonNode> listCallLogs(String userId, int limit, int skip);

    int clearCallLogs(String userId);
}
