package com.zzf.cryptoagent.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.cryptoagent.config.CryptoAgentConfig;
import com.zzf.cryptoagent.model.CryptoAgentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileLedgerStoreTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private JsonFileLedgerStore store;

    @BeforeEach
    void setUp() {
        CryptoAgentConfig config = new CryptoAgentConfig();
        config.getStorage().setDirectory(tempDir.toString());
        objectMapper = new ObjectMapper();
        store = new JsonFileLedgerStore(config, objectMapper, Clock.systemUTC());
        store.init();
    }

    @Test
    void testInitSeedsDefaultUser() {
        assertTrue(Files.exists(tempDir.resolve("ledgers").resolve("user_default.json")));
        assertEquals(10_000.0, store.readBalances("user_default").get(Wallet.USD));
    }

    @Test
    void testEnsureWalletIsIdempotent() {
        Wallet first = store.ensureWallet("alice");
        store.applyBuy("alice", "ETH", 0.05, 100.0, 2000.0);
        Wallet second = store.ensureWallet("alice");

        assertEquals(first.getCreatedAt(), second.getCreatedAt());
        assertEquals(9_900.0, second.balance(Wallet.USD));
        assertEquals(0.05, second.balance("ETH"));
    }

    @Test
    void testApplyBuyDebitsCreditsAndRecords() {
        BuyResult result = store.applyBuy("alice", "ETH", 0.05, 100.0, 2000.0);

        assertTrue(result.isApplied());
        assertEquals(10_000.0, result.getAvailable());
        assertEquals("ETH", result.getTransaction().getSymbol());
        Map<String, Double> balances = store.readBalances("alice");
        assertEquals(9_900.0, balances.get(Wallet.USD));
        assertEquals(0.05, balances.get("ETH"));

        List<TransactionRecord> txs = store.listTransactions("alice", 10);
        assertEquals(1, txs.size());
        TransactionRecord tx = txs.get(0);
        assertEquals(TransactionRecord.TYPE_BUY, tx.getType());
        assertEquals("ETH", tx.getSymbol());
        assertEquals(0.05, tx.getAmount());
        assertEquals(2000.0, tx.getPrice());
        assertEquals(100.0, tx.getUsdValue());
        assertNotNull(tx.getTimestamp());
    }

    @Test
    void testApplyBuyAccumulatesExistingHolding() {
        store.applyBuy("alice", "BTC", 0.01, 500.0, 50_000.0);
        store.applyBuy("alice", "BTC", 0.02, 1_000.0, 50_000.0);

        Map<String, Double> balances = store.readBalances("alice");
        assertEquals(8_500.0, balances.get(Wallet.USD));
        assertEquals(0.03, balances.get("BTC"), 1e-12);
    }

    @Test
    void testInsufficientBalanceChangesNothing() {
        store.applyBuy("alice", "ETH", 0.05, 100.0, 2000.0);

        BuyResult result = store.applyBuy("alice", "BTC", 1.0, 50_000.0, 50_000.0);

        assertFalse(result.isApplied());
        assertEquals(50_000.0, result.getRequired());
        assertEquals(9_900.0, result.getAvailable());
        assertEquals("Insufficient balance. Need $50,000.00, have $9,900.00", result.message());
        Map<String, Double> balances = store.readBalances("alice");
        assertEquals(9_900.0, balances.get(Wallet.USD));
        assertFalse(balances.containsKey("BTC"));
        assertEquals(1, store.listTransactions("alice", 10).size());
    }

    @Test
    void testSpendingExactBalanceIsAllowed() {
        BuyResult result = store.applyBuy("bob", "ETH", 5.0, 10_000.0, 2000.0);

        assertTrue(result.isApplied());
        assertEquals(0.0, store.readBalances("bob").get(Wallet.USD));
    }

    @Test
    void testTransactionsNewestFirstAndLimited() {
        store.applyBuy("alice", "BTC", 0.001, 50.0, 50_000.0);
        store.applyBuy("alice", "ETH", 0.01, 20.0, 2_000.0);
        store.applyBuy("alice", "SOL", 1.0, 100.0, 100.0);

        List<TransactionRecord> txs = store.listTransactions("alice", 2);
        assertEquals(2, txs.size());
        assertEquals("SOL", txs.get(0).getSymbol());
        assertEquals("ETH", txs.get(1).getSymbol());
        assertTrue(store.listTransactions("alice", 0).isEmpty());
        assertTrue(store.listTransactions("nobody", 5).isEmpty());
    }

    @Test
    void testConcurrentBuysNeverOverdraw() throws Exception {
        store.ensureWallet("racer");
        int threads = 20;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<BuyResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return store.applyBuy("racer", "ETH", 0.5, 1_000.0, 2_000.0);
                }));
            }
            start.countDown();
            int applied = 0;
            for (Future<BuyResult> f : futures) {
                if (f.get(30, TimeUnit.SECONDS).isApplied()) {
                    applied++;
                }
            }
            assertEquals(10, applied);
        } finally {
            pool.shutdownNow();
        }

        Map<String, Double> balances = store.readBalances("racer");
        assertEquals(0.0, balances.get(Wallet.USD));
        assertEquals(5.0, balances.get("ETH"), 1e-9);
        assertEquals(10, store.listTransactions("racer", 100).size());
    }

    @Test
    void testLedgerSurvivesReload() {
        store.applyBuy("alice", "ETH", 0.05, 100.0, 2000.0);

        CryptoAgentConfig config = new CryptoAgentConfig();
        config.getStorage().setDirectory(tempDir.toString());
        JsonFileLedgerStore reopened = new JsonFileLedgerStore(config, objectMapper, Clock.systemUTC());
        reopened.init();

        assertEquals(9_900.0, reopened.readBalances("alice").get(Wallet.USD));
        assertEquals(1, reopened.listTransactions("alice", 10).size());
    }

    @Test
    void testCallLogAppendListAndClear() {
        for (int i = 1; i <= 3; i++) {
            ObjectNode entry = objectMapper.createObjectNode();
            entry.put("id", i);
            entry.put("type", "tools/call");
            entry.putObject("request").put("id", i);
            entry.putObject("response").put("id", i);
            entry.put("timestamp", 1_700_000_000.0 + i);
            store.appendCallLog("alice", entry);
        }

        List<JsonNode> newest = store.listCallLogs("alice", 2, 0);
        assertEquals(2, newest.size());
        assertEquals(3, newest.get(0).path("request").path("id").asInt());
        assertEquals(2, newest.get(1).path("request").path("id").asInt());
        assertEquals("alice", newest.get(0).path("user_id").asText());
        assertTrue(newest.get(0).hasNonNull("created_at"));

        List<JsonNode> skipped = store.listCallLogs("alice", 10, 2);
        assertEquals(1, skipped.size());
        assertEquals(1, skipped.get(0).path("request").path("id").asInt());

        assertEquals(3, store.clearCallLogs("alice"));
        assertTrue(store.listCallLogs("alice", 10, 0).isEmpty());
        assertEquals(0, store.clearCallLogs("alice"));
    }

    @Test
    void testTornCallLogLineIsSkipped() throws Exception {
        ObjectNode first = objectMapper.createObjectNode();
        first.put("type", "tools/list");
        first.putObject("request").put("id", 1);
        store.appendCallLog("alice", first);
        Files.writeString(tempDir.resolve("calllogs").resolve("alice.jsonl"),
                "{\"user_id\":\"alice\",\"type\":\"tools/ca\n", StandardOpenOption.APPEND);
        ObjectNode third = objectMapper.createObjectNode();
        third.put("type", "tools/call");
        third.putObject("request").put("id", 3);
        store.appendCallLog("alice", third);

        List<JsonNode> logs = store.listCallLogs("alice", 10, 0);
        assertEquals(2, logs.size());
        assertEquals(3, logs.get(0).path("request").path("id").asInt());
        assertEquals(1, logs.get(1).path("request").path("id").asInt());

        List<JsonNode> paged = store.listCallLogs("alice", 10, 1);
        assertEquals(1, paged.size());
        assertEquals(1, paged.get(0).path("request").path("id").asInt());
    }

    @Test
    void testRejectsPathLikeUserIds() {
        assertThrows(CryptoAgentException.class, () -> store.ensureWallet("../escape"));
        assertThrows(CryptoAgentException.class, () -> store.ensureWallet(".hidden"));
        assertThrows(CryptoAgentException.class, () -> store.ensureWallet(""));
    }
}
