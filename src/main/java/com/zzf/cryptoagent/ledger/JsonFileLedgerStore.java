package com.zzf.cryptoagent.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.cryptoagent.config.CryptoAgentConfig;
import com.zzf.cryptoagent.core.util.UserIds;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Ledger backed by JSON documents on the local filesystem.
 * <p>
 * Each user has one ledger document holding the wallet and the transaction list, replaced as a
 * whole through a temp file and an atomic move, so a buy never lands half-written. Call-log
 * entries go to a separate JSON-lines file per user.
 */
@Slf4j
@Service
public class JsonFileLedgerStore implements LedgerStore {
    private final Path root;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final double initialUsd;
    private final String defaultUserId;
    private final ConcurrentHashMap<String, ReadWriteLock> locks = new ConcurrentHashMap<>();

    public JsonFileLedgerStore(CryptoAgentConfig config, ObjectMapper objectMapper, Clock clock) {
        this.root = Paths.get(config.getStorage().getDirectory());
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.initialUsd = config.getWallet().getInitialUsd();
        this.defaultUserId = config.getWallet().getDefaultUserId();
    }

    @PostConstruct
    public void init() {
        try {
            Files.createDirectories(root.resolve("ledgers"));
            Files.createDirectories(root.resolve("calllogs"));
        } catch (IOException e) {
            throw new LedgerException("Failed to initialize ledger directory " + root, e);
        }
        if (defaultUserId != null && !defaultUserId.isBlank()) {
            ensureWallet(defaultUserId);
        }
        log.info("ledger.init root={} initialUsd={}", root, initialUsd);
    }

    @Override
    public Wallet ensureWallet(String userId) {
        UserIds.requireValid(userId);
        ReadWriteLock lock = getLock(userId);
        lock.writeLock().lock();
        try {
            return loadOrSeed(userId).getWallet();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Map<String, Double> readBalances(String userId) {
        return new LinkedHashMap<>(ensureWallet(userId).getAssets());
    }

    @Override
    public BuyResult applyBuy(String userId, String asset, double cryptoAmount, double usdAmount, double price) {
        UserIds.requireValid(userId);
        ReadWriteLock lock = getLock(userId);
        lock.writeLock().lock();
        try {
            UserLedger ledger = loadOrSeed(userId);
            Wallet wallet = ledger.getWallet();
            double usd = wallet.balance(Wallet.USD);
            if (usd < usdAmount) {
                log.info("ledger.buy.rejected userId={} asset={} required={} available={}", userId, asset, usdAmount, usd);
                return BuyResult.insufficient(usdAmount, usd);
            }
            String now = clock.instant().toString();
            wallet.getAssets().merge(Wallet.USD, -usdAmount, Double::sum);
            wallet.getAssets().merge(asset, cryptoAmount, Double::sum);
            wallet.setUpdatedAt(now);
            TransactionRecord tx = TransactionRecord.builder()
                    .userId(userId)
                    .type(TransactionRecord.TYPE_BUY)
                    .symbol(asset)
                    .amount(cryptoAmount)
                    .price(price)
                    .usdValue(usdAmount)
                    .timestamp(now)
                    .build();
            ledger.getTransactions().add(tx);
            save(userId, ledger);
            log.info("ledger.buy.applied userId={} asset={} crypto={} usd={} price={}", userId, asset, cryptoAmount, usdAmount, price);
            return BuyResult.applied(tx, usd);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<TransactionRecord> listTransactions(String userId, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        ReadWriteLock lock = getLock(userId);
        lock.readLock().lock();
        try {
            UserLedger ledger = load(userId);
            if (ledger == null || ledger.getTransactions().isEmpty()) {
                return Collections.emptyList();
            }
            List<TransactionRecord> all = ledger.getTransactions();
            List<TransactionRecord> out = new ArrayList<>();
            for (int i = all.size() - 1; i >= 0 && out.size() < limit; i--) {
                out.add(all.get(i));
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void appendCallLog(String userId, JsonNode entry) {
        ObjectNode doc = objectMapper.createObjectNode();
        doc.put("user_id", userId);
        doc.put("type", entry.path("type").asText("tools/call"));
        doc.set("request", entry.path("request").isMissingNode() ? objectMapper.createObjectNode() : entry.get("request"));
        doc.set("response", entry.path("response").isMissingNode() ? objectMapper.createObjectNode() : entry.get("response"));
        doc.put("timestamp", entry.path("timestamp").asDouble(0));
        doc.put("created_at", clock.instant().toString());
        Path target = callLogPath(userId);
        ReadWriteLock lock = getLock("calllog:" + userId);
        lock.writeLock().lock();
        try {
            String line = objectMapper.writeValueAsString(doc) + "\n";
            Files.writeString(target, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new LedgerException("Failed to append call log: " + target, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<JsonNode> listCallLogs(String userId, int limit, int skip) {
        Path target = callLogPath(userId);
        ReadWriteLock lock = getLock("calllog:" + userId);
        lock.readLock().lock();
        try {
            if (!Files.exists(target)) {
                return Collections.emptyList();
            }
            List<String> lines = Files.readAllLines(target, StandardCharsets.UTF_8);
            List<JsonNode> out = new ArrayList<>();
            int skipped = 0;
            for (int i = lines.size() - 1; i >= 0 && out.size() < limit; i--) {
                String line = lines.get(i);
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node;
                try {
                    node = objectMapper.readTree(line);
                } catch (JsonProcessingException e) {
                    // torn append from an interrupted write
                    log.warn("calllog.line.skip userId={} line={} err={}", userId, i + 1, e.getOriginalMessage());
                    continue;
                }
                if (skipped < skip) {
                    skipped++;
                    continue;
                }
                out.add(node);
            }
            return out;
        } catch (IOException e) {
            throw new LedgerException("Failed to read call log: " + target, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int clearCallLogs(String userId) {
        Path target = callLogPath(userId);
        ReadWriteLock lock = getLock("calllog:" + userId);
        lock.writeLock().lock();
        try {
            if (!Files.exists(target)) {
                return 0;
            }
            int count = 0;
            for (String line : Files.readAllLines(target, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    count++;
                }
            }
            Files.deleteIfExists(target);
            return count;
        } catch (IOException e) {
            throw new LedgerException("Failed to clear call log: " + target, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private UserLedger loadOrSeed(String userId) {
        UserLedger ledger = load(userId);
        if (ledger != null) {
            return ledger;
        }
        String now = clock.instant().toString();
        Map<String, Double> assets = new LinkedHashMap<>();
        assets.put(Wallet.USD, initialUsd);
        ledger = new UserLedger(new Wallet(userId, assets, now, now), new ArrayList<>());
        save(userId, ledger);
        log.info("ledger.wallet.seeded userId={} usd={}", userId, initialUsd);
        return ledger;
    }

    private UserLedger load(String userId) {
        Path target = ledgerPath(userId);
        if (!Files.exists(target)) {
            return null;
        }
        try {
            UserLedger ledger = objectMapper.readValue(target.toFile(), UserLedger.class);
            if (ledger.getWallet().getAssets() == null) {
                ledger.getWallet().setAssets(new LinkedHashMap<>());
            }
            ledger.getWallet().getAssets().putIfAbsent(Wallet.USD, 0.0);
            if (ledger.getTransactions() == null) {
                ledger.setTransactions(new ArrayList<>());
            }
            return ledger;
        } catch (IOException e) {
            throw new LedgerException("Failed to read ledger: " + target, e);
        }
    }

    private void save(String userId, UserLedger ledger) {
        Path target = ledgerPath(userId);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), ledger);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new LedgerException("Failed to write ledger: " + target, e);
        }
    }

    private ReadWriteLock getLock(String key) {
        return locks.computeIfAbsent(key, k -> new ReentrantReadWriteLock());
    }

    private Path ledgerPath(String userId) {
        return root.resolve("ledgers").resolve(UserIds.requireValid(userId) + ".json");
    }

    private Path callLogPath(String userId) {
        return root.resolve("calllogs").resolve(UserIds.requireValid(userId) + ".jsonl");
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class UserLedger {
        private Wallet wallet;
        private List<TransactionRecord> transactions = new ArrayList<>();
    }
}
