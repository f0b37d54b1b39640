package com.zzf.cryptoagent.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.cryptoagent.core.tool.ToolProtocol.ToolOutcome;
import com.zzf.cryptoagent.core.tool.ToolProtocol.ToolSpec;
import com.zzf.cryptoagent.core.util.JsonUtils;
import com.zzf.cryptoagent.core.util.TradingInputs;
import com.zzf.cryptoagent.ledger.BuyResult;
import com.zzf.cryptoagent.ledger.TransactionRecord;
import com.zzf.cryptoagent.ledger.Wallet;
import com.zzf.cryptoagent.market.OrderBook;
import com.zzf.cryptoagent.market.Ticker;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The fixed tool table. Handlers return a {@link ToolOutcome} on every path; logging and
 * envelopes belong to the bridge.
 */
public final class BuiltInToolHandlers {
    public static final String GET_CRYPTO_PRICE = "get_crypto_price";
    public static final String GET_ORDERBOOK = "get_orderbook";
    public static final String BUY_CRYPTO = "buy_crypto";
    public static final String CHECK_BALANCE = "check_balance";
    public static final String TRANSACTION_HISTORY = "transaction_history";

    static final int DEFAULT_ORDERBOOK_LIMIT = 5;
    static final int MAX_ORDERBOOK_LIMIT = 1000;
    static final int DEFAULT_HISTORY_LIMIT = 10;
    static final int MAX_HISTORY_LIMIT = 100;
    private static final String SOURCE = "exchange";

    private BuiltInToolHandlers() {}

    public static void registerAll(ToolRegistry registry) {
        registry.register(new GetCryptoPriceTool());
        registry.register(new GetOrderBookTool());
        registry.register(new BuyCryptoTool());
        registry.register(new CheckBalanceTool());
        registry.register(new TransactionHistoryTool());
    }

    private static final class GetCryptoPriceTool implements ToolHandler {
        private final ToolSpec spec;

        private GetCryptoPriceTool() {
            ObjectMapper mapper = new ObjectMapper();
            Map<String, JsonNode> props = new LinkedHashMap<>();
            props.put("symbol", stringSchema(mapper, "Cryptocurrency symbol, e.g. BTC, ETH, BTC/USDT"));
            this.spec = new ToolSpec(GET_CRYPTO_PRICE,
                    "Get the current real-time market price for a cryptocurrency in USD. "
                            + "Input: symbol like BTC, ETH, SOL, or BTC/USDT.",
                    objectSchema(mapper, props, new String[] { "symbol" }), true);
        }

        @Override
        public ToolSpec spec() {
            return spec;
        }

        @Override
        public ToolOutcome execute(JsonNode args, ToolExecutionContext ctx) {
            String symbol;
            try {
                symbol = TradingInputs.normalizeSymbol(JsonUtils.stringOrNull(args, "symbol"), ctx.defaultQuote);
            } catch (IllegalArgumentException e) {
                return ToolOutcome.error(ToolErrorType.VALIDATION_ERROR, e.getMessage());
            }
            Ticker ticker;
            try {
                ticker = ctx.oracle.getTicker(symbol);
            } catch (RuntimeException e) {
                return ToolOutcome.error(ToolErrorType.EXCHANGE_ERROR, errorMessage(e));
            }
            ObjectNode data = ctx.mapper.createObjectNode();
            data.put("symbol", symbol);
            data.put("last", ticker.getLast());
            data.put("bid", ticker.getBid());
            data.put("ask", ticker.getAsk());
            data.put("high", ticker.getHigh());
            data.put("low", ticker.getLow());
            data.put("volume", ticker.getVolume());
            ObjectNode meta = ctx.mapper.createObjectNode();
            meta.put("source", SOURCE);
            meta.put("endpoint", "get_ticker");
            return ToolOutcome.ok(data, meta);
        }
    }

    private static final class GetOrderBookTool implements ToolHandler {
        private final ToolSpec spec;

        private GetOrderBookTool() {
            ObjectMapper mapper = new ObjectMapper();
            Map<String, JsonNode> props = new LinkedHashMap<>();
            props.put("symbol", stringSchema(mapper, "Trading pair symbol, e.g. BTC/USDT"));
            props.put("limit", integerSchema(mapper, "Number of orders to return", DEFAULT_ORDERBOOK_LIMIT));
            this.spec = new ToolSpec(GET_ORDERBOOK,
                    "Get the order book (buy/sell depth) for a trading pair.",
                    objectSchema(mapper, props, new String[] { "symbol" }), true);
        }

        @Override
        public ToolSpec spec() {
            return spec;
        }

        @Override
        public ToolOutcome execute(JsonNode args, ToolExecutionContext ctx) {
            String symbol;
            int limit;
            try {
                symbol = TradingInputs.normalizeSymbol(JsonUtils.stringOrNull(args, "symbol"), ctx.defaultQuote);
                limit = JsonUtils.intOrDefault(args, "limit", DEFAULT_ORDERBOOK_LIMIT);
                if (limit < 1 || limit > MAX_ORDERBOOK_LIMIT) {
                    throw new IllegalArgumentException("limit must be between 1 and " + MAX_ORDERBOOK_LIMIT);
                }
            } catch (IllegalArgumentException e) {
                return ToolOutcome.error(ToolErrorType.VALIDATION_ERROR, e.getMessage());
            }
            OrderBook book;
            try {
                book = ctx.oracle.getOrderBook(symbol, limit);
            } catch (RuntimeException e) {
                return ToolOutcome.error(ToolErrorType.EXCHANGE_ERROR, errorMessage(e));
            }
            ObjectNode data = ctx.mapper.createObjectNode();
            data.put("symbol", symbol);
            data.set("bids", levels(ctx.mapper, book.getBids(), limit));
            data.set("asks", levels(ctx.mapper, book.getAsks(), limit));
            ObjectNode meta = ctx.mapper.createObjectNode();
            meta.put("source", SOURCE);
            meta.put("endpoint", "get_orderbook");
            meta.put("limit", limit);
            return ToolOutcome.ok(data, meta);
        }

        private static ArrayNode levels(ObjectMapper mapper, List<OrderBook.Level> side, int limit) {
            ArrayNode out = mapper.createArrayNode();
            if (side == null) {
                return out;
            }
            for (OrderBook.Level level : side) {
                if (out.size() >= limit) {
                    break;
                }
                ObjectNode n = out.addObject();
                n.put("price", level.getPrice());
                n.put("quantity", level.getQuantity());
            }
            return out;
        }
    }

    private static final class BuyCryptoTool implements ToolHandler {
        private final ToolSpec spec;

        private BuyCryptoTool() {
            ObjectMapper mapper = new ObjectMapper();
            Map<String, JsonNode> props = new LinkedHashMap<>();
            props.put("symbol", stringSchema(mapper, "Cryptocurrency symbol to buy, e.g. BTC, ETH"));
            props.put("amount", numberSchema(mapper, "Amount in USD to spend"));
            this.spec = new ToolSpec(BUY_CRYPTO,
                    "Simulate buying cryptocurrency with USD. Uses real market price. "
                            + "This is a simulation, no real money is spent.",
                    objectSchema(mapper, props, new String[] { "symbol", "amount" }), true);
        }

        @Override
        public ToolSpec spec() {
            return spec;
        }

        @Override
        public ToolOutcome execute(JsonNode args, ToolExecutionContext ctx) {
            double amount;
            String pair;
            try {
                amount = TradingInputs.positiveAmount(JsonUtils.numberOrNull(args, "amount"), "amount");
                pair = TradingInputs.normalizeSymbol(JsonUtils.stringOrNull(args, "symbol"), ctx.defaultQuote);
            } catch (IllegalArgumentException e) {
                return ToolOutcome.error(ToolErrorType.VALIDATION_ERROR, e.getMessage());
            }
            double price;
            try {
                price = ctx.oracle.getTicker(pair).getLast();
            } catch (RuntimeException e) {
                return ToolOutcome.error(ToolErrorType.EXCHANGE_ERROR, errorMessage(e));
            }
            if (!(price > 0) || Double.isInfinite(price)) {
                return ToolOutcome.error(ToolErrorType.EXCHANGE_ERROR, "Invalid market price for " + pair + ": " + price);
            }
            String asset = TradingInputs.baseAsset(pair);
            double cryptoAmount = amount / price;

            BuyResult result;
            try {
                result = ctx.ledger.applyBuy(ctx.userId, asset, cryptoAmount, amount, price);
            } catch (RuntimeException e) {
                return ToolOutcome.error(ToolErrorType.TOOL_ERROR, errorMessage(e));
            }
            if (!result.isApplied()) {
                return ToolOutcome.error(ToolErrorType.INSUFFICIENT_BALANCE, result.message());
            }
            ObjectNode data = ctx.mapper.createObjectNode();
            data.put("action", "buy");
            data.put("symbol", asset);
            data.put("crypto_amount", cryptoAmount);
            data.put("usd_spent", amount);
            data.put("price", price);
            ObjectNode meta = ctx.mapper.createObjectNode();
            meta.put("simulated", true);
            return ToolOutcome.ok(data, meta);
        }
    }

    private static final class CheckBalanceTool implements ToolHandler {
        private final ToolSpec spec;

        private CheckBalanceTool() {
            ObjectMapper mapper = new ObjectMapper();
            this.spec = new ToolSpec(CHECK_BALANCE,
                    "Get the user's wallet balance with current USD values.",
                    objectSchema(mapper, new LinkedHashMap<>(), new String[] {}), false);
        }

        @Override
        public ToolSpec spec() {
            return spec;
        }

        @Override
        public ToolOutcome execute(JsonNode args, ToolExecutionContext ctx) {
            Wallet wallet;
            try {
                wallet = ctx.ledger.ensureWallet(ctx.userId);
            } catch (RuntimeException e) {
                return ToolOutcome.error(ToolErrorType.TOOL_ERROR, errorMessage(e));
            }
            ArrayNode assets = ctx.mapper.createArrayNode();
            double total = 0.0;
            for (Map.Entry<String, Double> entry : wallet.getAssets().entrySet()) {
                String asset = entry.getKey();
                double balance = entry.getValue() == null ? 0.0 : entry.getValue();
                if (balance <= 0) {
                    continue;
                }
                ObjectNode item = assets.addObject();
                item.put("asset", asset);
                item.put("balance", balance);
                if (Wallet.USD.equals(asset)) {
                    item.put("usd_value", balance);
                    total += balance;
                    continue;
                }
                // An unpriced asset is still listed; only the total skips it.
                try {
                    double price = ctx.oracle.getTicker(asset + "/" + ctx.defaultQuote).getLast();
                    double usdValue = balance * price;
                    item.put("price", price);
                    item.put("usd_value", usdValue);
                    total += usdValue;
                } catch (RuntimeException e) {
                    item.putNull("usd_value");
                }
            }
            ObjectNode data = ctx.mapper.createObjectNode();
            data.set("assets", assets);
            data.put("total_usd", total);
            return ToolOutcome.ok(data);
        }
    }

    private static final class TransactionHistoryTool implements ToolHandler {
        private final ToolSpec spec;

        private TransactionHistoryTool() {
            ObjectMapper mapper = new ObjectMapper();
            Map<String, JsonNode> props = new LinkedHashMap<>();
            props.put("limit", integerSchema(mapper, "Number of transactions to return", DEFAULT_HISTORY_LIMIT));
            this.spec = new ToolSpec(TRANSACTION_HISTORY,
                    "Get the user's recent transaction history.",
                    objectSchema(mapper, props, new String[] {}), false);
        }

        @Override
        public ToolSpec spec() {
            return spec;
        }

        @Override
        public ToolOutcome execute(JsonNode args, ToolExecutionContext ctx) {
            int limit;
            try {
                limit = JsonUtils.intOrDefault(args, "limit", DEFAULT_HISTORY_LIMIT);
            } catch (IllegalArgumentException e) {
                return ToolOutcome.error(ToolErrorType.VALIDATION_ERROR, e.getMessage());
            }
            if (limit <= 0) {
                limit = DEFAULT_HISTORY_LIMIT;
            }
            limit = Math.min(limit, MAX_HISTORY_LIMIT);

            List<TransactionRecord> txs;
            try {
                txs = ctx.ledger.listTransactions(ctx.userId, limit);
            } catch (RuntimeException e) {
                return ToolOutcome.error(ToolErrorType.TOOL_ERROR, errorMessage(e));
            }
            ArrayNode list = ctx.mapper.createArrayNode();
            for (TransactionRecord tx : txs) {
                ObjectNode n = list.addObject();
                n.put("type", tx.getType());
                n.put("symbol", tx.getSymbol());
                n.put("amount", tx.getAmount());
                n.put("price", tx.getPrice());
                n.put("usd_value", tx.getUsdValue());
                n.put("timestamp", tx.getTimestamp());
            }
            ObjectNode data = ctx.mapper.createObjectNode();
            data.set("transactions", list);
            data.put("count", list.size());
            return ToolOutcome.ok(data);
        }
    }

    private static String errorMessage(Throwable e) {
        String msg = e.getMessage();
        return msg == null || msg.isBlank() ? e.getClass().getSimpleName() : msg;
    }

    private static ObjectNode objectSchema(ObjectMapper mapper, Map<String, JsonNode> props, String[] required) {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = mapper.createObjectNode();
        for (Map.Entry<String, JsonNode> entry : props.entrySet()) {
            properties.set(entry.getKey(), entry.getValue());
        }
        schema.set("properties", properties);
        if (required != null && required.length > 0) {
            ArrayNode req = mapper.createArrayNode();
            for (String r : required) {
                req.add(r);
            }
            schema.set("required", req);
        }
        return schema;
    }

    private static ObjectNode stringSchema(ObjectMapper mapper, String description) {
        ObjectNode n = mapper.createObjectNode();
        n.put("type", "string");
        n.put("description", description);
        return n;
    }

    private static ObjectNode integerSchema(ObjectMapper mapper, String description, int defaultValue) {
        ObjectNode n = mapper.createObjectNode();
        n.put("type", "integer");
        n.put("description", description);
        n.put("default", defaultValue);
        return n;
    }

    private static ObjectNode numberSchema(ObjectMapper mapper, String description) {
        ObjectNode n = mapper.createObjectNode();
        n.put("type", "number");
        n.put("description", description);
        return n;
    }
}
