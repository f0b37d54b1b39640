package com.zzf.cryptoagent.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.cryptoagent.config.CryptoAgentConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Public Binance spot market data. No API key is needed for these endpoints.
 */
@Slf4j
@Service
public class BinancePriceOracle implements PriceOracle {
    private static final int MAX_ERROR_BODY_LENGTH = 300;

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final URI baseUri;
    private final Duration timeout;

    public BinancePriceOracle(HttpClient exchangeHttpClient, ObjectMapper mapper, CryptoAgentConfig config) {
        this.http = exchangeHttpClient;
        this.mapper = mapper;
        String base = config.getExchange().getBaseUrl();
        this.baseUri = URI.create(base.endsWith("/") ? base.substring(0, base.length() - 1) : base);
        this.timeout = Duration.ofSeconds(Math.max(1, config.getExchange().getTimeoutSeconds()));
    }

    @Override
    public Ticker getTicker(String symbol) {
        JsonNode body = get("/api/v3/ticker/24hr?symbol=" + encode(toMarketId(symbol)));
        return parseTicker(symbol, body);
    }

    @Override
    public OrderBook getOrderBook(String symbol, int depth) {
        int limit = Math.max(1, Math.min(depth, 5000));
        JsonNode body = get("/api/v3/depth?symbol=" + encode(toMarketId(symbol)) + "&limit=" + limit);
        return parseOrderBook(symbol, body, limit);
    }

    static String toMarketId(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new ExchangeException("symbol is blank");
        }
        return symbol.replace("/", "").trim().toUpperCase();
    }

    static Ticker parseTicker(String symbol, JsonNode body) {
        if (body == null || !body.hasNonNull("lastPrice")) {
            throw new ExchangeException("malformed ticker response for " + symbol);
        }
        return Ticker.builder()
                .symbol(symbol)
                .last(decimal(body, "lastPrice"))
                .bid(decimal(body, "bidPrice"))
                .ask(decimal(body, "askPrice"))
                .high(decimal(body, "highPrice"))
                .low(decimal(body, "lowPrice"))
                .volume(decimal(body, "volume"))
                .timestamp(body.path("closeTime").asLong(System.currentTimeMillis()))
                .build();
    }

    static OrderBook parseOrderBook(String symbol, JsonNode body, int limit) {
        if (body == null || !body.path("bids").isArray() || !body.path("asks").isArray()) {
            throw new ExchangeException("malformed order book response for " + symbol);
        }
        return OrderBook.builder()
                .symbol(symbol)
                .bids(levels(body.path("bids"), limit))
                .asks(levels(body.path("asks"), limit))
                .timestamp(System.currentTimeMillis())
                .build();
    }

    private JsonNode get(String pathAndQuery) {
        URI uri = URI.create(baseUri + pathAndQuery);
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeException("exchange request interrupted: " + uri.getPath(), e);
        } catch (IOException e) {
            throw new ExchangeException("exchange unreachable: " + e.getMessage(), e);
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            String body = resp.body() == null ? "" : resp.body();
            log.warn("exchange.http.fail path={} status={}", uri.getPath(), resp.statusCode());
            throw new ExchangeException("exchange returned HTTP " + resp.statusCode() + ": " + truncate(body, MAX_ERROR_BODY_LENGTH));
        }
        try {
            return mapper.readTree(resp.body());
        } catch (IOException e) {
            throw new ExchangeException("exchange returned invalid JSON", e);
        }
    }

    private static List<OrderBook.Level> levels(JsonNode side, int limit) {
        List<OrderBook.Level> out = new ArrayList<>();
        for (JsonNode row : side) {
            if (out.size() >= limit) {
                break;
            }
            if (!row.isArray() || row.size() < 2) {
                continue;
            }
            out.add(new OrderBook.Level(parse(row.get(0)), parse(row.get(1))));
        }
        return out;
    }

    private static double decimal(JsonNode body, String field) {
        return parse(body.path(field));
    }

    // Binance encodes decimals as strings.
    private static double parse(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return 0.0;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.parseDouble(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new ExchangeException("unparseable decimal: " + node.asText(), e);
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String truncate(String s, int maxChars) {
        return s.length() <= maxChars ? s : s.substring(0, maxChars);
    }
}
