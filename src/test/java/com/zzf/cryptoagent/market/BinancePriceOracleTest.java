package com.zzf.cryptoagent.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BinancePriceOracleTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testMarketId() {
        assertEquals("BTCUSDT", BinancePriceOracle.toMarketId("BTC/USDT"));
        assertEquals("ETHBTC", BinancePriceOracle.toMarketId("eth/btc"));
        assertThrows(ExchangeException.class, () -> BinancePriceOracle.toMarketId(" "));
    }

    @Test
    void testParseTicker() throws Exception {
        JsonNode body = mapper.readTree("{\"symbol\":\"BTCUSDT\",\"lastPrice\":\"50123.45\",\"bidPrice\":\"50123.00\","
                + "\"askPrice\":\"50124.00\",\"highPrice\":\"51000.00\",\"lowPrice\":\"49000.00\","
                + "\"volume\":\"1234.5\",\"closeTime\":1700000000000}");

        Ticker ticker = BinancePriceOracle.parseTicker("BTC/USDT", body);

        assertEquals("BTC/USDT", ticker.getSymbol());
        assertEquals(50123.45, ticker.getLast());
        assertEquals(50123.0, ticker.getBid());
        assertEquals(50124.0, ticker.getAsk());
        assertEquals(51000.0, ticker.getHigh());
        assertEquals(49000.0, ticker.getLow());
        assertEquals(1234.5, ticker.getVolume());
        assertEquals(1_700_000_000_000L, ticker.getTimestamp());
    }

    @Test
    void testParseTickerRejectsErrorBody() throws Exception {
        JsonNode body = mapper.readTree("{\"code\":-1121,\"msg\":\"Invalid symbol.\"}");
        assertThrows(ExchangeException.class, () -> BinancePriceOracle.parseTicker("NOPE/USDT", body));
        JsonNode garbage = mapper.readTree("{\"lastPrice\":\"abc\"}");
        assertThrows(ExchangeException.class, () -> BinancePriceOracle.parseTicker("BTC/USDT", garbage));
    }

    @Test
    void testParseOrderBook() throws Exception {
        JsonNode body = mapper.readTree("{\"lastUpdateId\":1,"
                + "\"bids\":[[\"100.5\",\"2.0\"],[\"100.4\",\"1.5\"],[\"100.3\",\"9\"]],"
                + "\"asks\":[[\"100.6\",\"0.5\"],[\"bad\"]]}");

        OrderBook book = BinancePriceOracle.parseOrderBook("X/USDT", body, 2);

        assertEquals(2, book.getBids().size());
        assertEquals(100.5, book.getBids().get(0).getPrice());
        assertEquals(1.5, book.getBids().get(1).getQuantity());
        assertEquals(1, book.getAsks().size());
        assertEquals(100.6, book.getAsks().get(0).getPrice());
    }

    @Test
    void testParseOrderBookRejectsMissingSides() throws Exception {
        JsonNode body = mapper.readTree("{\"bids\":[]}");
        assertThrows(ExchangeException.class, () -> BinancePriceOracle.parseOrderBook("X/USDT", body, 5));
    }
}
