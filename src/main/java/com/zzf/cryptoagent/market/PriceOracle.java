package com.zzf.cryptoagent.market;

/**
 * Market data source. Symbols are already normalized pairs such as {@code BTC/USDT}.
 * Any transport or lookup fault surfaces as {@link ExchangeException}.
 */
public interface PriceOracle {

    Ticker getTicker(String symbol);

    OrderBook getOrderBook(String symbol, int depth);
}
