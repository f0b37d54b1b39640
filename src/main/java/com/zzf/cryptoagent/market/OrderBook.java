package com.zzf.cryptoagent.market;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth snapshot. Both sides are ordered best price first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderBook {
    private String symbol;
    @Builder.Default
    private List<Level> bids = new ArrayList<>();
    @Builder.Default
    private List<Level> asks = new ArrayList<>();
    private long timestamp;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Level {
        private double price;
        private double quantity;
    }
}
