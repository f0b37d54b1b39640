package com.zzf.cryptoagent.market;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Ticker {
    private String symbol;
    private double last;
    private double bid;
    private double ask;
    private double high;
    private double low;
    private double volume;
    private long timestamp;
}
