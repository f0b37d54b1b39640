package com.zzf.cryptoagent.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionRecord {
    public static final String TYPE_BUY = "BUY";

    @JsonProperty("user_id")
    private String userId;
    private String type;
    private String symbol;
    private double amount;
    private double price;
    @JsonProperty("usd_value")
    private double usdValue;
    private String timestamp;
}
