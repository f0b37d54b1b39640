package com.zzf.cryptoagent.ledger;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Wallet {
    public static final String USD = "USD";

    private String userId;
    private Map<String, Double> assets = new LinkedHashMap<>();
    private String createdAt;
    private String updatedAt;

    public double balance(String asset) {
        Double v = assets == null ? null : assets.get(asset);
        return v == null ? 0.0 : v;
    }
}
