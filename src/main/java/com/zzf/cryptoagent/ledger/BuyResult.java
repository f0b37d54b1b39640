package com.zzf.cryptoagent.ledger;

import java.util.Locale;

public final class BuyResult {
    private final boolean applied;
    private final double required;
    private final double available;
    private final TransactionRecord transaction;

    private BuyResult(boolean applied, double required, double available, TransactionRecord transaction) {
        this.applied = applied;
        this.required = required;
        this.available = available;
        this.transaction = transaction;
    }

    public static BuyResult applied(TransactionRecord transaction, double availableBefore) {
        return new BuyResult(true, transaction.getUsdValue(), availableBefore, transaction);
    }

    public static BuyResult insufficient(double required, double available) {
        return new BuyResult(false, required, available, null);
    }

    public boolean isApplied() {
        return applied;
    }

    public double getRequired() {
        return required;
    }

    public double getAvailable() {
        return available;
    }

    public TransactionRecord getTransaction() {
        return transaction;
    }

    public String message() {
        if (applied) {
            return "ok";
        }
        return String.format(Locale.US, "Insufficient balance. Need $%,.2f, have $%,.2f", required, available);
    }
}
