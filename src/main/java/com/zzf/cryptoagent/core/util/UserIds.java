package com.zzf.cryptoagent.core.util;

import com.zzf.cryptoagent.model.CryptoAgentException;

import java.util.regex.Pattern;

public final class UserIds {
    private static final Pattern USER_ID = Pattern.compile("[A-Za-z0-9_.@-]{1,64}");

    private UserIds() {}

    /**
     * User keys double as file names in the ledger store, so only a conservative charset passes.
     */
    public static String requireValid(String userId) {
        if (userId == null || !USER_ID.matcher(userId).matches() || userId.startsWith(".")) {
            throw new CryptoAgentException("INVALID_USER_ID", "Invalid user id: " + userId);
        }
        return userId;
    }
}
