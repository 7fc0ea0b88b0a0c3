package com.flagship.missed_call.admin;

import java.util.Arrays;

public enum AdminAction {
    ADD_WALLET_FUNDS("add-wallet-funds"),
    DEDUCT_WALLET_FUNDS("deduct-wallet-funds"),
    PAUSE("pause"),
    RESUME("resume");

    private final String value;

    AdminAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * @throws IllegalArgumentException for a blank or unknown action name
     */
    public static AdminAction fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Action is required");
        }
        return Arrays.stream(values())
            .filter(action -> action.value.equals(value.trim()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown action: " + value));
    }
}
