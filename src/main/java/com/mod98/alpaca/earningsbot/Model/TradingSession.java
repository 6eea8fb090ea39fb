package com.mod98.alpaca.earningsbot.Model;

public enum TradingSession {
    PRE_MARKET("pre-market session"),
    REGULAR("regular session"),
    AFTER_HOURS("after-hours session"),
    CLOSED("market closed");

    private final String description;

    TradingSession(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    public boolean isTradable() {
        return this != CLOSED;
    }
}
