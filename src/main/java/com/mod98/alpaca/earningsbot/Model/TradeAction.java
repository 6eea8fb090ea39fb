package com.mod98.alpaca.earningsbot.Model;

public enum TradeAction {
    BUY,
    SELL;

    public TradeAction opposite() {
        return this == BUY ? SELL : BUY;
    }
}
