package com.mod98.alpaca.earningsbot.Model;

public enum OrderType {
    MARKET,
    LIMIT
}
