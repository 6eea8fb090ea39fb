package com.mod98.alpaca.earningsbot.Model;

public record OrderHandle(String orderId, String symbol) {}
