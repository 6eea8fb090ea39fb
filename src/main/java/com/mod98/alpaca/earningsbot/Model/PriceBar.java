package com.mod98.alpaca.earningsbot.Model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record PriceBar(LocalDate date, BigDecimal close) {}
