package com.mod98.alpaca.earningsbot.Model;

import java.math.BigDecimal;

/**
 * Live quote. Any field may be {@code null} or zero when the feed has nothing for it.
 */
public record Quote(BigDecimal last, BigDecimal close, BigDecimal bid, BigDecimal ask) {}
