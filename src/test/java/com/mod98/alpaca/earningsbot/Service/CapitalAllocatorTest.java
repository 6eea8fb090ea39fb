package com.mod98.alpaca.earningsbot.Service;

import com.mod98.alpaca.earningsbot.Config.StrategyProperties;
import com.mod98.alpaca.earningsbot.Service.CapitalAllocator.Allocation;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class CapitalAllocatorTest {

    private final StrategyProperties props = new StrategyProperties();
    private final CapitalAllocator allocator = new CapitalAllocator(props);

    @Test
    void splitsThirtyPercentEvenlyBetweenSides() {
        Allocation a = allocator.allocate(new BigDecimal("100000"), 2, 3);

        assertThat(a.total()).isEqualByComparingTo("30000");
        assertThat(a.longCapital()).isEqualByComparingTo("15000");
        assertThat(a.shortCapital()).isEqualByComparingTo("15000");
        assertThat(a.perLong()).isEqualByComparingTo("7500");
        assertThat(a.perShort()).isEqualByComparingTo("5000");
        assertThat(a.isEmpty()).isFalse();
    }

    @Test
    void emptySideGetsItsWholeBudgetPerSymbol() {
        Allocation a = allocator.allocate(new BigDecimal("10000"), 0, 1);

        assertThat(a.perLong()).isEqualByComparingTo("1500");
        assertThat(a.perShort()).isEqualByComparingTo("1500");
    }

    @Test
    void customRatiosAreHonoured() {
        props.setCapitalRatio(new BigDecimal("0.5"));
        props.setLongAllocationRatio(new BigDecimal("0.8"));
        props.setShortAllocationRatio(new BigDecimal("0.2"));

        Allocation a = allocator.allocate(new BigDecimal("1000"), 1, 1);

        assertThat(a.perLong()).isEqualByComparingTo("400");
        assertThat(a.perShort()).isEqualByComparingTo("100");
    }

    @Test
    void nonPositiveNetLiquidationAllocatesNothing() {
        assertThat(allocator.allocate(BigDecimal.ZERO, 1, 1).isEmpty()).isTrue();
        assertThat(allocator.allocate(new BigDecimal("-5"), 1, 1).isEmpty()).isTrue();
        assertThat(allocator.allocate(null, 1, 1).isEmpty()).isTrue();
    }

    @Test
    void quantityIsFloorOfCapitalOverPrice() {
        assertThat(CapitalAllocator.quantityFor(new BigDecimal("1000"), new BigDecimal("333"))).isEqualTo(3);
        assertThat(CapitalAllocator.quantityFor(new BigDecimal("999.99"), new BigDecimal("1000"))).isZero();
        assertThat(CapitalAllocator.quantityFor(new BigDecimal("1000"), BigDecimal.ZERO)).isZero();
    }
}
