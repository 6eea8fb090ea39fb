package com.mod98.alpaca.earningsbot.Service;

import com.mod98.alpaca.earningsbot.Config.StrategyProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

@RequiredArgsConstructor
@Component
public class CapitalAllocator {

    private static final Logger log = LoggerFactory.getLogger(CapitalAllocator.class);

    private final StrategyProperties props;

    /** Capital split for one cycle. All amounts are USD. */
    public record Allocation(
            BigDecimal total,
            BigDecimal longCapital,
            BigDecimal shortCapital,
            BigDecimal perLong,
            BigDecimal perShort
    ) {
        public static Allocation none() {
            return new Allocation(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
        }

        public boolean isEmpty() {
            return total.signum() <= 0;
        }
    }

    public Allocation allocate(BigDecimal netLiquidation, int longCount, int shortCount) {
        if (netLiquidation == null || netLiquidation.signum() <= 0) {
            log.error("Net liquidation is {}, nothing to allocate", netLiquidation);
            return Allocation.none();
        }
        BigDecimal total = netLiquidation.multiply(props.getCapitalRatio());
        BigDecimal longCapital = total.multiply(props.getLongAllocationRatio());
        BigDecimal shortCapital = total.multiply(props.getShortAllocationRatio());

        Allocation a = new Allocation(
                total,
                longCapital,
                shortCapital,
                longCapital.divide(BigDecimal.valueOf(Math.max(longCount, 1)), 2, RoundingMode.DOWN),
                shortCapital.divide(BigDecimal.valueOf(Math.max(shortCount, 1)), 2, RoundingMode.DOWN)
        );
        log.info("💵 Capital {} of {} → long {} ({} each), short {} ({} each)",
                total.setScale(2, RoundingMode.HALF_UP), netLiquidation,
                longCapital.setScale(2, RoundingMode.HALF_UP), a.perLong(),
                shortCapital.setScale(2, RoundingMode.HALF_UP), a.perShort());
        return a;
    }

    /** Whole shares that {@code capital} buys at {@code price}; zero for a non-positive price. */
    public static int quantityFor(BigDecimal capital, BigDecimal price) {
        if (capital == null || price == null || price.signum() <= 0 || capital.signum() <= 0) return 0;
        return capital.divide(price, 0, RoundingMode.FLOOR).intValue();
    }
}
