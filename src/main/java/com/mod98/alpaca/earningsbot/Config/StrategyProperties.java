package com.mod98.alpaca.earningsbot.Config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "strategy")
@Validated
@Getter
@Setter
public class StrategyProperties {

    // ---- Selection ----
    @Min(0)
    private int daysRange = 5;

    @Min(1)
    private int maxPositions = 20;

    @NotNull
    @DecimalMin("0.0")
    private BigDecimal minPrice = new BigDecimal("5.0");

    @Min(0)
    private long minVolume = 100_000L;

    private boolean excludeOtc = true;

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private BigDecimal marketCapQuintile = new BigDecimal("0.2");

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("0.5")
    private BigDecimal returnQuintile = new BigDecimal("0.2");

    @Min(2)
    private int historyLookbackSessions = 5;

    @Min(2)
    private int brokerHistoryDays = 10;

    @Min(2)
    private int minHistoryPoints = 3;

    @Min(0)
    private int earningsLookbackDays = 30;

    // ---- Capital ----
    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private BigDecimal capitalRatio = new BigDecimal("0.3");

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal longAllocationRatio = new BigDecimal("0.5");

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal shortAllocationRatio = new BigDecimal("0.5");

    // ---- Risk ----
    @Min(0)
    private int cooldownDays = 10;

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private BigDecimal stopLossPercent = new BigDecimal("0.05");

    @Min(0)
    private int holdingDays = 2;

    // ---- Orders ----
    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("0.2")
    private BigDecimal limitOffsetPercent = new BigDecimal("0.01");

    @Min(1)
    private int orderPollAttempts = 10;

    @NotNull
    private Duration orderPollInterval = Duration.ofSeconds(1);

    // ---- Runtime ----
    @NotBlank
    private String tradeHistoryDir = "data/trade_history";

    @NotBlank
    private String zoneId = "America/New_York";

    private boolean loopEnabled = true;

    @NotNull
    private Duration runInterval = Duration.ofHours(4);

    @NotNull
    private Duration stopCheckInterval = Duration.ofSeconds(10);

    @Min(1)
    private int reconnectAttempts = 3;

    @NotNull
    private Duration reconnectInterval = Duration.ofSeconds(5);

    public long cooldownSeconds() {
        return cooldownDays * 86_400L;
    }
}
