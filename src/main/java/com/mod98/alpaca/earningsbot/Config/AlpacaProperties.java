package com.mod98.alpaca.earningsbot.Config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "alpaca")
@Validated
@Getter
@Setter
public class AlpacaProperties {

    @NotBlank
    private String baseUrl; // https://paper-api.alpaca.markets

    @NotBlank
    private String dataUrl; // https://data.alpaca.markets

    @NotBlank
    private String apiKeyId;

    @NotBlank
    private String apiSecretKey;

    // iex on the free plan, sip with a market data subscription
    @NotBlank
    private String feed = "iex";

    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(20);

    @Min(0)
    private int maxRetries = 2;

}
