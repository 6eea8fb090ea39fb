package com.mod98.alpaca.earningsbot.Config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "nasdaq")
@Validated
@Getter
@Setter
public class NasdaqProperties {

    @NotBlank
    private String baseUrl = "https://api.nasdaq.com";

    // The public API answers 403 without a browser User-Agent.
    @NotBlank
    private String userAgent = "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36";

    @NotNull
    private Duration calendarCacheTtl = Duration.ofHours(6);

    @NotNull
    private Duration marketCapCacheTtl = Duration.ofHours(24);

    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(20);

    private int maxRetries = 2;

}
