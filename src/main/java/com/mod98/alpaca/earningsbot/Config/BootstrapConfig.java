package com.mod98.alpaca.earningsbot.Config;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class BootstrapConfig {

    // Exchange-zoned clock; sessions, trade-log dates and cooldowns all read it.
    @Bean
    Clock marketClock(StrategyProperties props) {
        return Clock.system(ZoneId.of(props.getZoneId()));
    }

    @Bean
    CsvMapper tradeLogCsvMapper() {
        CsvMapper mapper = new CsvMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
