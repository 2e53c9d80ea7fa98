package com.studfee.harvester.config;

import com.studfee.harvester.crawl.http.DelayStrategy;
import com.studfee.harvester.crawl.http.JitteredDelayStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HarvestConfig {

    @Bean
    public DelayStrategy delayStrategy() {
        return new JitteredDelayStrategy();
    }
}
