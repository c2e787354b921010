package com.tony.transferMarket.config;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.SynchronizedRandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class MarketBeans {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Tirages de l'IA (ordre des clubs, probabilité d'offre), partagé entre parties
    @Bean
    public RandomGenerator marketRandom() {
        return new SynchronizedRandomGenerator(new Well19937c());
    }

    @Bean(name = "aiMarketExecutor")
    public ThreadPoolTaskExecutor aiMarketExecutor(TransferMarketProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getAi().getPoolSize());
        executor.setMaxPoolSize(properties.getAi().getPoolSize());
        executor.setQueueCapacity(properties.getAi().getQueueCapacity());
        executor.setThreadNamePrefix("ai-market-");
        executor.initialize();
        return executor;
    }
}
