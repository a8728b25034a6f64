package com.mwor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class FairnessInfrastructureConfig {

    @Bean
    public Clock fairnessClock() {
        return Clock.systemUTC();
    }

    /**
     * Runs oracle queries so callers can bound each attempt with a timeout.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService oracleExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "mwor-vrf-oracle-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
