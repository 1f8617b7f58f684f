package com.minerpayout.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Only the beneficiary's on-chain balance is cached. Null balances are never stored.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String BENEFICIARY_BALANCE_CACHE = "beneficiaryBalanceCache";

    static final Duration BALANCE_TTL = Duration.ofMinutes(1);

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.setAllowNullValues(false);
        manager.registerCustomCache(BENEFICIARY_BALANCE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(BALANCE_TTL)
                .maximumSize(16)
                .build());
        return manager;
    }
}
