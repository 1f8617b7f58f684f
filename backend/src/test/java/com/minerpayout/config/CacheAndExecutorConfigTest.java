package com.minerpayout.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.math.BigDecimal;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.SHARE_EXECUTOR)
    Executor shareExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Test
    @DisplayName("beneficiary balance cache is created and usable")
    void cacheCreatedAndUsed() {
        assertThat(cacheManager.getCache(CaffeineConfig.BENEFICIARY_BALANCE_CACHE)).isNotNull();

        Cache cache = cacheManager.getCache(CaffeineConfig.BENEFICIARY_BALANCE_CACHE);
        cache.put("0xabc", new BigDecimal("1.5"));
        assertThat(cache.get("0xabc", BigDecimal.class)).isEqualByComparingTo("1.5");
        assertThatThrownBy(() -> cache.put("0xdef", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("share executor is created with a fixed pool")
    void shareExecutorCreated() {
        assertThat(shareExecutor).isInstanceOfSatisfying(ThreadPoolTaskExecutor.class, e -> {
            assertThat(e.getCorePoolSize()).isEqualTo(4);
            assertThat(e.getMaxPoolSize()).isEqualTo(4);
            assertThat(e.getThreadNamePrefix()).isEqualTo("share-");
            assertThat(e.getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);
        });
    }

    @Test
    @DisplayName("scheduler pool is created and configured")
    void schedulerPoolCreated() {
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("scheduler-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(2);
    }
}
