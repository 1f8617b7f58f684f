package com.minerpayout.payout;

import com.minerpayout.config.CaffeineConfig;
import com.minerpayout.domain.PayoutStatus;
import com.minerpayout.ledger.LedgerClient;
import com.minerpayout.payout.event.PayoutFinishedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * On-chain balance of an address, cached briefly. A completed payout clears the cache so the next read
 * reflects the transfer once the node has it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BeneficiaryBalanceService {

    private final LedgerClient ledgerClient;
    private final CacheManager cacheManager;

    @Cacheable(cacheNames = CaffeineConfig.BENEFICIARY_BALANCE_CACHE, key = "#address")
    public BigDecimal onChainBalance(String address) {
        return ledgerClient.getBalance(address);
    }

    @EventListener
    public void onPayoutFinished(PayoutFinishedEvent event) {
        if (event.getRecord().getStatus() != PayoutStatus.COMPLETED) {
            return;
        }
        Cache cache = cacheManager.getCache(CaffeineConfig.BENEFICIARY_BALANCE_CACHE);
        if (cache != null) {
            cache.clear();
            log.debug("Beneficiary balance cache cleared after payout {}", event.getRecord().getId());
        }
    }
}
