package com.minerpayout.payout.job;

import com.minerpayout.payout.PayoutExecutionException;
import com.minerpayout.payout.RewardPayoutEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic payout trigger. Pays balances that crossed the threshold while another payout was in flight,
 * and retries balances restored after a failed payout.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PayoutSweepJob {

    private final RewardPayoutEngine rewardPayoutEngine;

    @Scheduled(
            fixedRateString = "${minerpayout.payout.payout-interval-ms:3600000}",
            initialDelayString = "${minerpayout.payout.payout-interval-ms:3600000}")
    public void runScheduled() {
        try {
            rewardPayoutEngine.triggerPayoutIfReady()
                    .ifPresent(p -> log.info("Scheduled payout {} completed", p.getId()));
        } catch (PayoutExecutionException e) {
            log.warn("Scheduled payout failed, will retry next interval: {}", e.getMessage());
        }
    }
}
