package com.minerpayout.payout.job;

import com.minerpayout.ledger.RpcException;
import com.minerpayout.payout.RewardPayoutEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-samples the network gas price. On failure the previous sample stays in use.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GasPriceRefreshJob {

    private final RewardPayoutEngine rewardPayoutEngine;

    @Scheduled(
            fixedRateString = "${minerpayout.payout.gas-price-refresh-ms:600000}",
            initialDelayString = "${minerpayout.payout.gas-price-refresh-ms:600000}")
    public void runScheduled() {
        try {
            rewardPayoutEngine.refreshGasPrice();
        } catch (RpcException e) {
            log.warn("Gas price refresh failed, keeping previous sample: {}", e.getMessage());
        }
    }
}
