package com.minerpayout.share;

import com.minerpayout.config.AsyncConfig;
import com.minerpayout.domain.ShareAcceptedEvent;
import com.minerpayout.ledger.RpcException;
import com.minerpayout.payout.RewardPayoutEngine;
import com.minerpayout.payout.ShareValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Consumes share-accepted events on the share executor and credits them to the beneficiary.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ShareAcceptedListener {

    private final RewardPayoutEngine rewardPayoutEngine;

    @Async(AsyncConfig.SHARE_EXECUTOR)
    @EventListener
    public void onShareAccepted(ShareAcceptedEvent event) {
        try {
            rewardPayoutEngine.accrueReward(event);
        } catch (ShareValidationException e) {
            log.warn("Share at block {} rejected: {}", event.blockReference(), e.getMessage());
        } catch (RpcException e) {
            log.error("Share {} at block {} not credited, ledger unavailable: {}", event.hash(), event.blockReference(),
                    e.getMessage());
        } catch (RuntimeException e) {
            log.error("Share {} at block {} not credited: {}", event.hash(), event.blockReference(), e.getMessage(), e);
        }
    }
}
