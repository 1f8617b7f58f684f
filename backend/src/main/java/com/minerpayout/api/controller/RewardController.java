package com.minerpayout.api.controller;

import com.minerpayout.api.dto.BeneficiaryResponse;
import com.minerpayout.api.dto.PayoutHistoryResponse;
import com.minerpayout.api.dto.PayoutResponse;
import com.minerpayout.api.dto.PayoutTriggerResponse;
import com.minerpayout.api.dto.PendingRewardsResponse;
import com.minerpayout.payout.BeneficiaryBalanceService;
import com.minerpayout.payout.GasPriceSample;
import com.minerpayout.payout.PendingBalanceView;
import com.minerpayout.payout.RewardPayoutEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * GET /rewards/pending, GET /rewards/history, POST /rewards/payout, GET /rewards/beneficiary.
 * Calls that reach the node run on boundedElastic.
 */
@RestController
@RequestMapping("/api/v1/rewards")
@RequiredArgsConstructor
public class RewardController {

    static final String MINIMUM_NOT_REACHED = "Minimum payout not reached";

    private final RewardPayoutEngine rewardPayoutEngine;
    private final BeneficiaryBalanceService beneficiaryBalanceService;

    @GetMapping("/pending")
    public ResponseEntity<PendingRewardsResponse> pending() {
        PendingBalanceView view = rewardPayoutEngine.getPendingBalance();
        return ResponseEntity.ok(new PendingRewardsResponse(view.amount(), view.minimumPayoutThreshold(), view.readyForPayout()));
    }

    @GetMapping("/history")
    public ResponseEntity<PayoutHistoryResponse> history(@RequestParam(defaultValue = "false") boolean includeFailed) {
        List<PayoutResponse> items = (includeFailed ? rewardPayoutEngine.getPayoutAttempts() : rewardPayoutEngine.getPayoutHistory())
                .stream()
                .map(PayoutResponse::from)
                .toList();
        return ResponseEntity.ok(new PayoutHistoryResponse(items));
    }

    @PostMapping("/payout")
    public Mono<ResponseEntity<PayoutTriggerResponse>> payout() {
        return Mono.fromCallable(rewardPayoutEngine::triggerPayoutIfReady)
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> result
                        .map(p -> ResponseEntity.ok(new PayoutTriggerResponse(true, PayoutResponse.from(p), null)))
                        .orElseGet(() -> ResponseEntity.ok(new PayoutTriggerResponse(false, null, MINIMUM_NOT_REACHED))));
    }

    @GetMapping("/beneficiary")
    public Mono<ResponseEntity<BeneficiaryResponse>> beneficiary() {
        String address = rewardPayoutEngine.beneficiary();
        return Mono.fromCallable(() -> beneficiaryBalanceService.onChainBalance(address))
                .subscribeOn(Schedulers.boundedElastic())
                .map(balance -> ResponseEntity.ok(new BeneficiaryResponse(
                        address,
                        balance,
                        rewardPayoutEngine.currentGasPrice().map(GasPriceSample::gwei).orElse(null))));
    }
}
