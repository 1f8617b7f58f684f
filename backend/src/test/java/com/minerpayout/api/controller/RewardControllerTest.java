package com.minerpayout.api.controller;

import com.minerpayout.domain.PayoutRecord;
import com.minerpayout.domain.PayoutStatus;
import com.minerpayout.ledger.RpcException;
import com.minerpayout.payout.BeneficiaryBalanceService;
import com.minerpayout.payout.GasPriceSample;
import com.minerpayout.payout.PayoutExecutionException;
import com.minerpayout.payout.PendingBalanceView;
import com.minerpayout.payout.RewardPayoutEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;

@WebFluxTest(controllers = RewardController.class)
class RewardControllerTest {

    private static final String BENEFICIARY = "0x2222222222222222222222222222222222222222";

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    RewardPayoutEngine rewardPayoutEngine;
    @MockBean
    BeneficiaryBalanceService beneficiaryBalanceService;

    @Test
    @DisplayName("pending endpoint reports balance, threshold and readiness")
    void pending() {
        when(rewardPayoutEngine.getPendingBalance())
                .thenReturn(new PendingBalanceView(new BigDecimal("0.008"), new BigDecimal("0.01"), false));

        webTestClient.get().uri("/api/v1/rewards/pending")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.amount").isEqualTo(0.008)
                .jsonPath("$.minimumPayoutThreshold").isEqualTo(0.01)
                .jsonPath("$.readyForPayout").isEqualTo(false);
    }

    @Test
    @DisplayName("history lists completed payouts by default")
    void history_completedOnly() {
        when(rewardPayoutEngine.getPayoutHistory()).thenReturn(List.of(payout(1, PayoutStatus.COMPLETED)));

        webTestClient.get().uri("/api/v1/rewards/history")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.items.length()").isEqualTo(1)
                .jsonPath("$.items[0].sequence").isEqualTo(1)
                .jsonPath("$.items[0].status").isEqualTo("COMPLETED")
                .jsonPath("$.items[0].transactionHash").isEqualTo("0xtx1")
                .jsonPath("$.items[0].payoutAmount").isEqualTo(0.01188);
    }

    @Test
    @DisplayName("history with includeFailed lists every attempt")
    void history_includeFailed() {
        when(rewardPayoutEngine.getPayoutAttempts())
                .thenReturn(List.of(payout(1, PayoutStatus.FAILED), payout(2, PayoutStatus.COMPLETED)));

        webTestClient.get().uri("/api/v1/rewards/history?includeFailed=true")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.items.length()").isEqualTo(2)
                .jsonPath("$.items[0].status").isEqualTo("FAILED")
                .jsonPath("$.items[0].failureReason").isEqualTo("insufficient funds");
    }

    @Test
    @DisplayName("manual payout returns the completed record")
    void payout_success() {
        when(rewardPayoutEngine.triggerPayoutIfReady()).thenReturn(Optional.of(payout(3, PayoutStatus.COMPLETED)));

        webTestClient.post().uri("/api/v1/rewards/payout")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.payout.sequence").isEqualTo(3)
                .jsonPath("$.payout.recipient").isEqualTo(BENEFICIARY);
    }

    @Test
    @DisplayName("manual payout below threshold reports minimum not reached")
    void payout_belowThreshold() {
        when(rewardPayoutEngine.triggerPayoutIfReady()).thenReturn(Optional.empty());

        webTestClient.post().uri("/api/v1/rewards/payout")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.message").isEqualTo("Minimum payout not reached");
    }

    @Test
    @DisplayName("failed manual payout maps to 502 PAYOUT_FAILED")
    void payout_failure() {
        when(rewardPayoutEngine.triggerPayoutIfReady())
                .thenThrow(new PayoutExecutionException(payout(4, PayoutStatus.FAILED), new RuntimeException("insufficient funds")));

        webTestClient.post().uri("/api/v1/rewards/payout")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("PAYOUT_FAILED")
                .jsonPath("$.timestamp").exists();
    }

    @Test
    @DisplayName("beneficiary endpoint combines on-chain balance and gas sample")
    void beneficiary() {
        when(rewardPayoutEngine.beneficiary()).thenReturn(BENEFICIARY);
        when(beneficiaryBalanceService.onChainBalance(BENEFICIARY)).thenReturn(new BigDecimal("2.5"));
        when(rewardPayoutEngine.currentGasPrice())
                .thenReturn(Optional.of(new GasPriceSample(new BigInteger("35000000000"), Instant.now())));

        webTestClient.get().uri("/api/v1/rewards/beneficiary")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.address").isEqualTo(BENEFICIARY)
                .jsonPath("$.onChainBalance").isEqualTo(2.5)
                .jsonPath("$.gasPriceGwei").isEqualTo(35.0);
    }

    @Test
    @DisplayName("unreachable node maps to 503")
    void beneficiary_ledgerUnavailable() {
        when(rewardPayoutEngine.beneficiary()).thenReturn(BENEFICIARY);
        when(beneficiaryBalanceService.onChainBalance(BENEFICIARY))
                .thenThrow(new RpcException("eth_getBalance", "failed after 5 attempts: timeout"));

        webTestClient.get().uri("/api/v1/rewards/beneficiary")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("LEDGER_UNAVAILABLE");
    }

    private static PayoutRecord payout(long sequence, PayoutStatus status) {
        return PayoutRecord.builder()
                .id("p" + sequence)
                .sequence(sequence)
                .transactionHash(status == PayoutStatus.COMPLETED ? "0xtx" + sequence : null)
                .reservedAmount(new BigDecimal("0.012"))
                .payoutAmount(new BigDecimal("0.01188"))
                .feeAmount(new BigDecimal("0.00012"))
                .recipient(BENEFICIARY)
                .blockReference(1000L)
                .createdAt(Instant.parse("2025-01-02T10:00:00Z"))
                .completedAt(Instant.parse("2025-01-02T10:00:05Z"))
                .status(status)
                .failureReason(status == PayoutStatus.FAILED ? "insufficient funds" : null)
                .build();
    }
}
