package com.minerpayout.payout.job;

import com.minerpayout.domain.PayoutRecord;
import com.minerpayout.domain.PayoutStatus;
import com.minerpayout.payout.PayoutExecutionException;
import com.minerpayout.payout.RewardPayoutEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PayoutSweepJobTest {

    @Mock
    private RewardPayoutEngine rewardPayoutEngine;

    @InjectMocks
    private PayoutSweepJob job;

    @Test
    @DisplayName("scheduled sweep delegates to the payout trigger")
    void runScheduled_triggersPayout() {
        when(rewardPayoutEngine.triggerPayoutIfReady()).thenReturn(Optional.empty());

        job.runScheduled();

        verify(rewardPayoutEngine).triggerPayoutIfReady();
    }

    @Test
    @DisplayName("failed payout does not escape the scheduler thread")
    void runScheduled_failureIsContained() {
        PayoutRecord failed = PayoutRecord.builder()
                .id("p1")
                .reservedAmount(new BigDecimal("0.02"))
                .status(PayoutStatus.FAILED)
                .failureReason("insufficient funds")
                .build();
        when(rewardPayoutEngine.triggerPayoutIfReady())
                .thenThrow(new PayoutExecutionException(failed, new RuntimeException("insufficient funds")));

        assertThatCode(job::runScheduled).doesNotThrowAnyException();
    }
}
