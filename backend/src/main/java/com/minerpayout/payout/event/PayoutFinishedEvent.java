package com.minerpayout.payout.event;

import com.minerpayout.domain.PayoutRecord;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a payout attempt reaches COMPLETED or FAILED and its record is in the ledger.
 * A completed payout evicts the cached beneficiary balance.
 */
@Getter
public class PayoutFinishedEvent extends ApplicationEvent {

    private final transient PayoutRecord record;

    public PayoutFinishedEvent(Object source, PayoutRecord record) {
        super(source);
        this.record = record;
    }
}
