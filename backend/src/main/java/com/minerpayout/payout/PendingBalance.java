package com.minerpayout.payout;

import java.math.BigDecimal;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accrued, not yet paid amount in native units. Every read-modify-write runs under one lock, so concurrent
 * credits are never lost and a reservation takes exactly what was there.
 */
public class PendingBalance {

    private final ReentrantLock lock = new ReentrantLock();
    private BigDecimal amount = BigDecimal.ZERO;

    /**
     * Adds a non-negative amount and returns the new total.
     */
    public BigDecimal credit(BigDecimal delta) {
        if (delta == null || delta.signum() < 0) {
            throw new IllegalArgumentException("credit must be non-negative: " + delta);
        }
        lock.lock();
        try {
            amount = amount.add(delta);
            return amount;
        } finally {
            lock.unlock();
        }
    }

    /**
     * If the balance is at least {@code threshold}, zeroes it and returns what it held; otherwise returns zero
     * and leaves it untouched.
     */
    public BigDecimal reserveIfAtLeast(BigDecimal threshold) {
        lock.lock();
        try {
            if (amount.signum() == 0 || amount.compareTo(threshold) < 0) {
                return BigDecimal.ZERO;
            }
            BigDecimal reserved = amount;
            amount = BigDecimal.ZERO;
            return reserved;
        } finally {
            lock.unlock();
        }
    }

    public BigDecimal current() {
        lock.lock();
        try {
            return amount;
        } finally {
            lock.unlock();
        }
    }
}
