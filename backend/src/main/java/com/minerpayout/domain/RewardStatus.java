package com.minerpayout.domain;

/**
 * PENDING until folded into a payout reservation.
 */
public enum RewardStatus {
    PENDING,
    INCLUDED
}
