package com.minerpayout.domain;

public enum PayoutStatus {
    EXECUTING,
    COMPLETED,
    FAILED
}
