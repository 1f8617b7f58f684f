package com.minerpayout.domain;

import java.math.BigDecimal;

/**
 * Application event: the share source validated a share. Consumed by
 * {@link com.minerpayout.share.ShareAcceptedListener}.
 */
public record ShareAcceptedEvent(long blockReference, String hash, BigDecimal difficulty) {
}
