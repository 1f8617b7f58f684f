package com.minerpayout.payout;

import com.minerpayout.domain.PayoutRecord;
import com.minerpayout.domain.PayoutRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Append-only audit log of finalized payout attempts, in completion order. Kept in memory and written through
 * to payout_records; loaded from the repository on first access, or again later if that load failed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PayoutLedger {

    private final PayoutRecordRepository payoutRecordRepository;

    private final List<PayoutRecord> records = new ArrayList<>();
    private long lastSequence;
    private boolean loaded;

    /**
     * Assigns the next sequence number, appends and persists. Returns the stored record.
     */
    public synchronized PayoutRecord append(PayoutRecord finalized) {
        ensureLoaded();
        PayoutRecord sequenced = finalized.toBuilder().sequence(++lastSequence).build();
        records.add(sequenced);
        persist(sequenced);
        return sequenced;
    }

    /**
     * Completed payouts, oldest first.
     */
    public synchronized List<PayoutRecord> history() {
        ensureLoaded();
        return records.stream().filter(PayoutRecord::isCompleted).toList();
    }

    /**
     * Completed and failed attempts, oldest first.
     */
    public synchronized List<PayoutRecord> attempts() {
        ensureLoaded();
        return List.copyOf(records);
    }

    /**
     * Loads stored records. A failed load is logged and retried on the next call; records appended meanwhile
     * are renumbered after the stored ones once the load succeeds.
     */
    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        List<PayoutRecord> stored;
        try {
            stored = payoutRecordRepository.findAllByOrderBySequenceAsc();
        } catch (DataAccessException e) {
            log.warn("Payout history not loaded, will retry on next access: {}", e.getMessage());
            return;
        }
        loaded = true;
        if (stored == null || stored.isEmpty()) {
            return;
        }
        Set<String> storedIds = stored.stream().map(PayoutRecord::getId).collect(Collectors.toSet());
        List<PayoutRecord> unsaved = records.stream().filter(r -> !storedIds.contains(r.getId())).toList();
        records.clear();
        records.addAll(stored);
        lastSequence = stored.stream().mapToLong(PayoutRecord::getSequence).max().orElse(0L);
        for (PayoutRecord pending : unsaved) {
            PayoutRecord renumbered = pending.toBuilder().sequence(++lastSequence).build();
            records.add(renumbered);
            persist(renumbered);
        }
        log.info("Loaded {} payout record(s), last sequence {}", stored.size(), lastSequence);
    }

    private void persist(PayoutRecord sequenced) {
        try {
            payoutRecordRepository.save(sequenced);
        } catch (DataAccessException e) {
            log.error("Payout record {} ({}) kept in memory only, persistence failed: {}",
                    sequenced.getId(), sequenced.getStatus(), e.getMessage(), e);
        }
    }
}
