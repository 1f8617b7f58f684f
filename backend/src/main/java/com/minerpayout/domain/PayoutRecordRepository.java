package com.minerpayout.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for payout_records, read back in ledger order.
 */
public interface PayoutRecordRepository extends MongoRepository<PayoutRecord, String> {

    List<PayoutRecord> findAllByOrderBySequenceAsc();
}
