package ru.tigran.churnpredictor.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.tigran.churnpredictor.model.FeedbackRecord;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface FeedbackRecordRepository extends JpaRepository<FeedbackRecord, UUID> {
    Optional<FeedbackRecord> findByIdempotencyKey(String idempotencyKey);
}
