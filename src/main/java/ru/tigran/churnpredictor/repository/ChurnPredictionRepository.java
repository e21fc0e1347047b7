package ru.tigran.churnpredictor.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.tigran.churnpredictor.model.ChurnPrediction;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ChurnPredictionRepository extends JpaRepository<ChurnPrediction, UUID> {

    @Query("SELECT cp FROM ChurnPrediction cp WHERE cp.feedbackRecord.id = :feedbackId")
    Optional<ChurnPrediction> findByFeedbackRecordId(@Param("feedbackId") UUID feedbackId);
}
