package ru.tigran.churnpredictor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Churn prediction derived from exactly one feedback record.
 * The database removes the prediction when its feedback record is deleted.
 */
@Entity
@Table(name = "churn_predictions", indexes = {
    @Index(name = "idx_churn_predictions_customer_feedback_id", columnList = "customer_feedback_id", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString(exclude = "feedbackRecord")
public class ChurnPrediction {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "customer_feedback_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private FeedbackRecord feedbackRecord;

    @Column(name = "churn_probability", nullable = false)
    private Double churnProbability;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "predicted_at", nullable = false, updatable = false)
    private LocalDateTime predictedAt;

    @PrePersist
    protected void onCreate() {
        if (predictedAt == null) {
            predictedAt = LocalDateTime.now();
        }
    }
}
