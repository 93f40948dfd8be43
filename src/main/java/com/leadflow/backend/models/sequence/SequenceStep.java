package com.leadflow.backend.models.sequence;

import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Duration;
import java.time.OffsetDateTime;

@Entity
@Table(name = "sequence_steps", uniqueConstraints = {
        @UniqueConstraint(name = "uk_sequence_steps_order", columnNames = {"sequence_id", "step_order"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SequenceStep {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "sequence_id", nullable = false)
    private EmailSequence sequence;

    /**
     * 1-based position in the sequence.
     */
    @Min(1)
    @Column(name = "step_order", nullable = false)
    private Integer stepOrder;

    @Column(name = "template_id")
    private Long templateId;

    @Size(max = 500)
    private String subject;

    @Column(columnDefinition = "TEXT")
    private String body;

    @Min(0)
    @Column(name = "delay_days", nullable = false)
    @Builder.Default
    private Integer delayDays = 0;

    @Min(0)
    @Column(name = "delay_hours", nullable = false)
    @Builder.Default
    private Integer delayHours = 0;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    public Duration getDelay() {
        int days = delayDays != null ? delayDays : 0;
        int hours = delayHours != null ? delayHours : 0;
        return Duration.ofDays(days).plusHours(hours);
    }

    public String getDelayDescription() {
        Duration delay = getDelay();
        if (delay.isZero()) {
            return "Immediately";
        } else if (delay.toHours() < 24) {
            long hours = delay.toHours();
            return hours + " hour" + (hours > 1 ? "s" : "");
        } else {
            long days = delay.toDays();
            return days + " day" + (days > 1 ? "s" : "");
        }
    }

    @Override
    public String toString() {
        return "SequenceStep{" +
                "id=" + id +
                ", stepOrder=" + stepOrder +
                ", delay=" + getDelayDescription() +
                ", templateId=" + templateId +
                '}';
    }
}
