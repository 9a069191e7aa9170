package com.babytrack.backend.intake.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Getter @Setter @NoArgsConstructor
@Entity
@Table(
        name = "intake_logs",
        indexes = @Index(name = "idx_intake_logs_user_cat_time", columnList = "user_id,category,occurred_at_utc")
)
public class IntakeLogEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /** IntakeCategory.code()：mpasi / milk / weight ... */
    @Column(name = "category", nullable = false, length = 32)
    private String category;

    /** 單位依 category（g / ml / kg / cm / 次） */
    @Column(name = "quantity", nullable = false, precision = 10, scale = 2)
    private BigDecimal quantity;

    /** 可為 null；奶量沒填時讀取端依 calorie_settings 補上 */
    @Column(name = "calorie_estimate", precision = 10, scale = 2)
    private BigDecimal calorieEstimate;

    /** 只有 milk 用得到：asi / formula */
    @Column(name = "milk_type", length = 16)
    private String milkType;

    @Column(name = "occurred_at_utc", nullable = false)
    private Instant occurredAtUtc;

    /** 記錄當下的 client 時區（稽核用） */
    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @PrePersist
    void prePersist() {
        if (createdAtUtc == null) createdAtUtc = Instant.now();
    }
}
