package com.babytrack.backend.intake.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Getter @Setter @NoArgsConstructor
@Entity
@Table(name = "calorie_settings")
public class CalorieSettingEntity {

    @Id
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "asi_kcal_per_ml", nullable = false, precision = 5, scale = 3)
    private BigDecimal asiKcalPerMl;

    @Column(name = "formula_kcal_per_ml", nullable = false, precision = 5, scale = 3)
    private BigDecimal formulaKcalPerMl;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAtUtc = Instant.now();
    }
}
