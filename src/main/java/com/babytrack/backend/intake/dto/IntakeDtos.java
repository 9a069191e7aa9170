package com.babytrack.backend.intake.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;

public class IntakeDtos {

    /** POST /intake-logs；數值欄位對齊 DECIMAL(10,2) */
    public record LogIntakeRequest(
            @NotBlank String category,
            @NotNull @DecimalMin("0") @Digits(integer = 8, fraction = 2) BigDecimal quantity,
            /** 可不填；奶量會依 calorie-settings 自動估 */
            @DecimalMin("0") @Digits(integer = 8, fraction = 2) BigDecimal calorieEstimate,
            /** asi / formula，只有 milk 可填 */
            String milkType,
            /** 不填 = 現在 */
            OffsetDateTime occurredAt
    ) {}

    public record IntakeLogDto(
            Long id,
            String category,
            BigDecimal quantity,
            String unit,
            BigDecimal calorieEstimate,
            String milkType,
            Instant occurredAtUtc,
            LocalDate localDate
    ) {}

    public record CalorieSettingDto(
            BigDecimal asiKcalPerMl,
            BigDecimal formulaKcalPerMl
    ) {}

    /** 只更新有帶的欄位 */
    public record UpdateCalorieSettingRequest(
            BigDecimal asiKcalPerMl,
            BigDecimal formulaKcalPerMl
    ) {}

    public record SubjectProfileDto(
            String name,
            String gender,
            LocalDate dateOfBirth
    ) {}

    public record UpdateProfileRequest(
            @NotBlank @Size(max = 64) String name,
            String gender,
            LocalDate dateOfBirth
    ) {}
}
