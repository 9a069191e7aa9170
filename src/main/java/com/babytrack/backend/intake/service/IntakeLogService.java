package com.babytrack.backend.intake.service;

import com.babytrack.backend.intake.dto.IntakeDtos.IntakeLogDto;
import com.babytrack.backend.intake.dto.IntakeDtos.LogIntakeRequest;
import com.babytrack.backend.intake.entity.IntakeLogEntity;
import com.babytrack.backend.intake.model.IntakeCategory;
import com.babytrack.backend.intake.model.MilkType;
import com.babytrack.backend.intake.repo.IntakeLogRepository;
import com.babytrack.backend.intake.web.IntakeValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * 寫入端：驗證後存一筆 intake_logs。熱量不在這裡補，讀取端（JpaIntakeRecordStore）依當下設定估。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntakeLogService {

    /** 容許 client 時鐘稍微快一點 */
    static final Duration FUTURE_TOLERANCE = Duration.ofMinutes(5);
    static final int MAX_HISTORY = 500;

    /** intake_logs.quantity / calorie_estimate = DECIMAL(10,2) */
    static final int MAX_INTEGER_DIGITS = 8;
    static final int MAX_FRACTION_DIGITS = 2;

    private final IntakeLogRepository repo;
    private final Clock clock;

    @Transactional
    public IntakeLogDto log(Long userId, LogIntakeRequest req, ZoneId zone) {
        IntakeCategory category = IntakeCategory.parseOrThrow(req.category());

        BigDecimal qty = req.quantity();
        if (qty == null) throw new IntakeValidationException("INTAKE_QUANTITY_REQUIRED");
        if (qty.signum() < 0 || !fitsColumn(qty)) {
            throw new IntakeValidationException("INTAKE_QUANTITY_INVALID", "quantity=" + qty.toPlainString());
        }

        BigDecimal kcal = req.calorieEstimate();
        if (kcal != null && (kcal.signum() < 0 || !fitsColumn(kcal))) {
            throw new IntakeValidationException("INTAKE_CALORIES_INVALID", "calorieEstimate=" + kcal.toPlainString());
        }

        MilkType milkType = MilkType.parseOrNull(req.milkType());
        if (milkType != null && category != IntakeCategory.MILK) {
            throw new IntakeValidationException("MILK_TYPE_NOT_APPLICABLE", "category=" + category.code());
        }

        Instant now = clock.instant();
        Instant occurredAt = (req.occurredAt() == null) ? now : req.occurredAt().toInstant();
        if (occurredAt.isAfter(now.plus(FUTURE_TOLERANCE))) {
            throw new IntakeValidationException("OCCURRED_AT_IN_FUTURE", "occurredAt=" + occurredAt);
        }

        IntakeLogEntity e = new IntakeLogEntity();
        e.setUserId(userId);
        e.setCategory(category.code());
        // 已確認小數不超過兩位，setScale 不會捨入；回應與之後讀到的值一致
        e.setQuantity(qty.setScale(MAX_FRACTION_DIGITS));
        e.setCalorieEstimate(kcal == null ? null : kcal.setScale(MAX_FRACTION_DIGITS));
        e.setMilkType(milkType == null ? null : milkType.code());
        e.setOccurredAtUtc(occurredAt);
        e.setTimezone(zone.getId());
        IntakeLogEntity saved = repo.save(e);

        log.debug("intake logged: userId={} category={} qty={} at={}", userId, category.code(), qty, occurredAt);
        return toDto(saved, zone);
    }

    @Transactional(readOnly = true)
    public List<IntakeLogDto> history(Long userId, String categoryRaw, int limit, ZoneId zone) {
        IntakeCategory category = IntakeCategory.parseOrThrow(categoryRaw);
        if (limit < 1 || limit > MAX_HISTORY) throw new IllegalArgumentException("LIMIT_INVALID");

        return repo.findLatest(userId, category.code(), PageRequest.of(0, limit)).stream()
                .map(e -> toDto(e, zone))
                .toList();
    }

    /** 寫得進 DECIMAL(10,2)、且不會被 DB 捨入 */
    static boolean fitsColumn(BigDecimal v) {
        BigDecimal s = v.stripTrailingZeros();
        int fraction = Math.max(0, s.scale());
        int integer = s.precision() - s.scale();
        return fraction <= MAX_FRACTION_DIGITS && integer <= MAX_INTEGER_DIGITS;
    }

    private static IntakeLogDto toDto(IntakeLogEntity e, ZoneId zone) {
        IntakeCategory c = IntakeCategory.parseOrThrow(e.getCategory());
        return new IntakeLogDto(
                e.getId(),
                c.code(),
                e.getQuantity(),
                c.unit(),
                e.getCalorieEstimate(),
                e.getMilkType(),
                e.getOccurredAtUtc(),
                e.getOccurredAtUtc().atZone(zone).toLocalDate()
        );
    }
}
