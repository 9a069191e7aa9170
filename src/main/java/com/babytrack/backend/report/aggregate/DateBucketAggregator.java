package com.babytrack.backend.report.aggregate;

import com.babytrack.backend.intake.model.IntakeCategory;
import com.babytrack.backend.intake.model.IntakeRecord;
import com.babytrack.backend.intake.web.IntakeValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把不規則的事件紀錄切成固定日桶。
 *
 * <p>規則：
 * <ul>
 *   <li>日界線 = 使用者時區的當地午夜</li>
 *   <li>區間內每一天都有一個 bucket（沒紀錄的日子補 0，不省略）</li>
 *   <li>同一時間戳的重複紀錄都算（不去重）</li>
 *   <li>calorieEstimate 為 null 視為 0</li>
 * </ul>
 */
@Component
public class DateBucketAggregator {

    public List<DailyBucket> aggregate(List<IntakeRecord> records, DateWindow window, ZoneId zone) {
        if (window == null) throw new IllegalArgumentException("DATE_RANGE_REQUIRED");
        if (zone == null) throw new IllegalArgumentException("TIMEZONE_REQUIRED");

        List<IntakeRecord> input = (records == null) ? List.of() : records;
        // 先整批驗證，避免算到一半才丟例外
        for (IntakeRecord r : input) validate(r);

        Map<LocalDate, Acc> byDate = new LinkedHashMap<>();
        for (LocalDate d : window.dates()) {
            byDate.put(d, new Acc());
        }

        for (IntakeRecord r : input) {
            LocalDate local = r.timestamp().atZone(zone).toLocalDate();
            Acc acc = byDate.get(local);
            if (acc == null) continue; // 區間外

            acc.totals.merge(r.category(), r.quantity(), BigDecimal::add);
            BigDecimal kcal = (r.calorieEstimate() == null) ? BigDecimal.ZERO : r.calorieEstimate();
            acc.calories.merge(r.category(), kcal, BigDecimal::add);
        }

        List<DailyBucket> out = new ArrayList<>(byDate.size());
        byDate.forEach((date, acc) -> out.add(new DailyBucket(date, acc.totals, acc.calories)));
        return List.copyOf(out);
    }

    /** 全部 bucket 都是 0（資料不足） */
    public static boolean allZero(List<DailyBucket> buckets) {
        return buckets == null || buckets.stream().allMatch(DailyBucket::isZero);
    }

    private static void validate(IntakeRecord r) {
        if (r == null) throw new IntakeValidationException("INTAKE_RECORD_REQUIRED");
        if (r.timestamp() == null) throw new IntakeValidationException("INTAKE_TIMESTAMP_REQUIRED");
        if (r.category() == null) throw new IntakeValidationException("INTAKE_CATEGORY_UNSUPPORTED", "category is null");
        if (r.quantity() == null || r.quantity().signum() < 0) {
            throw new IntakeValidationException("INTAKE_QUANTITY_INVALID", "quantity=" + r.quantity());
        }
        if (r.calorieEstimate() != null && r.calorieEstimate().signum() < 0) {
            throw new IntakeValidationException("INTAKE_CALORIES_INVALID", "calorieEstimate=" + r.calorieEstimate());
        }
    }

    private static final class Acc {
        final Map<IntakeCategory, BigDecimal> totals = new EnumMap<>(IntakeCategory.class);
        final Map<IntakeCategory, BigDecimal> calories = new EnumMap<>(IntakeCategory.class);
    }
}
