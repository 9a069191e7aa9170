package com.babytrack.backend.intake.store;

import com.babytrack.backend.intake.entity.IntakeLogEntity;
import com.babytrack.backend.intake.model.CalorieSetting;
import com.babytrack.backend.intake.model.IntakeCategory;
import com.babytrack.backend.intake.model.IntakeRecord;
import com.babytrack.backend.intake.model.MilkType;
import com.babytrack.backend.intake.model.SubjectProfile;
import com.babytrack.backend.intake.repo.IntakeLogRepository;
import com.babytrack.backend.intake.service.CalorieSettingService;
import com.babytrack.backend.intake.service.SubjectProfileService;
import com.babytrack.backend.report.service.SubjectIds;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class JpaIntakeRecordStore implements IntakeRecordStore {

    static final int MAX_LIMIT = 1000;

    private final IntakeLogRepository repo;
    private final CalorieSettingService calorieSettings;
    private final SubjectProfileService profiles;

    @Override
    @Transactional(readOnly = true)
    public List<IntakeRecord> getHistory(String identity, IntakeCategory category, int limit) {
        Long userId = SubjectIds.parse(identity);
        if (category == null) throw new IllegalArgumentException("INTAKE_CATEGORY_REQUIRED");
        if (limit < 1 || limit > MAX_LIMIT) throw new IllegalArgumentException("LIMIT_INVALID");

        List<IntakeLogEntity> rows = repo.findLatest(userId, category.code(), PageRequest.of(0, limit));
        return toRecords(userId, rows);
    }

    @Override
    @Transactional(readOnly = true)
    public List<IntakeRecord> getHistoryBetween(String identity, Set<IntakeCategory> categories,
                                                Instant fromUtc, Instant toUtcExclusive) {
        Long userId = SubjectIds.parse(identity);
        if (fromUtc == null || toUtcExclusive == null) throw new IllegalArgumentException("DATE_RANGE_REQUIRED");
        if (!fromUtc.isBefore(toUtcExclusive)) throw new IllegalArgumentException("DATE_RANGE_INVALID");
        if (categories == null || categories.isEmpty()) return List.of();

        Set<String> codes = categories.stream().map(IntakeCategory::code).collect(Collectors.toSet());
        return toRecords(userId, repo.findBetween(userId, codes, fromUtc, toUtcExclusive));
    }

    @Override
    @Transactional(readOnly = true)
    public SubjectProfile getSubjectProfile(String identity) {
        return profiles.get(SubjectIds.parse(identity));
    }

    private List<IntakeRecord> toRecords(Long userId, List<IntakeLogEntity> rows) {
        if (rows.isEmpty()) return List.of();
        CalorieSetting setting = calorieSettings.get(userId);
        return rows.stream().map(r -> toRecord(r, setting)).toList();
    }

    /** 奶量沒存熱量時依設定補：母乳 / 配方奶各自的 kcal/ml */
    static IntakeRecord toRecord(IntakeLogEntity row, CalorieSetting setting) {
        IntakeCategory category = IntakeCategory.parseOrThrow(row.getCategory());
        BigDecimal kcal = row.getCalorieEstimate();
        if (kcal == null && category == IntakeCategory.MILK && row.getQuantity() != null) {
            kcal = setting.estimate(row.getQuantity(), MilkType.parseOrNull(row.getMilkType()));
        }
        return new IntakeRecord(row.getOccurredAtUtc(), category, row.getQuantity(), kcal);
    }
}
