package com.babytrack.backend.intake.service;

import com.babytrack.backend.intake.dto.IntakeDtos.UpdateCalorieSettingRequest;
import com.babytrack.backend.intake.entity.CalorieSettingEntity;
import com.babytrack.backend.intake.model.CalorieSetting;
import com.babytrack.backend.intake.repo.CalorieSettingRepository;
import com.babytrack.backend.intake.web.IntakeValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

@Slf4j
@Service
@RequiredArgsConstructor
public class CalorieSettingService {

    static final BigDecimal MAX_KCAL_PER_ML = new BigDecimal("5");

    private final CalorieSettingRepository repo;

    @Transactional(readOnly = true)
    public CalorieSetting get(Long userId) {
        return repo.findById(userId)
                .map(e -> new CalorieSetting(e.getAsiKcalPerMl(), e.getFormulaKcalPerMl()))
                .orElseGet(CalorieSetting::defaults);
    }

    @Transactional
    public CalorieSetting update(Long userId, UpdateCalorieSettingRequest req) {
        if (req == null || (req.asiKcalPerMl() == null && req.formulaKcalPerMl() == null)) {
            throw new IntakeValidationException("CALORIE_SETTING_EMPTY");
        }
        validate(req.asiKcalPerMl());
        validate(req.formulaKcalPerMl());

        CalorieSettingEntity e = repo.findById(userId).orElseGet(() -> {
            CalorieSettingEntity n = new CalorieSettingEntity();
            n.setUserId(userId);
            n.setAsiKcalPerMl(CalorieSetting.DEFAULT_ASI);
            n.setFormulaKcalPerMl(CalorieSetting.DEFAULT_FORMULA);
            return n;
        });
        if (req.asiKcalPerMl() != null) e.setAsiKcalPerMl(req.asiKcalPerMl());
        if (req.formulaKcalPerMl() != null) e.setFormulaKcalPerMl(req.formulaKcalPerMl());
        repo.save(e);

        log.info("calorie setting updated: userId={} asi={} formula={}",
                userId, e.getAsiKcalPerMl(), e.getFormulaKcalPerMl());
        return new CalorieSetting(e.getAsiKcalPerMl(), e.getFormulaKcalPerMl());
    }

    /** (0, 5] kcal/ml */
    private static void validate(BigDecimal v) {
        if (v == null) return;
        if (v.signum() <= 0 || v.compareTo(MAX_KCAL_PER_ML) > 0) {
            throw new IntakeValidationException("CALORIE_SETTING_INVALID", "kcalPerMl=" + v);
        }
    }
}
