package com.babytrack.backend.intake.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 每 ml 熱量。沒設定過就用預設：母乳 0.67、配方奶 0.70。
 */
public record CalorieSetting(BigDecimal asiKcalPerMl, BigDecimal formulaKcalPerMl) {

    public static final BigDecimal DEFAULT_ASI = new BigDecimal("0.67");
    public static final BigDecimal DEFAULT_FORMULA = new BigDecimal("0.70");

    public static CalorieSetting defaults() {
        return new CalorieSetting(DEFAULT_ASI, DEFAULT_FORMULA);
    }

    public BigDecimal kcalPerMl(MilkType type) {
        return (type == MilkType.FORMULA) ? formulaKcalPerMl : asiKcalPerMl;
    }

    public BigDecimal estimate(BigDecimal ml, MilkType type) {
        return ml.multiply(kcalPerMl(type)).setScale(2, RoundingMode.HALF_UP);
    }
}
