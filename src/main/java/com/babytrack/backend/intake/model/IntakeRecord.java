package com.babytrack.backend.intake.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 一筆已記錄的事件（餵食 / 成長量測 / 擠奶 / 排便）。
 * 在 storage 邊界就轉成這個型別，聚合邏輯不碰 entity 或 raw row。
 *
 * @param calorieEstimate 可為 null（聚合時視為 0）
 */
public record IntakeRecord(
        Instant timestamp,
        IntakeCategory category,
        BigDecimal quantity,
        BigDecimal calorieEstimate
) {}
