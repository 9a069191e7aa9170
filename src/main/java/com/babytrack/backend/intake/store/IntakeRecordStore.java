package com.babytrack.backend.intake.store;

import com.babytrack.backend.intake.model.IntakeCategory;
import com.babytrack.backend.intake.model.IntakeRecord;
import com.babytrack.backend.intake.model.SubjectProfile;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * 讀取端邊界：DB row 在這裡就轉成 {@link IntakeRecord}，上層不碰 entity。
 */
public interface IntakeRecordStore {

    /** 最新的在前 */
    List<IntakeRecord> getHistory(String identity, IntakeCategory category, int limit);

    /** [fromUtc, toUtcExclusive)，時間遞增 */
    List<IntakeRecord> getHistoryBetween(String identity, Set<IntakeCategory> categories,
                                         Instant fromUtc, Instant toUtcExclusive);

    /** 沒建過 profile 回預設值，不丟例外 */
    SubjectProfile getSubjectProfile(String identity);
}
