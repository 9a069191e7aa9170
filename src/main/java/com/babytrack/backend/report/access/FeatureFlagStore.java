package com.babytrack.backend.report.access;

/**
 * 訂閱狀態查詢。實作可以丟例外（DB 掛掉等），AccessGate 會 fail closed。
 */
public interface FeatureFlagStore {

    boolean hasFeature(String identity, String featureKey);
}
