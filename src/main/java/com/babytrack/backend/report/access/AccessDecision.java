package com.babytrack.backend.report.access;

public record AccessDecision(boolean allowed, Reason reason) {

    public enum Reason { PREMIUM_ACTIVE, FREE_TIER, FEATURE_DISABLED }

    public static AccessDecision premium() {
        return new AccessDecision(true, Reason.PREMIUM_ACTIVE);
    }

    public static AccessDecision free() {
        return new AccessDecision(true, Reason.FREE_TIER);
    }

    public static AccessDecision upgradeRequired() {
        return new AccessDecision(false, Reason.FREE_TIER);
    }

    public static AccessDecision disabled() {
        return new AccessDecision(false, Reason.FEATURE_DISABLED);
    }
}
