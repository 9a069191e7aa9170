package com.babytrack.backend.entitlement.service;

import com.babytrack.backend.entitlement.entity.UserEntitlementEntity;
import com.babytrack.backend.entitlement.repo.UserEntitlementRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

@Slf4j
@RequiredArgsConstructor
@Service
public class EntitlementService {

    public enum Tier { NONE, TRIAL, MONTHLY, YEARLY }

    private final UserEntitlementRepository repo;

    @Transactional(readOnly = true)
    public Tier resolveTier(Long userId, Instant nowUtc) {
        var list = repo.findActive(userId, nowUtc, PageRequest.of(0, 5));
        if (list.isEmpty()) return Tier.NONE;

        // 同時有多筆時取最高：YEARLY > MONTHLY > TRIAL
        Tier best = Tier.NONE;
        for (var e : list) {
            Tier t = parseTier(e.getEntitlementType());
            if (rank(t) > rank(best)) best = t;
        }
        return best;
    }

    /** 收掉現有的再發一筆新的（dev 手動發放 / 購買後同步都走這裡） */
    @Transactional
    public UserEntitlementEntity grant(Long userId, Tier tier, String source, Instant nowUtc) {
        if (tier == null || tier == Tier.NONE) throw new IllegalArgumentException("TIER_INVALID");

        int expired = repo.expireActiveByUserId(userId, nowUtc);

        UserEntitlementEntity e = new UserEntitlementEntity();
        e.setUserId(userId);
        e.setEntitlementType(tier.name());
        e.setStatus("ACTIVE");
        e.setSource(source);
        e.setValidFromUtc(nowUtc);
        e.setValidToUtc(nowUtc.plus(validity(tier)));
        UserEntitlementEntity saved = repo.save(e);

        log.info("entitlement granted: userId={} tier={} source={} expiredPrevious={} validTo={}",
                userId, tier, source, expired, saved.getValidToUtc());
        return saved;
    }

    public static Tier parseTier(String raw) {
        if (raw == null) return Tier.NONE;
        String v = raw.trim().toUpperCase(Locale.ROOT);
        return switch (v) {
            case "TRIAL" -> Tier.TRIAL;
            case "MONTHLY" -> Tier.MONTHLY;
            case "YEARLY" -> Tier.YEARLY;
            default -> Tier.NONE;
        };
    }

    private static Duration validity(Tier t) {
        return switch (t) {
            case TRIAL -> Duration.ofDays(3);
            case MONTHLY -> Duration.ofDays(30);
            case YEARLY -> Duration.ofDays(365);
            case NONE -> Duration.ZERO;
        };
    }

    private static int rank(Tier t) {
        return switch (t) {
            case NONE -> 0;
            case TRIAL -> 1;
            case MONTHLY -> 2;
            case YEARLY -> 3;
        };
    }
}
