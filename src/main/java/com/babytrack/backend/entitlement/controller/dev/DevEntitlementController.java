package com.babytrack.backend.entitlement.controller.dev;

import com.babytrack.backend.entitlement.entity.UserEntitlementEntity;
import com.babytrack.backend.entitlement.service.EntitlementService;
import com.babytrack.backend.report.service.SubjectIds;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.Map;

@Profile({"dev", "local"})
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/dev/entitlements")
public class DevEntitlementController {

    private final EntitlementService entitlementService;
    private final Clock clock;

    @PostMapping("/{identity}/grant")
    public Map<String, Object> grant(@PathVariable String identity,
                                     @RequestParam(defaultValue = "MONTHLY") String tier) {
        Long uid = SubjectIds.parse(identity);
        EntitlementService.Tier t = EntitlementService.parseTier(tier);

        UserEntitlementEntity e = entitlementService.grant(uid, t, "DEV", clock.instant());

        return Map.of(
                "ok", true,
                "tier", e.getEntitlementType(),
                "validToUtc", e.getValidToUtc().toString()
        );
    }
}
