package com.babytrack.backend.intake.service;

import com.babytrack.backend.intake.dto.IntakeDtos.UpdateProfileRequest;
import com.babytrack.backend.intake.entity.SubjectProfileEntity;
import com.babytrack.backend.intake.model.SubjectProfile;
import com.babytrack.backend.intake.repo.SubjectProfileRepository;
import com.babytrack.backend.intake.web.IntakeValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class SubjectProfileService {

    private static final Set<String> GENDERS = Set.of("male", "female", SubjectProfile.UNKNOWN_GENDER);

    private final SubjectProfileRepository repo;
    private final Clock clock;

    @Transactional(readOnly = true)
    public SubjectProfile get(Long userId) {
        return repo.findById(userId)
                .map(e -> new SubjectProfile(e.getName(), e.getGender(), e.getDateOfBirth()))
                .orElseGet(SubjectProfile::defaults);
    }

    @Transactional
    public SubjectProfile upsert(Long userId, UpdateProfileRequest req, ZoneId zone) {
        String name = (req.name() == null) ? "" : req.name().trim();
        if (name.isEmpty()) throw new IntakeValidationException("PROFILE_NAME_REQUIRED");

        String gender = normalizeGender(req.gender());
        LocalDate dob = req.dateOfBirth();
        if (dob != null && dob.isAfter(LocalDate.now(clock.withZone(zone)))) {
            throw new IntakeValidationException("DATE_OF_BIRTH_IN_FUTURE", "dateOfBirth=" + dob);
        }

        SubjectProfileEntity e = repo.findById(userId).orElseGet(() -> {
            SubjectProfileEntity n = new SubjectProfileEntity();
            n.setUserId(userId);
            return n;
        });
        e.setName(name);
        e.setGender(gender);
        e.setDateOfBirth(dob);
        repo.save(e);

        return new SubjectProfile(e.getName(), e.getGender(), e.getDateOfBirth());
    }

    private static String normalizeGender(String raw) {
        if (raw == null || raw.isBlank()) return SubjectProfile.UNKNOWN_GENDER;
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (!GENDERS.contains(v)) throw new IntakeValidationException("GENDER_INVALID", "gender=" + raw.trim());
        return v;
    }
}
