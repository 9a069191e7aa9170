package com.babytrack.backend.intake.service;

import com.babytrack.backend.intake.dto.IntakeDtos.UpdateCalorieSettingRequest;
import com.babytrack.backend.intake.dto.IntakeDtos.UpdateProfileRequest;
import com.babytrack.backend.intake.entity.CalorieSettingEntity;
import com.babytrack.backend.intake.model.CalorieSetting;
import com.babytrack.backend.intake.model.SubjectProfile;
import com.babytrack.backend.intake.repo.CalorieSettingRepository;
import com.babytrack.backend.intake.repo.SubjectProfileRepository;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SubjectSettingsServiceTest {

    private final CalorieSettingRepository calorieRepo = mock(CalorieSettingRepository.class);
    private final SubjectProfileRepository profileRepo = mock(SubjectProfileRepository.class);

    private final CalorieSettingService calories = new CalorieSettingService(calorieRepo);
    // 2024-06-10 23:30 UTC = 2024-06-11 06:30 Jakarta
    private final SubjectProfileService profiles = new SubjectProfileService(profileRepo,
            Clock.fixed(Instant.parse("2024-06-10T23:30:00Z"), ZoneOffset.UTC));

    @Test
    void calorie_settings_default_when_missing() {
        when(calorieRepo.findById(42L)).thenReturn(Optional.empty());

        assertThat(calories.get(42L)).isEqualTo(CalorieSetting.defaults());
    }

    @Test
    void partial_calorie_update_keeps_other_value() {
        when(calorieRepo.findById(42L)).thenReturn(Optional.empty());
        when(calorieRepo.save(any(CalorieSettingEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        CalorieSetting s = calories.update(42L, new UpdateCalorieSettingRequest(null, new BigDecimal("0.8")));

        assertThat(s.asiKcalPerMl()).isEqualByComparingTo(CalorieSetting.DEFAULT_ASI);
        assertThat(s.formulaKcalPerMl()).isEqualByComparingTo("0.8");
    }

    @Test
    void calorie_update_validation() {
        assertThatThrownBy(() -> calories.update(42L, new UpdateCalorieSettingRequest(null, null)))
                .hasMessage("CALORIE_SETTING_EMPTY");
        assertThatThrownBy(() -> calories.update(42L, new UpdateCalorieSettingRequest(BigDecimal.ZERO, null)))
                .hasMessage("CALORIE_SETTING_INVALID");
        assertThatThrownBy(() -> calories.update(42L, new UpdateCalorieSettingRequest(null, new BigDecimal("5.5"))))
                .hasMessage("CALORIE_SETTING_INVALID");
    }

    @Test
    void profile_defaults_when_missing() {
        when(profileRepo.findById(42L)).thenReturn(Optional.empty());

        assertThat(profiles.get(42L)).isEqualTo(SubjectProfile.defaults());
    }

    @Test
    void profile_upsert_normalizes_gender() {
        when(profileRepo.findById(42L)).thenReturn(Optional.empty());

        SubjectProfile p = profiles.upsert(42L, new UpdateProfileRequest(" Alya ", "FEMALE", null), ZoneOffset.UTC);

        assertThat(p).isEqualTo(new SubjectProfile("Alya", "female", null));
        verify(profileRepo).save(any());
    }

    @Test
    void birth_date_is_checked_in_the_callers_zone() {
        when(profileRepo.findById(42L)).thenReturn(Optional.empty());
        LocalDate june11 = LocalDate.of(2024, 6, 11);

        // Jakarta 已經 6/11
        assertThat(profiles.upsert(42L, new UpdateProfileRequest("A", null, june11), ZoneId.of("Asia/Jakarta"))
                .dateOfBirth()).isEqualTo(june11);
        // UTC 還是 6/10
        assertThatThrownBy(() -> profiles.upsert(42L, new UpdateProfileRequest("A", null, june11), ZoneOffset.UTC))
                .hasMessage("DATE_OF_BIRTH_IN_FUTURE");
    }

    @Test
    void unknown_gender_is_rejected() {
        assertThatThrownBy(() -> profiles.upsert(42L, new UpdateProfileRequest("A", "robot", null), ZoneOffset.UTC))
                .hasMessage("GENDER_INVALID");
    }
}
