package com.babytrack.backend.intake.controller;

import com.babytrack.backend.intake.dto.IntakeDtos.CalorieSettingDto;
import com.babytrack.backend.intake.dto.IntakeDtos.SubjectProfileDto;
import com.babytrack.backend.intake.dto.IntakeDtos.UpdateCalorieSettingRequest;
import com.babytrack.backend.intake.dto.IntakeDtos.UpdateProfileRequest;
import com.babytrack.backend.intake.model.CalorieSetting;
import com.babytrack.backend.intake.model.SubjectProfile;
import com.babytrack.backend.intake.service.CalorieSettingService;
import com.babytrack.backend.intake.service.SubjectProfileService;
import com.babytrack.backend.report.service.ReportZoneResolver;
import com.babytrack.backend.report.service.SubjectIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

/** 每 ml 熱量設定 + 寶寶基本資料 */
@RestController
@RequiredArgsConstructor
@RequestMapping(value = "/api/v1/subjects/{identity}", produces = MediaType.APPLICATION_JSON_VALUE)
public class SubjectSettingsController {

    private final CalorieSettingService calorieSettings;
    private final SubjectProfileService profiles;
    private final ReportZoneResolver zoneResolver;

    @GetMapping("/calorie-settings")
    public CalorieSettingDto getCalories(@PathVariable String identity) {
        return toDto(calorieSettings.get(SubjectIds.parse(identity)));
    }

    @PutMapping(value = "/calorie-settings", consumes = MediaType.APPLICATION_JSON_VALUE)
    public CalorieSettingDto updateCalories(@PathVariable String identity,
                                            @RequestBody UpdateCalorieSettingRequest body) {
        return toDto(calorieSettings.update(SubjectIds.parse(identity), body));
    }

    @GetMapping("/profile")
    public SubjectProfileDto getProfile(@PathVariable String identity) {
        return toDto(profiles.get(SubjectIds.parse(identity)));
    }

    @PutMapping(value = "/profile", consumes = MediaType.APPLICATION_JSON_VALUE)
    public SubjectProfileDto updateProfile(@PathVariable String identity,
                                           @Valid @RequestBody UpdateProfileRequest body,
                                           HttpServletRequest req) {
        return toDto(profiles.upsert(SubjectIds.parse(identity), body, zoneResolver.resolve(req)));
    }

    private static CalorieSettingDto toDto(CalorieSetting s) {
        return new CalorieSettingDto(s.asiKcalPerMl(), s.formulaKcalPerMl());
    }

    private static SubjectProfileDto toDto(SubjectProfile p) {
        return new SubjectProfileDto(p.name(), p.gender(), p.dateOfBirth());
    }
}
