package com.babytrack.backend.intake.repo;

import com.babytrack.backend.intake.entity.CalorieSettingEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CalorieSettingRepository extends JpaRepository<CalorieSettingEntity, Long> {
}
