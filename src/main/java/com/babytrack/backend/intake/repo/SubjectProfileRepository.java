package com.babytrack.backend.intake.repo;

import com.babytrack.backend.intake.entity.SubjectProfileEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SubjectProfileRepository extends JpaRepository<SubjectProfileEntity, Long> {
}
