package com.babytrack.backend.intake.repo;

import com.babytrack.backend.intake.entity.IntakeLogEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface IntakeLogRepository extends JpaRepository<IntakeLogEntity, Long> {

    @Query("""
        select l from IntakeLogEntity l
        where l.userId = :userId
          and l.category = :category
        order by l.occurredAtUtc desc, l.id desc
    """)
    List<IntakeLogEntity> findLatest(@Param("userId") Long userId,
                                     @Param("category") String category,
                                     Pageable pageable);

    /** [fromUtc, toUtc) */
    @Query("""
        select l from IntakeLogEntity l
        where l.userId = :userId
          and l.category in :categories
          and l.occurredAtUtc >= :fromUtc
          and l.occurredAtUtc < :toUtc
        order by l.occurredAtUtc asc, l.id asc
    """)
    List<IntakeLogEntity> findBetween(@Param("userId") Long userId,
                                      @Param("categories") Collection<String> categories,
                                      @Param("fromUtc") Instant fromUtc,
                                      @Param("toUtc") Instant toUtc);
}
