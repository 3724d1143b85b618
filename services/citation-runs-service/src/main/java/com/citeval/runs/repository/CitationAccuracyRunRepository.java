package com.citeval.runs.repository;

import com.citeval.runs.domain.CitationAccuracyRunEntity;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CitationAccuracyRunRepository extends JpaRepository<CitationAccuracyRunEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from CitationAccuracyRunEntity r where r.runId = :runId")
    Optional<CitationAccuracyRunEntity> findByIdForUpdate(@Param("runId") UUID runId);

    List<CitationAccuracyRunEntity> findAllByOrderByStartedAtDesc(Pageable pageable);

    List<CitationAccuracyRunEntity> findByCompletedAtIsNullOrderByStartedAtDesc(Pageable pageable);

    List<CitationAccuracyRunEntity> findByStartedAtGreaterThanEqualOrderByStartedAtDesc(Instant since, Pageable pageable);

    List<CitationAccuracyRunEntity> findByCompletedAtIsNullAndStartedAtGreaterThanEqualOrderByStartedAtDesc(
        Instant since,
        Pageable pageable
    );
}
