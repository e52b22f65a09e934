package com.schoolerp.backend.modules.school.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import com.schoolerp.backend.modules.school.domain.School;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SchoolRepository extends JpaRepository<School, UUID> {

    long JOIN_CODE_ALLOCATION_LOCK = 5_730_001L;

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from School s where s.id = :id")
    Optional<School> findByIdForUpdate(@Param("id") UUID id);

    // shared row lock held until the caller's transaction ends
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("select s from School s where s.joinCode = :joinCode")
    Optional<School> findByJoinCodeForShare(@Param("joinCode") String joinCode);

    /**
     * Serializes join code allocation across schools until the caller's transaction ends.
     */
    @Query(value = "select 1 from pg_advisory_xact_lock(" + JOIN_CODE_ALLOCATION_LOCK + ")", nativeQuery = true)
    int lockJoinCodeAllocation();

    boolean existsByJoinCode(String joinCode);

    boolean existsByNameIgnoreCase(String name);

    boolean existsByAbbreviation(String abbreviation);
}
