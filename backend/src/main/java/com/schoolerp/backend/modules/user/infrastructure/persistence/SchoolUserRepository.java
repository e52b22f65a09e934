package com.schoolerp.backend.modules.user.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.schoolerp.backend.modules.user.domain.SchoolUser;
import com.schoolerp.backend.modules.user.domain.SchoolUserStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SchoolUserRepository extends JpaRepository<SchoolUser, UUID> {

    boolean existsByEmailIgnoreCase(String email);

    @Query("""
            select u
              from SchoolUser u
             where u.school.id = :schoolId
               and u.status = :status
             order by u.createdAt asc, u.id asc
            """)
    List<SchoolUser> findBySchoolAndStatus(@Param("schoolId") UUID schoolId,
                                          @Param("status") SchoolUserStatus status);

    /**
     * Compare-and-set on {@code status}. Returns the number of rows changed, which is zero
     * when the user has already left {@code expected}.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update SchoolUser u
               set u.status = :next,
                   u.resolvedAt = :resolvedAt,
                   u.resolvedBy = :resolvedBy,
                   u.updatedAt = :resolvedAt
             where u.id = :id
               and u.status = :expected
            """)
    int transitionStatus(@Param("id") UUID id,
                         @Param("expected") SchoolUserStatus expected,
                         @Param("next") SchoolUserStatus next,
                         @Param("resolvedAt") OffsetDateTime resolvedAt,
                         @Param("resolvedBy") UUID resolvedBy);
}
