package com.schoolerp.backend.modules.onboarding.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.schoolerp.backend.modules.user.domain.SchoolUser;

public record OnboardingUserResponse(
        UUID id,
        UUID schoolId,
        String fullName,
        String email,
        String role,
        String status,
        OffsetDateTime createdAt,
        OffsetDateTime resolvedAt
) {

    public static OnboardingUserResponse from(SchoolUser user) {
        return new OnboardingUserResponse(
                user.getId(),
                user.getSchoolId(),
                user.getFullName(),
                user.getEmail(),
                user.getRole().name(),
                user.getStatus().name(),
                user.getCreatedAt(),
                user.getResolvedAt()
        );
    }
}
