package com.schoolerp.backend.modules.school.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record SchoolRegistrationResponse(
        UUID id,
        String name,
        String abbreviation,
        UUID adminUserId,
        String joinCode,
        OffsetDateTime codeExpiresAt
) {
}
