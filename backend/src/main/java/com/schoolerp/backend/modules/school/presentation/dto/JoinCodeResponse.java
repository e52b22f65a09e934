package com.schoolerp.backend.modules.school.presentation.dto;

import java.time.OffsetDateTime;

public record JoinCodeResponse(String joinCode, OffsetDateTime codeIssuedAt, OffsetDateTime codeExpiresAt) {
}
