package com.schoolerp.backend.modules.onboarding.presentation.dto;

import java.util.UUID;

public record JoinSchoolResponse(String message, UUID userId, String status) {

    public static final String PENDING_MESSAGE = "Registration successful, pending admin approval.";
}
