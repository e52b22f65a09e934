package com.schoolerp.backend.global.security;

import java.util.List;
import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userId, UUID schoolId, List<String> roles) {

    public static final String ROLE_ADMIN = "ADMIN";

    public boolean isAdmin() {
        return roles.contains(ROLE_ADMIN);
    }

    public boolean isAdminOf(UUID otherSchoolId) {
        return isAdmin() && schoolId != null && schoolId.equals(otherSchoolId);
    }
}
