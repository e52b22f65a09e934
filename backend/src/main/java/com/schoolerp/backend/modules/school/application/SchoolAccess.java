package com.schoolerp.backend.modules.school.application;

import java.util.UUID;

import com.schoolerp.backend.global.error.ProblemException;
import com.schoolerp.backend.global.security.JwtAuthenticationPrincipal;

import org.springframework.http.HttpStatus;

public final class SchoolAccess {

    public static final String FORBIDDEN_SCHOOL_SCOPE = "FORBIDDEN_SCHOOL_SCOPE";

    private SchoolAccess() {
    }

    public static void requireAdminOf(JwtAuthenticationPrincipal requester, UUID schoolId) {
        if (requester == null || !requester.isAdminOf(schoolId)) {
            throw new ProblemException(
                    HttpStatus.FORBIDDEN,
                    FORBIDDEN_SCHOOL_SCOPE,
                    "Only an admin of this school may perform this action"
            );
        }
    }
}
