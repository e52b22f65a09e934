package com.schoolerp.backend.modules.onboarding.domain;

import java.util.Locale;

import com.schoolerp.backend.modules.user.domain.SchoolUserStatus;

public enum OnboardingDecision {
    APPROVE(SchoolUserStatus.ACTIVE),
    REJECT(SchoolUserStatus.REJECTED);

    private final SchoolUserStatus resultingStatus;

    OnboardingDecision(SchoolUserStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public SchoolUserStatus resultingStatus() {
        return resultingStatus;
    }

    public static OnboardingDecision fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("decision must not be null");
        }
        return OnboardingDecision.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
