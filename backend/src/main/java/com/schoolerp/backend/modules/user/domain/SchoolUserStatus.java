package com.schoolerp.backend.modules.user.domain;

public enum SchoolUserStatus {
    PENDING,
    ACTIVE,
    REJECTED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
