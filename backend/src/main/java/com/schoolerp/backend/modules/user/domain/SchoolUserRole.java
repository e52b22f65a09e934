package com.schoolerp.backend.modules.user.domain;

public enum SchoolUserRole {
    ADMIN,
    STAFF
}
