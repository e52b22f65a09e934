package com.schoolerp.backend.modules.school.domain;

import java.time.OffsetDateTime;
import java.util.Objects;

public record JoinCode(String code, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {

    public JoinCode {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("expiresAt must be after issuedAt");
        }
    }

    // usable strictly before expiresAt
    public boolean isUsableAt(OffsetDateTime now) {
        return expiresAt.isAfter(now);
    }
}
