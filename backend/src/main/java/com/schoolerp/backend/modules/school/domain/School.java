package com.schoolerp.backend.modules.school.domain;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.schoolerp.backend.global.jpa.AuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "school")
public class School extends AuditedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, unique = true, length = 255)
    private String name;

    @Column(name = "abbreviation", nullable = false, unique = true, length = 20)
    private String abbreviation;

    @Column(name = "join_code", unique = true, length = 5)
    private String joinCode;

    @Column(name = "join_code_issued_at")
    private OffsetDateTime joinCodeIssuedAt;

    @Column(name = "join_code_expires_at")
    private OffsetDateTime joinCodeExpiresAt;

    @Override
    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getAbbreviation() {
        return abbreviation;
    }

    public void setAbbreviation(String abbreviation) {
        this.abbreviation = abbreviation;
    }

    public Optional<JoinCode> getActiveJoinCode() {
        if (joinCode == null || joinCodeIssuedAt == null || joinCodeExpiresAt == null) {
            return Optional.empty();
        }
        return Optional.of(new JoinCode(joinCode, joinCodeIssuedAt, joinCodeExpiresAt));
    }

    public void replaceJoinCode(JoinCode next) {
        this.joinCode = next.code();
        this.joinCodeIssuedAt = next.issuedAt();
        this.joinCodeExpiresAt = next.expiresAt();
    }
}
