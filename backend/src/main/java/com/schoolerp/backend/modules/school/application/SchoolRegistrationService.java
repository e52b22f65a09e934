package com.schoolerp.backend.modules.school.application;

import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

import com.schoolerp.backend.global.error.ProblemException;
import com.schoolerp.backend.global.security.JwtAuthenticationPrincipal;
import com.schoolerp.backend.modules.school.domain.JoinCode;
import com.schoolerp.backend.modules.school.domain.School;
import com.schoolerp.backend.modules.school.infrastructure.persistence.SchoolRepository;
import com.schoolerp.backend.modules.user.domain.SchoolUser;
import com.schoolerp.backend.modules.user.domain.SchoolUserRole;
import com.schoolerp.backend.modules.user.domain.SchoolUserStatus;
import com.schoolerp.backend.modules.user.infrastructure.persistence.SchoolUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class SchoolRegistrationService {

    public static final String SCHOOL_NAME_TAKEN = "SCHOOL_NAME_TAKEN";
    public static final String EMAIL_ALREADY_REGISTERED = "EMAIL_ALREADY_REGISTERED";
    public static final String ABBREVIATION_UNAVAILABLE = "ABBREVIATION_UNAVAILABLE";

    private static final Logger log = LoggerFactory.getLogger(SchoolRegistrationService.class);
    private static final int ABBREVIATION_MAX_LENGTH = 20;
    private static final int ABBREVIATION_BASE_LENGTH = 16;
    private static final int ABBREVIATION_SUFFIX_ATTEMPTS = 10;

    private final SchoolRepository schoolRepository;
    private final SchoolUserRepository schoolUserRepository;
    private final JoinCodeIssuer joinCodeIssuer;
    private final PasswordEncoder passwordEncoder;

    public SchoolRegistrationService(
            SchoolRepository schoolRepository,
            SchoolUserRepository schoolUserRepository,
            JoinCodeIssuer joinCodeIssuer,
            PasswordEncoder passwordEncoder
    ) {
        this.schoolRepository = schoolRepository;
        this.schoolUserRepository = schoolUserRepository;
        this.joinCodeIssuer = joinCodeIssuer;
        this.passwordEncoder = passwordEncoder;
    }

    public RegisteredSchool register(String schoolName, String adminName, String adminEmail, String adminPassword) {
        String name = schoolName.trim();
        if (schoolRepository.existsByNameIgnoreCase(name)) {
            throw new ProblemException(HttpStatus.CONFLICT, SCHOOL_NAME_TAKEN, "School name already exists");
        }
        if (schoolUserRepository.existsByEmailIgnoreCase(adminEmail.trim())) {
            throw new ProblemException(HttpStatus.CONFLICT, EMAIL_ALREADY_REGISTERED, "Email already registered");
        }

        School school = new School();
        school.setName(name);
        school.setAbbreviation(uniqueAbbreviation(name));
        School saved = schoolRepository.save(school);

        SchoolUser admin = new SchoolUser();
        admin.setSchool(saved);
        admin.setFullName(adminName.trim());
        admin.setEmail(adminEmail);
        admin.setPasswordHash(passwordEncoder.encode(adminPassword));
        admin.setRole(SchoolUserRole.ADMIN);
        admin.setStatus(SchoolUserStatus.ACTIVE);
        SchoolUser savedAdmin = schoolUserRepository.save(admin);

        JoinCode joinCode = joinCodeIssuer.issue(saved.getId());
        log.info("Registered school {} ({}) with admin {}", saved.getId(), saved.getAbbreviation(), savedAdmin.getId());

        return new RegisteredSchool(
                saved.getId(),
                saved.getName(),
                saved.getAbbreviation(),
                savedAdmin.getId(),
                joinCode.code(),
                joinCode.expiresAt()
        );
    }

    public JoinCode regenerateCode(UUID schoolId, JwtAuthenticationPrincipal requester) {
        if (!schoolRepository.existsById(schoolId)) {
            throw new ProblemException(HttpStatus.NOT_FOUND, JoinCodeIssuer.SCHOOL_NOT_FOUND, "School not found");
        }
        SchoolAccess.requireAdminOf(requester, schoolId);
        return joinCodeIssuer.regenerate(schoolId);
    }

    // Lengths are counted in code points, matching the VARCHAR length PostgreSQL enforces.
    static String abbreviate(String schoolName) {
        StringBuilder sb = new StringBuilder();
        int initials = 0;
        for (String word : schoolName.trim().split("\\s+")) {
            if (!word.isEmpty() && initials < ABBREVIATION_BASE_LENGTH) {
                sb.appendCodePoint(word.codePointAt(0));
                initials++;
            }
        }
        return sb.toString().toUpperCase(Locale.ROOT);
    }

    private String uniqueAbbreviation(String schoolName) {
        String base = abbreviate(schoolName);
        if (!schoolRepository.existsByAbbreviation(base)) {
            return base;
        }
        for (int attempt = 0; attempt < ABBREVIATION_SUFFIX_ATTEMPTS; attempt++) {
            String candidate = base + ThreadLocalRandom.current().nextInt(1, 1000);
            if (candidate.codePointCount(0, candidate.length()) <= ABBREVIATION_MAX_LENGTH && !schoolRepository.existsByAbbreviation(candidate)) {
                return candidate;
            }
        }
        throw new ProblemException(HttpStatus.CONFLICT, ABBREVIATION_UNAVAILABLE, "Could not derive a unique school abbreviation");
    }

    public record RegisteredSchool(
            UUID schoolId,
            String name,
            String abbreviation,
            UUID adminUserId,
            String joinCode,
            OffsetDateTime codeExpiresAt
    ) {
    }
}
