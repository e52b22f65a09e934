package com.schoolerp.backend.modules.school.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.schoolerp.backend.global.error.ProblemException;
import com.schoolerp.backend.global.error.RetryableProblemException;
import com.schoolerp.backend.modules.school.domain.JoinCode;
import com.schoolerp.backend.modules.school.domain.School;
import com.schoolerp.backend.modules.school.infrastructure.persistence.SchoolRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues and validates the single active join code of each school. Replacement holds a
 * write lock on the school row, validation a shared one.
 */
@Service
@Transactional
public class JoinCodeIssuer {

    public static final String CODE_INVALID = "JOIN_CODE_INVALID";
    public static final String CODE_EXHAUSTED = "JOIN_CODE_EXHAUSTED";
    public static final String SCHOOL_NOT_FOUND = "SCHOOL_NOT_FOUND";

    private static final Logger log = LoggerFactory.getLogger(JoinCodeIssuer.class);
    public static final int CODE_LENGTH = 5;

    private static final Duration EXHAUSTED_RETRY_AFTER = Duration.ofSeconds(1);

    private final SchoolRepository schoolRepository;
    private final JoinCodeGenerator joinCodeGenerator;
    private final Clock clock;
    private final Duration validity;
    private final int maxAttempts;

    public JoinCodeIssuer(
            SchoolRepository schoolRepository,
            JoinCodeGenerator joinCodeGenerator,
            Clock clock,
            @Value("${app.onboarding.join-code.validity:P3D}") Duration validity,
            @Value("${app.onboarding.join-code.max-attempts:20}") int maxAttempts
    ) {
        if (maxAttempts <= 0 || validity.isNegative() || validity.isZero()) {
            throw new IllegalArgumentException("join code validity and max attempts must be positive");
        }
        this.schoolRepository = schoolRepository;
        this.joinCodeGenerator = joinCodeGenerator;
        this.clock = clock;
        this.validity = validity;
        this.maxAttempts = maxAttempts;
    }

    public JoinCode issue(UUID schoolId) {
        JoinCode joinCode = replaceCode(schoolId);
        log.info("Issued join code for school {} valid until {}", schoolId, joinCode.expiresAt());
        return joinCode;
    }

    public JoinCode regenerate(UUID schoolId) {
        JoinCode joinCode = replaceCode(schoolId);
        log.info("Regenerated join code for school {} valid until {}", schoolId, joinCode.expiresAt());
        return joinCode;
    }

    /**
     * Resolves the school whose active code is {@code code}. Unknown, malformed and expired
     * codes all fail the same way.
     */
    public UUID validate(String code) {
        if (!isWellFormed(code)) {
            throw codeInvalid();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        return schoolRepository.findByJoinCodeForShare(code)
                .filter(school -> school.getActiveJoinCode()
                        .map(active -> active.isUsableAt(now))
                        .orElse(false))
                .map(School::getId)
                .orElseThrow(() -> {
                    log.debug("Join code rejected at {}", now);
                    return codeInvalid();
                });
    }

    private JoinCode replaceCode(UUID schoolId) {
        School school = schoolRepository.findByIdForUpdate(schoolId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, SCHOOL_NOT_FOUND));

        schoolRepository.lockJoinCodeAllocation();
        OffsetDateTime now = OffsetDateTime.now(clock);
        JoinCode next = new JoinCode(nextUnusedCode(), now, now.plus(validity));
        school.replaceJoinCode(next);
        schoolRepository.save(school);
        return next;
    }

    // Checked against every stored code, the caller's previous one included.
    private String nextUnusedCode() {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = joinCodeGenerator.randomDigits(CODE_LENGTH);
            if (!schoolRepository.existsByJoinCode(candidate)) {
                return candidate;
            }
            log.debug("Join code collision on attempt {}/{}", attempt, maxAttempts);
        }
        log.warn("No unused join code found after {} attempts", maxAttempts);
        throw new RetryableProblemException(
                HttpStatus.SERVICE_UNAVAILABLE,
                CODE_EXHAUSTED,
                "Could not allocate a unique join code, try again",
                EXHAUSTED_RETRY_AFTER
        );
    }

    private boolean isWellFormed(String code) {
        if (code == null || code.length() != CODE_LENGTH) {
            return false;
        }
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static ProblemException codeInvalid() {
        return new ProblemException(
                HttpStatus.BAD_REQUEST,
                CODE_INVALID,
                "Invalid or expired join code, ask a school admin to regenerate it"
        );
    }
}
