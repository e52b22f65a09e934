package com.schoolerp.backend.modules.onboarding.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.schoolerp.backend.global.error.ProblemException;
import com.schoolerp.backend.global.security.JwtAuthenticationPrincipal;
import com.schoolerp.backend.modules.onboarding.domain.OnboardingDecision;
import com.schoolerp.backend.modules.school.application.JoinCodeIssuer;
import com.schoolerp.backend.modules.school.application.SchoolAccess;
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

/**
 * Staff self-registration through a join code, followed by admin approval.
 *
 * <p>A staff account is created {@code PENDING} and moves exactly once to {@code ACTIVE} or
 * {@code REJECTED}. The move is a conditional update, so of two concurrent decisions only
 * one takes effect.
 */
@Service
@Transactional
public class OnboardingWorkflow {

    public static final String EMAIL_ALREADY_REGISTERED = "EMAIL_ALREADY_REGISTERED";
    public static final String USER_NOT_FOUND = "USER_NOT_FOUND";
    public static final String ALREADY_RESOLVED = "ALREADY_RESOLVED";

    private static final Logger log = LoggerFactory.getLogger(OnboardingWorkflow.class);

    private final JoinCodeIssuer joinCodeIssuer;
    private final SchoolRepository schoolRepository;
    private final SchoolUserRepository schoolUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public OnboardingWorkflow(
            JoinCodeIssuer joinCodeIssuer,
            SchoolRepository schoolRepository,
            SchoolUserRepository schoolUserRepository,
            PasswordEncoder passwordEncoder,
            Clock clock
    ) {
        this.joinCodeIssuer = joinCodeIssuer;
        this.schoolRepository = schoolRepository;
        this.schoolUserRepository = schoolUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    public SchoolUser submitJoinRequest(String code, String fullName, String email, String rawPassword) {
        // holds a shared lock on the school row until this transaction ends
        UUID schoolId = joinCodeIssuer.validate(code);

        if (schoolUserRepository.existsByEmailIgnoreCase(email.trim())) {
            throw new ProblemException(HttpStatus.CONFLICT, EMAIL_ALREADY_REGISTERED, "Email already registered");
        }

        SchoolUser user = new SchoolUser();
        user.setSchool(schoolRepository.getReferenceById(schoolId));
        user.setFullName(fullName.trim());
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(rawPassword));
        user.setRole(SchoolUserRole.STAFF);
        user.setStatus(SchoolUserStatus.PENDING);
        SchoolUser saved = schoolUserRepository.save(user);

        log.info("Join request accepted: user {} pending approval in school {}", saved.getId(), schoolId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<SchoolUser> listPending(UUID schoolId, JwtAuthenticationPrincipal requester) {
        SchoolAccess.requireAdminOf(requester, schoolId);
        return schoolUserRepository.findBySchoolAndStatus(schoolId, SchoolUserStatus.PENDING);
    }

    public SchoolUser resolve(UUID userId, JwtAuthenticationPrincipal requester, OnboardingDecision decision) {
        // only staff accounts go through onboarding; admins are created active
        SchoolUser user = schoolUserRepository.findById(userId)
                .filter(candidate -> candidate.getRole() == SchoolUserRole.STAFF)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, USER_NOT_FOUND, "User not found"));

        SchoolAccess.requireAdminOf(requester, user.getSchoolId());

        if (user.getStatus().isTerminal()) {
            throw alreadyResolved(user.getStatus());
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        int updated = schoolUserRepository.transitionStatus(
                userId,
                SchoolUserStatus.PENDING,
                decision.resultingStatus(),
                now,
                requester.userId()
        );
        if (updated == 0) {
            // lost the race against another decision on the same user
            SchoolUserStatus current = schoolUserRepository.findById(userId)
                    .map(SchoolUser::getStatus)
                    .orElse(null);
            throw alreadyResolved(current);
        }

        log.info("User {} {} by admin {}", userId, decision.resultingStatus(), requester.userId());
        return schoolUserRepository.findById(userId)
                .orElseThrow(() -> new IllegalStateException("User vanished after status update: " + userId));
    }

    private static ProblemException alreadyResolved(SchoolUserStatus current) {
        String detail = current != null
                ? "User has already been resolved as " + current
                : "User has already been resolved";
        return new ProblemException(HttpStatus.CONFLICT, ALREADY_RESOLVED, detail);
    }
}
