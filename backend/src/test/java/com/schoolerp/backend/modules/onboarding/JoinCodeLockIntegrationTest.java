package com.schoolerp.backend.modules.onboarding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.schoolerp.backend.global.error.ProblemException;
import com.schoolerp.backend.global.security.JwtAuthenticationPrincipal;
import com.schoolerp.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.schoolerp.backend.modules.onboarding.application.OnboardingWorkflow;
import com.schoolerp.backend.modules.school.application.JoinCodeIssuer;
import com.schoolerp.backend.modules.school.application.SchoolRegistrationService;
import com.schoolerp.backend.modules.school.domain.JoinCode;
import com.schoolerp.backend.modules.user.domain.SchoolUser;
import com.schoolerp.backend.modules.user.domain.SchoolUserStatus;
import com.schoolerp.backend.modules.user.infrastructure.persistence.SchoolUserRepository;
import com.schoolerp.backend.support.AbstractPostgresIntegrationTest;
import com.schoolerp.backend.support.MutableClock;
import com.schoolerp.backend.support.OnboardingApiClient;
import com.schoolerp.backend.support.OnboardingApiClient.RegisteredSchool;
import com.schoolerp.backend.support.TestClockConfig;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Interleaving of a join and a code regeneration on the same school. Each test keeps one
 * side's transaction open and checks that the other side waits for it.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfig.class)
class JoinCodeLockIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final long BLOCKED_MILLIS = 500;
    private static final long DONE_SECONDS = 30;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JwtTokenProvider tokenProvider;

    @Autowired
    private MutableClock clock;

    @Autowired
    private OnboardingWorkflow onboardingWorkflow;

    @Autowired
    private SchoolRegistrationService schoolRegistrationService;

    @Autowired
    private SchoolUserRepository schoolUserRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private OnboardingApiClient api;
    private TransactionTemplate transaction;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        clock.setInstant(TestClockConfig.START);
        api = new OnboardingApiClient(mockMvc, objectMapper, tokenProvider, clock);
        transaction = new TransactionTemplate(transactionManager);
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void stopExecutor() {
        executor.shutdownNow();
    }

    @Test
    void regenerateWaitsForJoinInFlight() throws Exception {
        RegisteredSchool school = api.registerSchool("Larch Hill School", "admin@larch.edu");
        CountDownLatch joinValidated = new CountDownLatch(1);
        CountDownLatch releaseJoin = new CountDownLatch(1);

        Future<UUID> join = executor.submit(() -> transaction.execute(status -> {
            SchoolUser pending = onboardingWorkflow.submitJoinRequest(
                    school.joinCode(), "Ada Lovelace", "ada@larch.edu", "staff-pass-1");
            joinValidated.countDown();
            awaitRelease(releaseJoin);
            return pending.getId();
        }));
        assertThat(joinValidated.await(DONE_SECONDS, TimeUnit.SECONDS)).isTrue();

        Future<JoinCode> regenerate = executor.submit(
                () -> schoolRegistrationService.regenerateCode(school.schoolId(), adminOf(school)));
        assertThatThrownBy(() -> regenerate.get(BLOCKED_MILLIS, TimeUnit.MILLISECONDS))
                .isInstanceOf(TimeoutException.class);

        releaseJoin.countDown();
        UUID staffId = join.get(DONE_SECONDS, TimeUnit.SECONDS);
        JoinCode fresh = regenerate.get(DONE_SECONDS, TimeUnit.SECONDS);

        SchoolUser stored = schoolUserRepository.findById(staffId).orElseThrow();
        assertThat(stored.getSchoolId()).isEqualTo(school.schoolId());
        assertThat(stored.getStatus()).isEqualTo(SchoolUserStatus.PENDING);
        assertThat(fresh.code()).isNotEqualTo(school.joinCode());

        api.join(school.joinCode(), "Late Comer", "late@larch.edu")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(JoinCodeIssuer.CODE_INVALID));
        api.join(fresh.code(), "Grace Hopper", "grace@larch.edu")
                .andExpect(status().isCreated());
    }

    @Test
    void joinQueuedBehindRegenerateSeesTheOldCodeGone() throws Exception {
        RegisteredSchool school = api.registerSchool("Rowan Vale School", "admin@rowan.edu");
        CountDownLatch regenerated = new CountDownLatch(1);
        CountDownLatch releaseRegenerate = new CountDownLatch(1);

        Future<JoinCode> regenerate = executor.submit(() -> transaction.execute(status -> {
            JoinCode fresh = schoolRegistrationService.regenerateCode(school.schoolId(), adminOf(school));
            regenerated.countDown();
            awaitRelease(releaseRegenerate);
            return fresh;
        }));
        assertThat(regenerated.await(DONE_SECONDS, TimeUnit.SECONDS)).isTrue();

        Future<UUID> join = executor.submit(() -> onboardingWorkflow.submitJoinRequest(
                school.joinCode(), "Ada Lovelace", "ada@rowan.edu", "staff-pass-1").getId());
        assertThatThrownBy(() -> join.get(BLOCKED_MILLIS, TimeUnit.MILLISECONDS))
                .isInstanceOf(TimeoutException.class);

        releaseRegenerate.countDown();
        JoinCode fresh = regenerate.get(DONE_SECONDS, TimeUnit.SECONDS);
        ExecutionException failure = catchThrowableOfType(
                () -> join.get(DONE_SECONDS, TimeUnit.SECONDS), ExecutionException.class);

        assertThat(failure).isNotNull();
        assertThat(failure.getCause()).isInstanceOfSatisfying(ProblemException.class,
                ex -> assertThat(ex.getCode()).isEqualTo(JoinCodeIssuer.CODE_INVALID));
        assertThat(schoolUserRepository.existsByEmailIgnoreCase("ada@rowan.edu")).isFalse();
        assertThat(fresh.code()).isNotEqualTo(school.joinCode());
    }

    private static JwtAuthenticationPrincipal adminOf(RegisteredSchool school) {
        return new JwtAuthenticationPrincipal(school.adminUserId(), school.schoolId(), List.of("ADMIN"));
    }

    private static void awaitRelease(CountDownLatch latch) {
        try {
            if (!latch.await(DONE_SECONDS, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Transaction was never released");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }
}
