package com.schoolerp.backend.modules.school;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.schoolerp.backend.modules.school.application.JoinCodeGenerator;
import com.schoolerp.backend.modules.school.application.JoinCodeIssuer;
import com.schoolerp.backend.modules.school.domain.JoinCode;
import com.schoolerp.backend.modules.school.domain.School;
import com.schoolerp.backend.modules.school.infrastructure.persistence.SchoolRepository;
import com.schoolerp.backend.support.AbstractPostgresIntegrationTest;
import com.schoolerp.backend.support.TestClockConfig;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@Import({TestClockConfig.class, JoinCodeAllocationIntegrationTest.ScriptedCodes.class})
class JoinCodeAllocationIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private JoinCodeIssuer joinCodeIssuer;

    @Autowired
    private SchoolRepository schoolRepository;

    @Autowired
    private ScriptedJoinCodeGenerator codes;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        codes.clear();
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void stopExecutor() {
        executor.shutdownNow();
    }

    @Test
    void concurrentAllocationsDrawingTheSameCodeBothSucceed() throws Exception {
        UUID alpha = newSchool("Alder Academy", "AA");
        UUID beta = newSchool("Birch Institute", "BI");
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);
        CountDownLatch alphaAllocated = new CountDownLatch(1);
        CountDownLatch releaseAlpha = new CountDownLatch(1);

        codes.enqueue("33333");
        Future<JoinCode> alphaCode = executor.submit(() -> transaction.execute(status -> {
            JoinCode code = joinCodeIssuer.regenerate(alpha);
            alphaAllocated.countDown();
            awaitRelease(releaseAlpha);
            return code;
        }));
        assertThat(alphaAllocated.await(30, TimeUnit.SECONDS)).isTrue();

        // beta draws the code alpha holds uncommitted, then a free one
        codes.enqueue("33333", "44444");
        Future<JoinCode> betaCode = executor.submit(() -> joinCodeIssuer.regenerate(beta));
        assertThatThrownBy(() -> betaCode.get(500, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);

        releaseAlpha.countDown();

        assertThat(alphaCode.get(30, TimeUnit.SECONDS).code()).isEqualTo("33333");
        assertThat(betaCode.get(30, TimeUnit.SECONDS).code()).isEqualTo("44444");
        assertThat(joinCodeIssuer.validate("33333")).isEqualTo(alpha);
        assertThat(joinCodeIssuer.validate("44444")).isEqualTo(beta);
    }

    private UUID newSchool(String name, String abbreviation) {
        School school = new School();
        school.setName(name);
        school.setAbbreviation(abbreviation);
        return schoolRepository.save(school).getId();
    }

    private static void awaitRelease(CountDownLatch latch) {
        try {
            if (!latch.await(30, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Transaction was never released");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }

    @TestConfiguration
    static class ScriptedCodes {

        @Bean
        @Primary
        ScriptedJoinCodeGenerator scriptedJoinCodeGenerator() {
            return new ScriptedJoinCodeGenerator();
        }
    }

    static class ScriptedJoinCodeGenerator implements JoinCodeGenerator {

        private final Deque<String> queued = new ArrayDeque<>();

        synchronized void enqueue(String... next) {
            queued.addAll(Arrays.asList(next));
        }

        synchronized void clear() {
            queued.clear();
        }

        @Override
        public synchronized String randomDigits(int length) {
            String next = queued.pollFirst();
            if (next == null) {
                throw new IllegalStateException("No scripted join code left");
            }
            return next;
        }
    }
}
