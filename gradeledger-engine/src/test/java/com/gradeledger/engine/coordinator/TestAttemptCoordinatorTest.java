package com.gradeledger.engine.coordinator;

import com.gradeledger.core.exception.ConflictException;
import com.gradeledger.core.exception.NotFoundException;
import com.gradeledger.core.exception.ValidationException;
import com.gradeledger.core.model.Actor;
import com.gradeledger.core.model.AttemptStatus;
import com.gradeledger.core.model.EventType;
import com.gradeledger.core.model.GradebookEntry;
import com.gradeledger.engine.service.TestAttemptService.AttemptStarted;
import com.gradeledger.engine.service.TestAttemptService.AttemptSubmitted;
import com.gradeledger.engine.service.TestAttemptService.SubmitAttemptRequest;
import com.gradeledger.engine.test.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.gradeledger.engine.test.LedgerFixture.COURSE;
import static com.gradeledger.engine.test.LedgerFixture.START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TestAttemptCoordinatorTest {

    private static final Actor ANA = Actor.student("u_ana");

    private LedgerFixture ledger;

    @BeforeEach
    void setUp() {
        ledger = LedgerFixture.create();
    }

    // ========== Start ==========

    @Test
    @DisplayName("Starting an attempt numbers it and sets the expiry from the duration")
    void startScheduledAttempt() {
        ledger.publishScheduledTest("exam1", 50, 2, 45, START, START.plus(Duration.ofHours(3)));

        AttemptStarted started = ledger.attempts.startAttempt(COURSE, "exam1", ANA, null);

        assertThat(started.attempt().attemptId()).isEqualTo("u_ana__1");
        assertThat(started.attempt().attemptNo()).isEqualTo(1);
        assertThat(started.attempt().expiresAt()).isEqualTo(START.plus(Duration.ofMinutes(45)));
        assertThat(started.event().type()).isEqualTo(EventType.TEST_ATTEMPT_STARTED.wireName());
        assertThat(started.event().idempotencyKey()).isEqualTo("test.attempt.started:course_cs101:exam1:u_ana__1:v1");
        assertThat(started.event().payload().get("durationMinutes").asInt()).isEqualTo(45);
    }

    @Test
    @DisplayName("Attempts beyond the allowance are refused")
    void attemptLimit() {
        ledger.publishPracticeTest("p1", 10, 2);
        ledger.attempts.startAttempt(COURSE, "p1", ANA, null);
        AttemptStarted second = ledger.attempts.startAttempt(COURSE, "p1", ANA, null);

        assertThat(second.attempt().attemptNo()).isEqualTo(2);
        assertThatThrownBy(() -> ledger.attempts.startAttempt(COURSE, "p1", ANA, null))
            .isInstanceOf(ConflictException.class)
            .hasMessageContaining("No remaining attempts");
    }

    @Test
    @DisplayName("Scheduled tests refuse starts outside their window")
    void windowEnforced() {
        ledger.publishScheduledTest("exam1", 50, 1, 30, START.plusSeconds(3600), START.plusSeconds(7200));

        assertThatThrownBy(() -> ledger.attempts.startAttempt(COURSE, "exam1", ANA, null))
            .isInstanceOf(ConflictException.class);

        ledger.clock.advanceHours(3);
        assertThatThrownBy(() -> ledger.attempts.startAttempt(COURSE, "exam1", ANA, null))
            .isInstanceOf(ConflictException.class);
    }

    @Test
    @DisplayName("Unknown test fails with not found")
    void unknownTest() {
        assertThatThrownBy(() -> ledger.attempts.startAttempt(COURSE, "missing", ANA, null))
            .isInstanceOf(NotFoundException.class);
    }

    // ========== Submit ==========

    @Test
    @DisplayName("Submitting a scheduled attempt grades it through the gradebook")
    void scheduledSubmitGrades() {
        ledger.publishScheduledTest("exam1", 50, 1, 60, START, START.plus(Duration.ofHours(2)));
        AttemptStarted started = ledger.attempts.startAttempt(COURSE, "exam1", ANA, null);
        ledger.clock.advanceMinutes(30);

        AttemptSubmitted submitted = submit("exam1", started.attempt().attemptId(), 42.0, ANA);

        assertThat(submitted.attempt().status()).isEqualTo(AttemptStatus.SUBMITTED);
        assertThat(submitted.event().payload().get("assessed").asBoolean()).isTrue();
        assertThat(submitted.grade()).isNotNull();
        assertThat(submitted.grade().grade().gradedBy()).isEqualTo(Actor.AUTO_GRADER.uid());
        assertThat(submitted.grade().event().actorRole()).isEqualTo("system");

        GradebookEntry totals = ledger.gradebook.getGradebook(COURSE, "u_ana");
        assertThat(totals.totalScore()).isEqualTo(42.0);
        assertThat(totals.totalPossible()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Practice attempts are scored but never reach the gradebook")
    void practiceSubmitNotGraded() {
        ledger.publishPracticeTest("p1", 10, 1);
        AttemptStarted started = ledger.attempts.startAttempt(COURSE, "p1", ANA, null);

        AttemptSubmitted submitted = submit("p1", started.attempt().attemptId(), 7.0, ANA);

        assertThat(submitted.grade()).isNull();
        assertThat(submitted.attempt().score()).isEqualTo(7.0);
        assertThat(submitted.event().payload().get("assessed").asBoolean()).isFalse();
        assertThat(ledger.grades.findByStudent(COURSE, "u_ana")).isEmpty();
    }

    @Test
    @DisplayName("An attempt can be submitted only once")
    void doubleSubmitRefused() {
        ledger.publishPracticeTest("p1", 10, 1);
        String attemptId = ledger.attempts.startAttempt(COURSE, "p1", ANA, null).attempt().attemptId();
        submit("p1", attemptId, 5.0, ANA);

        assertThatThrownBy(() -> submit("p1", attemptId, 6.0, ANA))
            .isInstanceOf(ConflictException.class);
    }

    @Test
    @DisplayName("Expired attempts cannot be submitted")
    void expiredAttemptRefused() {
        ledger.publishScheduledTest("exam1", 50, 1, 30, START, START.plus(Duration.ofHours(4)));
        String attemptId = ledger.attempts.startAttempt(COURSE, "exam1", ANA, null).attempt().attemptId();
        ledger.clock.advanceMinutes(31);

        assertThatThrownBy(() -> submit("exam1", attemptId, 40.0, ANA))
            .isInstanceOf(ConflictException.class)
            .hasMessageContaining("expired");
        assertThat(ledger.grades.findByStudent(COURSE, "u_ana")).isEmpty();
    }

    @Test
    @DisplayName("Another student's attempt is reported as not found")
    void foreignAttemptHidden() {
        ledger.publishPracticeTest("p1", 10, 1);
        String attemptId = ledger.attempts.startAttempt(COURSE, "p1", ANA, null).attempt().attemptId();

        assertThatThrownBy(() -> submit("p1", attemptId, 5.0, Actor.student("u_ben")))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Score above the test's points is rejected")
    void scoreAbovePointsRejected() {
        ledger.publishPracticeTest("p1", 10, 1);
        String attemptId = ledger.attempts.startAttempt(COURSE, "p1", ANA, null).attempt().attemptId();

        assertThatThrownBy(() -> submit("p1", attemptId, 11.0, ANA))
            .isInstanceOf(ValidationException.class);
    }

    private AttemptSubmitted submit(String testId, String attemptId, Double score, Actor student) {
        return ledger.attempts.submitAttempt(new SubmitAttemptRequest(COURSE, testId, attemptId, score, student, null));
    }
}
