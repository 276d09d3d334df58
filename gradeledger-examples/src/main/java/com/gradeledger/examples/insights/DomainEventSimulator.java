package com.gradeledger.examples.insights;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gradeledger.core.model.ActorRole;
import com.gradeledger.core.model.AggregateKind;
import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.EventAggregate;
import com.gradeledger.core.model.EventIds;
import com.gradeledger.core.model.EventType;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Generates a week of synthetic course activity for exercising the analyzer
 * without a database.
 * 
 * The output is a pure function of (seed, now). Events have the same shape and
 * idempotency-key conventions as the ones written by the engine, so the analyzer
 * cannot tell them apart.
 * 
 * Built in signals:
 * - u_student_a submits every course_cs101 assignment late
 * - course_cs101 has a gradebook recompute with drift
 * - u_student_b abandons both of their course_cs101 test attempts
 * - 18 course_cs101 attempt starts in the last 45 minutes
 */
public class DomainEventSimulator {

    public static final String DEFAULT_SEED = "gradeledger-insights-sim-v1";

    public static final String CS101 = "course_cs101";
    public static final String MATH201 = "course_math201";
    public static final List<String> STUDENTS = List.of("u_student_a", "u_student_b", "u_student_c", "u_student_d");

    static final String LATE_STUDENT = "u_student_a";
    static final String DROPOFF_STUDENT = "u_student_b";
    static final int BURST_STARTS = 18;

    private static final int TEST_DURATION_MINUTES = 60;
    private static final int TEST_VERSION = 1;
    private static final int ASSIGNMENT_VERSION = 2;
    private static final double POINTS_POSSIBLE = 100;

    private static final Comparator<DomainEvent> LEDGER_ORDER =
        Comparator.comparing(DomainEvent::occurredAt).thenComparing(DomainEvent::eventId);

    private final String seed;

    public DomainEventSimulator() {
        this(DEFAULT_SEED);
    }

    public DomainEventSimulator(String seed) {
        if (seed == null || seed.isBlank()) {
            throw new IllegalArgumentException("seed must not be blank");
        }
        this.seed = seed;
    }

    /**
     * Simulate the week ending at {@code now}.
     * 
     * @return Events ordered by (occurredAt, eventId)
     */
    public List<DomainEvent> simulate(Instant now) {
        Run run = new Run(new SplittableRandom(seedToLong(seed)), now);
        for (Course course : List.of(new Course(CS101, "u_instructor_1"), new Course(MATH201, "u_instructor_2"))) {
            run.coursework(course);
        }
        for (Course course : List.of(new Course(CS101, "u_instructor_1"), new Course(MATH201, "u_instructor_2"))) {
            run.testAttempts(course);
        }
        run.events.sort(LEDGER_ORDER);
        return List.copyOf(run.events);
    }

    static long seedToLong(String seed) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(seed.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(hash, 0, Long.BYTES).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record Course(String courseId, String instructorUid) {
    }

    /**
     * State of one simulation pass.
     */
    private static final class Run {
        private final SplittableRandom random;
        private final Instant now;
        private final Instant weekStart;
        private final List<DomainEvent> events = new ArrayList<>();
        private int requestCounter;

        Run(SplittableRandom random, Instant now) {
            this.random = random;
            this.now = now;
            this.weekStart = now.minus(Duration.ofDays(7));
        }

        void coursework(Course course) {
            boolean cs101 = CS101.equals(course.courseId());

            for (int index = 1; index <= 2; index++) {
                String assignmentId = "a_" + course.courseId() + "_" + index;
                Instant dueAt = weekStart
                    .plus(Duration.ofDays(2L + index))
                    .plusSeconds(random.nextLong(3 * 3600));

                ObjectNode published = payload(course.courseId());
                published.put("assignmentId", assignmentId);
                published.put("title", "Assignment " + index);
                published.put("pointsPossible", POINTS_POSSIBLE);
                published.put("version", ASSIGNMENT_VERSION);
                published.put("dueAt", dueAt.toString());
                published.put("allowLate", true);
                add(EventType.ASSIGNMENT_PUBLISHED, course.courseId(), course.instructorUid(), ActorRole.INSTRUCTOR,
                    EventAggregate.of(AggregateKind.ASSIGNMENT, assignmentId, ASSIGNMENT_VERSION), published,
                    key(EventType.ASSIGNMENT_PUBLISHED, course.courseId(), assignmentId + ":v" + ASSIGNMENT_VERSION),
                    weekStart.plus(Duration.ofHours(index)));

                for (String student : STUDENTS) {
                    boolean forcedLate = cs101 && LATE_STUDENT.equals(student);
                    boolean late = forcedLate || random.nextDouble() < (cs101 ? 0.25 : 0.12);
                    Instant submittedAt = late
                        ? dueAt.plus(Duration.ofHours(2 + random.nextInt(48)))
                        : dueAt.minus(Duration.ofHours(1));
                    submission(course, assignmentId, dueAt, student, submittedAt, late);
                }

                for (String student : STUDENTS) {
                    if (random.nextDouble() < 0.75) {
                        double score = Math.round(POINTS_POSSIBLE * (0.5 + random.nextDouble() * 0.5));
                        Instant gradedAt = dueAt.plus(Duration.ofDays(2)).plusSeconds(random.nextLong(8 * 3600));
                        grade(course, assignmentId, student, score, gradedAt);
                    }
                }
            }

            recompute(course, cs101);
        }

        void testAttempts(Course course) {
            boolean cs101 = CS101.equals(course.courseId());
            String testId = "t_" + course.courseId() + "_1";

            for (String student : STUDENTS) {
                boolean abandons = cs101 && DROPOFF_STUDENT.equals(student);
                int attempts = abandons ? 2 : 1 + (random.nextDouble() < 0.25 ? 1 : 0);
                for (int attemptNo = 1; attemptNo <= attempts; attemptNo++) {
                    Instant startedAt = now.minus(Duration.ofHours(48 - random.nextInt(24)));
                    String attemptId = student + "__" + attemptNo;
                    attemptStarted(course, testId, student, attemptId, attemptNo, startedAt);

                    if (!abandons && random.nextDouble() < 0.85) {
                        Instant submittedAt = startedAt.plus(Duration.ofMinutes(15 + random.nextInt(40)));
                        attemptSubmitted(course, testId, student, attemptId, attemptNo,
                            10 + random.nextInt(11), submittedAt);
                    }
                }
            }

            if (cs101) {
                Instant burstStart = now.minus(Duration.ofMinutes(45));
                for (int k = 0; k < BURST_STARTS; k++) {
                    String student = STUDENTS.get(random.nextInt(STUDENTS.size()));
                    attemptStarted(course, testId, student, student + "__burst_" + k, 99,
                        burstStart.plus(Duration.ofMinutes(k)));
                }
            }
        }

        private void submission(Course course, String assignmentId, Instant dueAt, String student,
                                Instant submittedAt, boolean late) {
            EventAggregate aggregate = EventAggregate.of(
                AggregateKind.SUBMISSION, assignmentId + ":" + student, ASSIGNMENT_VERSION);
            String keySuffix = assignmentId + ":" + student + ":v" + ASSIGNMENT_VERSION;

            ObjectNode submitted = payload(course.courseId());
            submitted.put("assignmentId", assignmentId);
            submitted.put("studentId", student);
            submitted.put("assignmentVersion", ASSIGNMENT_VERSION);
            submitted.put("status", "submitted");
            submitted.put("late", late);
            add(EventType.SUBMISSION_SUBMITTED, course.courseId(), student, ActorRole.STUDENT, aggregate, submitted,
                key(EventType.SUBMISSION_SUBMITTED, course.courseId(), keySuffix), submittedAt);

            if (late) {
                ObjectNode latePayload = payload(course.courseId());
                latePayload.put("assignmentId", assignmentId);
                latePayload.put("studentId", student);
                latePayload.put("dueAt", dueAt.toString());
                latePayload.put("submittedAt", submittedAt.toString());
                latePayload.put("lateByHours", Math.max(1, Math.round(
                    Duration.between(dueAt, submittedAt).toMinutes() / 60.0)));
                add(EventType.SUBMISSION_LATE, course.courseId(), student, ActorRole.STUDENT, aggregate, latePayload,
                    key(EventType.SUBMISSION_LATE, course.courseId(), keySuffix), submittedAt.plusSeconds(5));
            }
        }

        private void grade(Course course, String assignmentId, String student, double score, Instant gradedAt) {
            ObjectNode payload = payload(course.courseId());
            payload.put("sourceType", "assignment");
            payload.put("sourceId", assignmentId);
            payload.put("studentId", student);
            payload.put("sourceVersion", ASSIGNMENT_VERSION);
            payload.put("pointsPossible", POINTS_POSSIBLE);
            ObjectNode before = payload.putObject("before");
            before.putNull("score");
            before.put("gradeRevision", 0);
            ObjectNode after = payload.putObject("after");
            after.put("score", score);
            after.put("gradeRevision", 1);
            payload.put("deltaScore", score);
            payload.put("deltaPossible", POINTS_POSSIBLE);

            add(EventType.GRADE_MUTATED, course.courseId(), course.instructorUid(), ActorRole.INSTRUCTOR,
                EventAggregate.of(AggregateKind.GRADE, "assignment_" + assignmentId + "_" + student, 1), payload,
                EventType.GRADE_MUTATED.wireName() + ":assignment:" + course.courseId() + ":" + assignmentId
                    + ":" + student + ":r1",
                gradedAt);
        }

        private void recompute(Course course, boolean forceDrift) {
            double deltaScore = forceDrift ? 5 + random.nextInt(10) : 0;
            String student = STUDENTS.get(random.nextInt(STUDENTS.size()));
            double totalScore = 250;
            double totalPossible = 300;

            ObjectNode payload = payload(course.courseId());
            payload.put("studentId", student);
            payload.put("totalScore", totalScore);
            payload.put("totalPossible", totalPossible);
            payload.put("liveTotalScore", totalScore - deltaScore);
            payload.put("liveTotalPossible", totalPossible);
            payload.put("deltaTotalScore", deltaScore);
            payload.put("deltaTotalPossible", 0.0);
            payload.put("driftFlagged", forceDrift);
            payload.put("reconciled", false);
            payload.put("reason", "periodic_reconcile");

            Instant at = now.minus(Duration.ofHours(6));
            add(EventType.GRADEBOOK_STUDENT_RECOMPUTED, course.courseId(), course.instructorUid(),
                ActorRole.INSTRUCTOR, EventAggregate.unversioned(AggregateKind.GRADEBOOK, student), payload,
                key(EventType.GRADEBOOK_STUDENT_RECOMPUTED, course.courseId(),
                    student + ":s250:p300:ls" + (long) (totalScore - deltaScore) + ":lp300:report:d"
                        + LocalDate.ofInstant(at, ZoneOffset.UTC)),
                at);
        }

        private void attemptStarted(Course course, String testId, String student, String attemptId, int attemptNo,
                                    Instant startedAt) {
            ObjectNode payload = payload(course.courseId());
            payload.put("testId", testId);
            payload.put("attemptId", attemptId);
            payload.put("studentId", student);
            payload.put("attemptNo", attemptNo);
            payload.put("testVersion", TEST_VERSION);
            payload.put("mode", "scheduled");
            payload.put("durationMinutes", TEST_DURATION_MINUTES);
            payload.put("expiresAt", startedAt.plus(Duration.ofMinutes(TEST_DURATION_MINUTES)).toString());

            add(EventType.TEST_ATTEMPT_STARTED, course.courseId(), student, ActorRole.STUDENT,
                EventAggregate.of(AggregateKind.ATTEMPT, attemptId, TEST_VERSION), payload,
                key(EventType.TEST_ATTEMPT_STARTED, course.courseId(), testId + ":" + attemptId + ":v" + TEST_VERSION),
                startedAt);
        }

        private void attemptSubmitted(Course course, String testId, String student, String attemptId, int attemptNo,
                                      int score, Instant submittedAt) {
            ObjectNode payload = payload(course.courseId());
            payload.put("testId", testId);
            payload.put("attemptId", attemptId);
            payload.put("studentId", student);
            payload.put("attemptNo", attemptNo);
            payload.put("testVersion", TEST_VERSION);
            payload.put("score", score);
            payload.put("pointsPossible", 20);
            payload.put("assessed", true);

            add(EventType.TEST_ATTEMPT_SUBMITTED, course.courseId(), student, ActorRole.STUDENT,
                EventAggregate.of(AggregateKind.ATTEMPT, attemptId, TEST_VERSION), payload,
                key(EventType.TEST_ATTEMPT_SUBMITTED, course.courseId(), testId + ":" + attemptId + ":v" + TEST_VERSION),
                submittedAt);
        }

        private void add(EventType type, String courseId, String actorUid, String actorRole,
                         EventAggregate aggregate, ObjectNode payload, String idempotencyKey, Instant occurredAt) {
            events.add(new DomainEvent(
                EventIds.fromIdempotencyKey(idempotencyKey),
                type.wireName(),
                courseId,
                actorUid,
                actorRole,
                aggregate,
                payload,
                idempotencyKey,
                "sim-req-" + (++requestCounter),
                occurredAt));
        }

        private static ObjectNode payload(String courseId) {
            ObjectNode payload = JsonNodeFactory.instance.objectNode();
            payload.put("courseId", courseId);
            return payload;
        }

        private static String key(EventType type, String courseId, String suffix) {
            return type.wireName() + ":" + courseId + ":" + suffix;
        }
    }
}
