package com.gradeledger.engine.reconcile;

import com.gradeledger.core.model.Actor;
import com.gradeledger.core.model.GradebookEntry;
import com.gradeledger.engine.reconcile.GradebookReconciler.ReconcileReport;
import com.gradeledger.engine.test.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.gradeledger.engine.test.LedgerFixture.COURSE;
import static org.assertj.core.api.Assertions.assertThat;

public class GradebookReconcilerTest {

    private LedgerFixture ledger;
    private GradebookReconciler reconciler;

    @BeforeEach
    void setUp() {
        ledger = LedgerFixture.create();
        reconciler = new GradebookReconciler(ledger.gradebooks, ledger.gradebook);
        ledger.publishTest("quiz1");
        ledger.gradeTest("quiz1", "u_ana", 6, 10);
        ledger.gradeTest("quiz1", "u_ben", 8, 10);
    }

    @Test
    @DisplayName("Clean gradebooks produce an empty drift report")
    void noDrift() {
        ReconcileReport report = reconciler.reconcileAll();

        assertThat(report.checked()).isEqualTo(2);
        assertThat(report.drifted()).isEmpty();
        assertThat(report.failed()).isZero();
    }

    @Test
    @DisplayName("Drifted entries are reported and left untouched")
    void driftReportedNotRepaired() {
        ledger.memoryStore.execute(tx -> {
            GradebookEntry live = tx.readGradebook(COURSE, "u_ben").orElseThrow();
            tx.putGradebook(live.withTotals(99, 10, ledger.clock.instant()));
            return null;
        });

        ReconcileReport report = reconciler.reconcileAll();

        assertThat(report.drifted()).singleElement().satisfies(drift -> {
            assertThat(drift.studentId()).isEqualTo("u_ben");
            assertThat(drift.reconciled()).isFalse();
            assertThat(drift.event().actorUid()).isEqualTo(Actor.RECONCILER.uid());
        });
        assertThat(ledger.gradebook.getGradebook(COURSE, "u_ben").totalScore()).isEqualTo(99.0);
    }
}
