package io.runwatch.core.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.runwatch.api.RunKind;
import io.runwatch.api.RunStatus;
import io.runwatch.api.TestStatus;
import io.runwatch.api.event.ForceReset;
import io.runwatch.api.event.RunClosed;
import io.runwatch.api.event.RunEvent;
import io.runwatch.api.event.TestCompleted;
import io.runwatch.api.event.TestStarted;
import io.runwatch.api.model.ActiveRun;
import io.runwatch.api.model.Admission;
import io.runwatch.api.model.ResetReport;
import io.runwatch.api.model.RunProgress;
import io.runwatch.api.model.RunsSnapshot;
import io.runwatch.api.model.TestResultRecord;
import io.runwatch.api.store.PersistenceStore;
import io.runwatch.core.MutableClock;

public class ActiveRunRegistryTest {
   private final MutableClock clock = new MutableClock(1_000_000);
   private final List<RunEvent> events = new ArrayList<>();
   private final List<ActiveRun> savedRuns = new ArrayList<>();
   private final List<TestResultRecord> savedResults = new ArrayList<>();
   private ActiveRunRegistry registry;

   @BeforeEach
   public void setup() {
      PersistenceStore store = new PersistenceStore() {
         @Override
         public void saveCompletedRun(ActiveRun run) {
            savedRuns.add(run);
         }

         @Override
         public void saveTestResult(TestResultRecord result) {
            savedResults.add(result);
         }
      };
      registry = new ActiveRunRegistry(clock, Duration.ofSeconds(30), store, Runnable::run);
      registry.addListener(events::add);
   }

   @Test
   public void testBulkRunLifecycle() {
      String runId = registry.admit(RunKind.BULK_RUN, null).runId();
      assertThat(registry.refineTotal(runId, 3)).isTrue();

      clock.advance(Duration.ofSeconds(1));
      registry.startTest(runId, "test-a", "a", "a.spec.ts");
      registry.startTest(runId, "test-b", "b", "b.spec.ts");
      clock.advance(Duration.ofSeconds(1));
      assertThat(registry.completeTest(runId, "test-a", TestStatus.PASSED)).isTrue();
      assertThat(registry.completeTest(runId, "test-b", TestStatus.FAILED)).isTrue();
      registry.startTest(runId, "test-c", "c", "c.spec.ts");
      assertThat(registry.completeTest(runId, "test-c", TestStatus.SKIPPED)).isTrue();

      ActiveRun view = registry.find(runId);
      assertThat(view.progress.totalTests).isEqualTo(3);
      assertThat(view.progress.completedTests).isEqualTo(3);
      assertThat(view.progress.passedTests).isEqualTo(1);
      assertThat(view.progress.failedTests).isEqualTo(1);
      assertThat(view.progress.skippedTests).isEqualTo(1);
      assertThat(view.progress.runningTests).isEmpty();

      ActiveRun closed = registry.close(runId, RunStatus.fromExitCode(1));
      assertThat(closed.finalStatus).isEqualTo(RunStatus.FAILED);
      assertThat(registry.isRunning(runId)).isFalse();
      assertThat(registry.snapshot().activeRuns).isEmpty();
      assertThat(registry.snapshot().isAnyRunning).isFalse();

      assertThat(events).extracting(e -> e.type()).containsExactly(
            RunEvent.Type.RUN_ADMITTED, RunEvent.Type.RUN_UPDATED,
            RunEvent.Type.TEST_STARTED, RunEvent.Type.TEST_STARTED,
            RunEvent.Type.TEST_COMPLETED, RunEvent.Type.TEST_COMPLETED,
            RunEvent.Type.TEST_STARTED, RunEvent.Type.TEST_COMPLETED,
            RunEvent.Type.RUN_CLOSED);
      assertThat(savedRuns).extracting(r -> r.runId).containsExactly(runId);
      assertThat(savedResults).extracting(r -> r.testId).containsExactly("test-a", "test-b", "test-c");
   }

   @Test
   public void testSecondBulkRunRejected() {
      String runId = registry.admit(RunKind.BULK_RUN, null).runId();
      clock.advance(Duration.ofSeconds(20));

      Admission second = registry.admit(RunKind.BULK_RUN, null);
      assertThat(second.isAdmitted()).isFalse();
      assertThat(second.conflict().currentRunId).isEqualTo(runId);
      assertThat(second.conflict().elapsedMs).isEqualTo(20_000);
      assertThat(second.conflict().estimatedRemainingMs).isEqualTo(160_000);
      assertThat(second.conflict().code()).isEqualTo("TESTS_ALREADY_RUNNING");
      assertThatThrownBy(second::runId).isInstanceOf(IllegalStateException.class);
      assertThat(events).hasSize(1);
   }

   @Test
   public void testConflictUsesProgressEstimate() {
      String runId = registry.admit(RunKind.BULK_RUN, null).runId();
      registry.refineTotal(runId, 4);
      registry.startTest(runId, "test-a", "a", "a.spec.ts");
      clock.advance(Duration.ofSeconds(10));
      registry.completeTest(runId, "test-a", TestStatus.PASSED);

      Admission second = registry.admit(RunKind.BULK_RUN, null);
      assertThat(second.conflict().estimatedRemainingMs).isEqualTo(30_000);
      assertThat(registry.find(runId).progress.estimatedEndTime).isEqualTo(clock.millis() + 30_000);
   }

   @Test
   public void testGroupRunsKeyedByScope() {
      Admission suiteA = registry.admit(RunKind.GROUP_RUN, "suiteA");
      Admission suiteB = registry.admit(RunKind.GROUP_RUN, "suiteB");
      Admission suiteAAgain = registry.admit(RunKind.GROUP_RUN, "suiteA");

      assertThat(suiteA.isAdmitted()).isTrue();
      assertThat(suiteB.isAdmitted()).isTrue();
      assertThat(suiteAAgain.isAdmitted()).isFalse();
      assertThat(suiteAAgain.conflict().currentRunId).isEqualTo(suiteA.runId());
      assertThat(suiteAAgain.conflict().scope).isEqualTo("suiteA");
      assertThat(suiteAAgain.conflict().isScopeMatch()).isTrue();

      RunsSnapshot snapshot = registry.snapshot();
      assertThat(snapshot.activeGroups).containsExactly("suiteA", "suiteB");
      assertThat(snapshot.isAnyRunning).isTrue();

      registry.close(suiteA.runId(), RunStatus.COMPLETED);
      assertThat(registry.admit(RunKind.GROUP_RUN, "suiteA").isAdmitted()).isTrue();
   }

   @Test
   public void testKindsDoNotBlockEachOther() {
      assertThat(registry.admit(RunKind.BULK_RUN, null).isAdmitted()).isTrue();
      assertThat(registry.admit(RunKind.GROUP_RUN, "suiteA").isAdmitted()).isTrue();
      assertThat(registry.admit(RunKind.SINGLE_RERUN, "test-abc").isAdmitted()).isTrue();
      assertThat(registry.admit(RunKind.SINGLE_RERUN, "test-abc").isAdmitted()).isFalse();
      assertThat(registry.snapshot().activeRuns).hasSize(3);
   }

   @Test
   public void testScopeRequired() {
      assertThatThrownBy(() -> registry.admit(RunKind.GROUP_RUN, null)).isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> registry.admit(RunKind.SINGLE_RERUN, "")).isInstanceOf(IllegalArgumentException.class);
   }

   @Test
   public void testUnknownRun() {
      assertThat(registry.startTest("nope", "test-a", "a", "a.spec.ts")).isNull();
      assertThat(registry.completeTest("nope", "test-a", TestStatus.PASSED)).isFalse();
      assertThat(registry.close("nope", RunStatus.COMPLETED)).isNull();
      assertThat(registry.refineTotal("nope", 3)).isFalse();
      assertThat(registry.isRunning("nope")).isFalse();
      assertThat(registry.find("nope")).isNull();
      assertThat(events).isEmpty();
   }

   @Test
   public void testDuplicateCompletionCountedOnce() {
      String runId = registry.admit(RunKind.BULK_RUN, null).runId();
      registry.startTest(runId, "test-a", "a", "a.spec.ts");
      assertThat(registry.completeTest(runId, "test-a", TestStatus.PASSED)).isTrue();
      assertThat(registry.completeTest(runId, "test-a", TestStatus.FAILED)).isFalse();

      RunProgress progress = registry.find(runId).progress;
      assertThat(progress.completedTests).isEqualTo(1);
      assertThat(progress.passedTests).isEqualTo(1);
      assertThat(progress.failedTests).isZero();
   }

   @Test
   public void testStartAfterCompleteRejected() {
      String runId = registry.admit(RunKind.BULK_RUN, null).runId();
      registry.startTest(runId, "test-a", "a", "a.spec.ts");
      registry.completeTest(runId, "test-a", TestStatus.PASSED);

      assertThat(registry.startTest(runId, "test-a", "a", "a.spec.ts")).isNull();
      RunProgress progress = registry.find(runId).progress;
      assertThat(progress.runningTests).isEmpty();
      assertThat(progress.isRunning("test-a")).isFalse();
   }

   @Test
   public void testCompleteWithoutStart() {
      String runId = registry.admit(RunKind.GROUP_RUN, "suiteA").runId();
      assertThat(registry.completeTest(runId, "test-a", TestStatus.SKIPPED, "a", "a.spec.ts")).isTrue();

      RunProgress progress = registry.find(runId).progress;
      assertThat(progress.skippedTests).isEqualTo(1);
      // total follows the counters while the worker has not announced it
      assertThat(progress.totalTests).isEqualTo(1);
      assertThat(registry.refineTotal(runId, 5)).isTrue();
      assertThat(registry.refineTotal(runId, 7)).isFalse();
      assertThat(registry.find(runId).progress.totalTests).isEqualTo(5);
   }

   @Test
   public void testCompletionsBeyondTotalRejected() {
      String runId = registry.admit(RunKind.BULK_RUN, null).runId();
      registry.refineTotal(runId, 1);
      assertThat(registry.completeTest(runId, "test-a", TestStatus.PASSED)).isTrue();
      assertThat(registry.completeTest(runId, "test-b", TestStatus.PASSED)).isFalse();
      assertThat(registry.find(runId).progress.completedTests).isEqualTo(1);
   }

   @Test
   public void testRunEndIdempotent() {
      String runId = registry.admit(RunKind.BULK_RUN, null).runId();
      assertThat(registry.close(runId, RunStatus.COMPLETED)).isNotNull();
      assertThat(registry.close(runId, RunStatus.FAILED)).isNull();
      assertThat(registry.find(runId).finalStatus).isEqualTo(RunStatus.COMPLETED);
      assertThat(events).filteredOn(e -> e instanceof RunClosed).hasSize(1);
      assertThat(savedRuns).hasSize(1);
   }

   @Test
   public void testClosedRunDoesNotAcceptUpdates() {
      String runId = registry.admit(RunKind.BULK_RUN, null).runId();
      registry.close(runId, RunStatus.COMPLETED);
      assertThat(registry.startTest(runId, "test-a", "a", "a.spec.ts")).isNull();
      assertThat(registry.completeTest(runId, "test-a", TestStatus.PASSED)).isFalse();
   }

   @Test
   public void testEvictAfterRetention() {
      String runId = registry.admit(RunKind.BULK_RUN, null).runId();
      registry.close(runId, RunStatus.COMPLETED);

      clock.advance(Duration.ofSeconds(10));
      assertThat(registry.evictExpired()).isZero();
      assertThat(registry.find(runId)).isNotNull();
      assertThat(registry.find(runId).closedAt).isNotNull();

      clock.advance(Duration.ofSeconds(21));
      assertThat(registry.evictExpired()).isEqualTo(1);
      assertThat(registry.find(runId)).isNull();
   }

   @Test
   public void testExpireStale() {
      String old = registry.admit(RunKind.GROUP_RUN, "suiteA").runId();
      clock.advance(Duration.ofMinutes(20));
      String recent = registry.admit(RunKind.GROUP_RUN, "suiteB").runId();
      clock.advance(Duration.ofMinutes(11));

      assertThat(registry.expireStale(Duration.ZERO)).isEmpty();
      assertThat(registry.expireStale(Duration.ofMinutes(30))).containsExactly(old);
      assertThat(registry.isRunning(old)).isFalse();
      assertThat(registry.isRunning(recent)).isTrue();
      assertThat(registry.find(old).finalStatus).isEqualTo(RunStatus.FAILED);
      assertThat(savedRuns).extracting(r -> r.runId).containsExactly(old);
   }

   @Test
   public void testForceReset() {
      String bulk = registry.admit(RunKind.BULK_RUN, null).runId();
      String group = registry.admit(RunKind.GROUP_RUN, "suiteA").runId();
      events.clear();

      ResetReport report = registry.forceReset();
      assertThat(report.before.activeRuns).extracting(r -> r.runId).containsExactly(bulk, group);
      assertThat(report.after.activeRuns).isEmpty();
      assertThat(report.after.isAnyRunning).isFalse();
      assertThat(registry.isRunning(bulk)).isFalse();
      assertThat(events).hasSize(1);
      assertThat(((ForceReset) events.get(0)).discardedRunIds).containsExactly(bulk, group);

      assertThat(registry.admit(RunKind.BULK_RUN, null).isAdmitted()).isTrue();
      // late callbacks from the discarded run are ignored
      assertThat(registry.startTest(bulk, "test-a", "a", "a.spec.ts")).isNull();
   }

   @Test
   public void testAttach() {
      Admission attached = registry.attach("worker-1", RunKind.GROUP_RUN, "suiteA", 0);
      assertThat(attached.runId()).isEqualTo("worker-1");
      assertThat(registry.attach("worker-1", RunKind.GROUP_RUN, "suiteA", 4).isAdmitted()).isTrue();
      assertThat(registry.find("worker-1").progress.totalTests).isEqualTo(4);
      assertThat(registry.attach("worker-2", RunKind.GROUP_RUN, "suiteA", 2).isAdmitted()).isFalse();
      assertThat(events).extracting(RunEvent::type).containsExactly(RunEvent.Type.RUN_ADMITTED, RunEvent.Type.RUN_UPDATED);
   }

   @Test
   public void testRepeatedStartOfEvictedRunIgnored() {
      registry.attach("worker-1", RunKind.BULK_RUN, null, 3);
      registry.close("worker-1", RunStatus.COMPLETED);
      clock.advance(Duration.ofSeconds(31));
      assertThat(registry.evictExpired()).isEqualTo(1);
      events.clear();

      assertThat(registry.attach("worker-1", RunKind.BULK_RUN, null, 3).isAdmitted()).isTrue();
      assertThat(registry.isRunning("worker-1")).isFalse();
      assertThat(registry.find("worker-1")).isNull();
      assertThat(events).isEmpty();
      assertThat(registry.admit(RunKind.BULK_RUN, null).isAdmitted()).isTrue();
   }

   @Test
   public void testRepeatedStartOfDiscardedRunIgnored() {
      registry.attach("worker-1", RunKind.GROUP_RUN, "suiteA", 0);
      registry.forceReset();

      registry.attach("worker-1", RunKind.GROUP_RUN, "suiteA", 0);
      assertThat(registry.isRunning("worker-1")).isFalse();
      assertThat(registry.snapshot().activeRuns).isEmpty();
      assertThat(registry.attach("worker-2", RunKind.GROUP_RUN, "suiteA", 0).isAdmitted()).isTrue();
   }

   @Test
   public void testConcurrentBulkAdmission() throws Exception {
      int threads = 16;
      ExecutorService executor = Executors.newFixedThreadPool(threads);
      CountDownLatch ready = new CountDownLatch(threads);
      CountDownLatch go = new CountDownLatch(1);
      List<Future<Admission>> futures = new ArrayList<>();
      try {
         for (int i = 0; i < threads; ++i) {
            futures.add(executor.submit(() -> {
               ready.countDown();
               go.await();
               return registry.admit(RunKind.BULK_RUN, null);
            }));
         }
         ready.await(10, TimeUnit.SECONDS);
         go.countDown();
         List<Admission> admissions = new ArrayList<>();
         for (Future<Admission> future : futures) {
            admissions.add(future.get(10, TimeUnit.SECONDS));
         }

         List<Admission> admitted = admissions.stream().filter(Admission::isAdmitted).collect(Collectors.toList());
         assertThat(admitted).hasSize(1);
         String winner = admitted.get(0).runId();
         assertThat(admissions).filteredOn(a -> !a.isAdmitted())
               .hasSize(threads - 1)
               .allSatisfy(a -> assertThat(a.conflict().currentRunId).isEqualTo(winner));
         assertThat(registry.snapshot().activeRuns).extracting(r -> r.runId).containsExactly(winner);
      } finally {
         executor.shutdownNow();
      }
   }

   @Test
   public void testEventsCarryProgress() {
      String runId = registry.admit(RunKind.SINGLE_RERUN, "test-a").runId();
      registry.startTest(runId, "test-a", "a", "a.spec.ts");
      registry.completeTest(runId, "test-a", TestStatus.TIMED_OUT);

      TestStarted started = (TestStarted) events.get(1);
      assertThat(started.progress.runningTests).extracting(t -> t.testId).containsExactly("test-a");
      TestCompleted completed = (TestCompleted) events.get(2);
      assertThat(completed.status).isEqualTo(TestStatus.TIMED_OUT);
      assertThat(completed.progress.failedTests).isEqualTo(1);
      assertThat(completed.progress.runningTests).isEmpty();
   }

   @Test
   public void testFailingListenerDoesNotBreakRegistry() {
      registry.addListener(event -> {
         throw new IllegalStateException("boom");
      });
      String runId = registry.admit(RunKind.BULK_RUN, null).runId();
      assertThat(registry.isRunning(runId)).isTrue();
      assertThat(events).hasSize(1);
   }
}
