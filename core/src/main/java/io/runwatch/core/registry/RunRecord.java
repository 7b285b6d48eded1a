package io.runwatch.core.registry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

import io.runwatch.api.RunKind;
import io.runwatch.api.RunStatus;
import io.runwatch.api.TestStatus;
import io.runwatch.api.model.ActiveRun;
import io.runwatch.api.model.RunProgress;
import io.runwatch.api.model.RunningTest;
import io.runwatch.api.model.TestResultRecord;

/**
 * Mutable state of one admitted run. Only accessed while holding the {@link ActiveRunRegistry} lock.
 */
class RunRecord {
   final String id;
   final RunKind kind;
   final String scope;
   final long startedAt;
   final Map<String, RunningTest> running = new LinkedHashMap<>();
   final Map<String, TestResultRecord> completed = new LinkedHashMap<>();

   int totalTests;
   boolean totalFinalized;
   int passedTests;
   int failedTests;
   int skippedTests;
   RunStatus finalStatus;
   long closedAt;

   RunRecord(String id, RunKind kind, String scope, long startedAt) {
      this.id = id;
      this.kind = kind;
      this.scope = scope;
      this.startedAt = startedAt;
   }

   boolean isClosed() {
      return finalStatus != null;
   }

   boolean matches(RunKind kind, String scope) {
      if (this.kind != kind) {
         return false;
      }
      return kind == RunKind.BULK_RUN || this.scope.equals(scope);
   }

   /**
    * @return false if the total was already set; the total may be refined only once.
    */
   boolean refineTotal(int total) {
      if (totalFinalized || total <= 0) {
         return false;
      }
      totalTests = Math.max(total, completed.size());
      totalFinalized = true;
      return true;
   }

   int completedTests() {
      return passedTests + failedTests + skippedTests;
   }

   void count(TestStatus status) {
      if (status == TestStatus.PASSED) {
         passedTests++;
      } else if (status == TestStatus.SKIPPED) {
         skippedTests++;
      } else {
         assert status.countsAsFailure();
         failedTests++;
      }
   }

   Long estimatedEndTime(long now) {
      int completedTests = completedTests();
      if (completedTests == 0 || totalTests == 0 || completedTests >= totalTests) {
         return null;
      }
      long averagePerTest = (now - startedAt) / completedTests;
      return now + averagePerTest * (totalTests - completedTests);
   }

   RunProgress progress(long now) {
      return new RunProgress(totalTests, completedTests(), passedTests, failedTests, skippedTests,
            isClosed() ? null : estimatedEndTime(now), new ArrayList<>(running.values()));
   }

   ActiveRun view(long now) {
      return new ActiveRun(id, kind, scope, startedAt, progress(now), finalStatus, isClosed() ? closedAt : null);
   }

   @Override
   public String toString() {
      return id + "[" + kind.wireName() + (scope == null ? "" : " " + scope) + "]";
   }
}
