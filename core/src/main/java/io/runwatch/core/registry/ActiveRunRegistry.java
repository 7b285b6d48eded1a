package io.runwatch.core.registry;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.runwatch.api.RunKind;
import io.runwatch.api.RunStatus;
import io.runwatch.api.TestStatus;
import io.runwatch.api.event.ForceReset;
import io.runwatch.api.event.RunAdmitted;
import io.runwatch.api.event.RunClosed;
import io.runwatch.api.event.RunEvent;
import io.runwatch.api.event.RunUpdated;
import io.runwatch.api.event.TestCompleted;
import io.runwatch.api.event.TestStarted;
import io.runwatch.api.model.ActiveRun;
import io.runwatch.api.model.Admission;
import io.runwatch.api.model.AdmissionConflict;
import io.runwatch.api.model.ResetReport;
import io.runwatch.api.model.RunProgress;
import io.runwatch.api.model.RunningTest;
import io.runwatch.api.model.RunsSnapshot;
import io.runwatch.api.model.TestResultRecord;
import io.runwatch.api.store.PersistenceStore;
import io.runwatch.impl.Util;

/**
 * Single source of truth for the runs that are currently executing.
 * <p>
 * Every mutation holds the registry monitor and publishes its event to the listeners before
 * releasing it, so listeners observe events in exactly the order the mutations were applied.
 * Closed runs stay visible through {@link #find(String)} for the retention window and are then
 * dropped by {@link #evictExpired()}.
 */
public class ActiveRunRegistry {
   private static final Logger log = LogManager.getLogger(ActiveRunRegistry.class);
   // Used for conflict estimates before any test of the blocking run completed.
   static final long DEFAULT_ESTIMATED_DURATION = 180_000;
   // Ids of evicted or discarded runs remembered to ignore late notifications.
   static final int MAX_FINISHED_IDS = 10_000;

   private final Clock clock;
   private final Duration closedRetention;
   private final PersistenceStore store;
   private final Executor persistenceExecutor;
   private final ObjectMapper mapper = new ObjectMapper();
   private final Map<String, RunRecord> runs = new LinkedHashMap<>();
   private final List<RunEventListener> listeners = new CopyOnWriteArrayList<>();
   private final Map<String, Boolean> finishedIds = new LinkedHashMap<>() {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
         return size() > MAX_FINISHED_IDS;
      }
   };

   public ActiveRunRegistry(Clock clock, Duration closedRetention, PersistenceStore store, Executor persistenceExecutor) {
      this.clock = clock;
      this.closedRetention = closedRetention;
      this.store = store;
      this.persistenceExecutor = persistenceExecutor;
   }

   public void addListener(RunEventListener listener) {
      listeners.add(listener);
   }

   public synchronized Admission admit(RunKind kind, String scope) {
      checkScope(kind, scope);
      long now = clock.millis();
      AdmissionConflict conflict = findConflict(kind, scope, now);
      if (conflict != null) {
         log.info("Rejecting {} {}: {} is already running", kind.wireName(), scope, conflict.currentRunId);
         return Admission.rejected(conflict);
      }
      RunRecord record = register(UUID.randomUUID().toString(), kind, scope, now);
      return Admission.admitted(record.id);
   }

   /**
    * Admits a run launched outside of the supervisor, using the id the worker picked. Repeated
    * notifications for a known run only refine its total; notifications for a run that was
    * already evicted or discarded by {@link #forceReset()} are ignored.
    */
   public synchronized Admission attach(String runId, RunKind kind, String scope, int totalTests) {
      RunRecord existing = runs.get(runId);
      if (existing != null) {
         if (existing.isClosed()) {
            log.debug("Ignoring start of already closed run {}", runId);
         } else {
            refineTotal(existing, totalTests);
         }
         return Admission.admitted(runId);
      }
      if (finishedIds.containsKey(runId)) {
         log.debug("Ignoring start of finished run {}", runId);
         return Admission.admitted(runId);
      }
      checkScope(kind, scope);
      long now = clock.millis();
      AdmissionConflict conflict = findConflict(kind, scope, now);
      if (conflict != null) {
         log.info("Rejecting attached run {} ({} {}): {} is already running", runId, kind.wireName(), scope, conflict.currentRunId);
         return Admission.rejected(conflict);
      }
      RunRecord record = register(runId, kind, scope, now);
      refineTotal(record, totalTests);
      return Admission.admitted(runId);
   }

   public synchronized boolean refineTotal(String runId, int totalTests) {
      RunRecord record = runs.get(runId);
      if (record == null || record.isClosed()) {
         log.debug("Cannot set total for unknown run {}", runId);
         return false;
      }
      return refineTotal(record, totalTests);
   }

   private boolean refineTotal(RunRecord record, int totalTests) {
      if (!record.refineTotal(totalTests)) {
         return false;
      }
      long now = clock.millis();
      publish(new RunUpdated(now, record.view(now)));
      return true;
   }

   /**
    * @return progress after the start was recorded or <code>null</code> when the run is unknown,
    * closed or the test has already finished in this run.
    */
   public synchronized RunProgress startTest(String runId, String testId, String name, String filePath) {
      RunRecord record = runs.get(runId);
      if (record == null || record.isClosed()) {
         log.debug("Ignoring start of {} in unknown run {}", testId, runId);
         return null;
      }
      if (record.completed.containsKey(testId)) {
         log.warn("Test {} in run {} started after it has completed, ignoring.", testId, runId);
         return null;
      }
      long now = clock.millis();
      RunningTest test = new RunningTest(testId, name, filePath, now);
      if (record.running.put(testId, test) != null) {
         log.debug("Test {} in run {} started twice", testId, runId);
      }
      RunProgress progress = record.progress(now);
      publish(new TestStarted(now, runId, test, progress));
      return progress;
   }

   public boolean completeTest(String runId, String testId, TestStatus status) {
      return completeTest(runId, testId, status, null, null);
   }

   /**
    * Records the outcome of a test. Each test is counted once per run; repeated completions are
    * ignored.
    *
    * @return true if the counters changed.
    */
   public synchronized boolean completeTest(String runId, String testId, TestStatus status, String name, String filePath) {
      RunRecord record = runs.get(runId);
      if (record == null || record.isClosed()) {
         log.debug("Ignoring completion of {} in unknown run {}", testId, runId);
         return false;
      }
      if (record.completed.containsKey(testId)) {
         log.debug("Test {} in run {} completed twice", testId, runId);
         return false;
      }
      if (record.totalFinalized && record.completedTests() >= record.totalTests) {
         log.warn("Run {} already completed all its {} tests, ignoring {}", runId, record.totalTests, testId);
         return false;
      }
      long now = clock.millis();
      RunningTest running = record.running.remove(testId);
      if (running == null) {
         if (status == TestStatus.SKIPPED) {
            log.debug("Test {} in run {} was skipped without starting", testId, runId);
         } else {
            log.warn("Test {} in run {} completed without being started", testId, runId);
         }
      } else {
         if (name == null) {
            name = running.name;
         }
         if (filePath == null) {
            filePath = running.filePath;
         }
      }
      long startedAt = running == null ? now : running.startedAt;
      record.completed.put(testId, new TestResultRecord(testId, runId, name, filePath, status, startedAt, now));
      record.count(status);
      if (!record.totalFinalized && record.totalTests < record.completedTests()) {
         // The worker has not announced the total; keep it consistent with the counters.
         record.totalTests = record.completedTests();
      }
      publish(new TestCompleted(now, runId, testId, status, record.progress(now)));
      return true;
   }

   /**
    * Marks the run finished. The run stops blocking admission immediately and its results are
    * handed to the persistence store.
    *
    * @return view of the closed run or <code>null</code> if it was unknown or already closed.
    */
   public ActiveRun close(String runId, RunStatus status) {
      ActiveRun closed;
      List<TestResultRecord> results;
      synchronized (this) {
         RunRecord record = runs.get(runId);
         if (record == null || record.isClosed()) {
            log.debug("Ignoring end of unknown run {}", runId);
            return null;
         }
         results = new ArrayList<>(record.completed.values());
         closed = closeRecord(record, status, clock.millis());
      }
      persist(closed, results);
      return closed;
   }

   private ActiveRun closeRecord(RunRecord record, RunStatus status, long now) {
      record.running.clear();
      record.finalStatus = status;
      record.closedAt = now;
      ActiveRun view = record.view(now);
      log.info("Run {} finished as {} after {}: {} passed, {} failed, {} skipped", record,
            status, Util.prettyPrintMillis(now - record.startedAt), record.passedTests, record.failedTests, record.skippedTests);
      publish(new RunClosed(now, view));
      return view;
   }

   private void persist(ActiveRun run, List<TestResultRecord> results) {
      try {
         persistenceExecutor.execute(() -> {
            try {
               for (TestResultRecord result : results) {
                  store.saveTestResult(result);
               }
               store.saveCompletedRun(run);
            } catch (IOException e) {
               log.error("Failed to persist run {}", run.runId, e);
            }
         });
      } catch (RejectedExecutionException e) {
         log.error("Cannot persist run {}, persistence executor rejected the task.", run.runId, e);
      }
   }

   public synchronized boolean isRunning(String runId) {
      RunRecord record = runs.get(runId);
      return record != null && !record.isClosed();
   }

   /**
    * @return an active run or a run closed within the retention window, <code>null</code> otherwise.
    */
   public synchronized ActiveRun find(String runId) {
      RunRecord record = runs.get(runId);
      return record == null ? null : record.view(clock.millis());
   }

   public synchronized RunsSnapshot snapshot() {
      return snapshot(clock.millis());
   }

   private RunsSnapshot snapshot(long now) {
      List<ActiveRun> active = new ArrayList<>();
      for (RunRecord record : runs.values()) {
         if (!record.isClosed()) {
            active.add(record.view(now));
         }
      }
      return new RunsSnapshot(active, now);
   }

   /**
    * Applies the function to the current snapshot while holding the registry lock, so no event
    * can be published between the snapshot and whatever the function does.
    */
   public synchronized <T> T withSnapshot(Function<RunsSnapshot, T> function) {
      return function.apply(snapshot(clock.millis()));
   }

   /**
    * Operator escape hatch: discards every tracked run regardless of its state. Supervised
    * processes keep running unless the caller terminates them.
    */
   public synchronized ResetReport forceReset() {
      long now = clock.millis();
      RunsSnapshot before = snapshot(now);
      List<String> discarded = new ArrayList<>();
      for (RunRecord record : runs.values()) {
         if (!record.isClosed()) {
            discarded.add(record.id);
         }
         finishedIds.put(record.id, Boolean.TRUE);
      }
      runs.clear();
      RunsSnapshot after = snapshot(now);
      log.warn("Force reset discarded {} run(s). Before: {}", discarded.size(), toJson(before));
      log.warn("Force reset completed. After: {}", toJson(after));
      publish(new ForceReset(now, discarded));
      return new ResetReport(before, after);
   }

   /**
    * Drops closed runs whose retention window has elapsed.
    *
    * @return number of evicted runs.
    */
   public synchronized int evictExpired() {
      long threshold = clock.millis() - closedRetention.toMillis();
      int evicted = 0;
      for (Iterator<RunRecord> it = runs.values().iterator(); it.hasNext(); ) {
         RunRecord record = it.next();
         if (record.isClosed() && record.closedAt <= threshold) {
            it.remove();
            finishedIds.put(record.id, Boolean.TRUE);
            evicted++;
         }
      }
      if (evicted > 0) {
         log.debug("Evicted {} closed run(s)", evicted);
      }
      return evicted;
   }

   /**
    * Closes as {@link RunStatus#FAILED} every run that has been active for longer than
    * <code>maxAge</code>; a zero or negative age disables the check.
    *
    * @return ids of the closed runs.
    */
   public List<String> expireStale(Duration maxAge) {
      List<String> expired = new ArrayList<>();
      if (maxAge.isZero() || maxAge.isNegative()) {
         return expired;
      }
      List<ActiveRun> closedRuns = new ArrayList<>();
      List<List<TestResultRecord>> closedResults = new ArrayList<>();
      synchronized (this) {
         long now = clock.millis();
         for (RunRecord record : new ArrayList<>(runs.values())) {
            if (!record.isClosed() && now - record.startedAt > maxAge.toMillis()) {
               log.warn("Run {} has been running for more than {}, closing it as failed.", record, maxAge);
               closedResults.add(new ArrayList<>(record.completed.values()));
               closedRuns.add(closeRecord(record, RunStatus.FAILED, now));
               expired.add(record.id);
            }
         }
      }
      for (int i = 0; i < closedRuns.size(); ++i) {
         persist(closedRuns.get(i), closedResults.get(i));
      }
      return expired;
   }

   private RunRecord register(String runId, RunKind kind, String scope, long now) {
      RunRecord record = new RunRecord(runId, kind, kind.isScoped() ? scope : null, now);
      runs.put(runId, record);
      log.info("Admitted run {}", record);
      publish(new RunAdmitted(now, record.view(now)));
      return record;
   }

   private void checkScope(RunKind kind, String scope) {
      if (kind.isScoped() && (scope == null || scope.isEmpty())) {
         throw new IllegalArgumentException(kind.wireName() + " requires a scope");
      }
   }

   private AdmissionConflict findConflict(RunKind kind, String scope, long now) {
      for (RunRecord record : runs.values()) {
         if (record.isClosed() || !record.matches(kind, scope)) {
            continue;
         }
         long elapsed = now - record.startedAt;
         Long estimatedEnd = record.estimatedEndTime(now);
         long remaining = estimatedEnd != null ? estimatedEnd - now : Math.max(0, DEFAULT_ESTIMATED_DURATION - elapsed);
         return new AdmissionConflict(record.id, record.kind, record.scope, record.startedAt, elapsed, remaining);
      }
      return null;
   }

   private void publish(RunEvent event) {
      for (RunEventListener listener : listeners) {
         try {
            listener.onEvent(event);
         } catch (RuntimeException e) {
            log.error("Listener {} failed to process {}", listener, event, e);
         }
      }
   }

   private String toJson(Object value) {
      try {
         return mapper.writeValueAsString(value);
      } catch (JsonProcessingException e) {
         return String.valueOf(value);
      }
   }
}
