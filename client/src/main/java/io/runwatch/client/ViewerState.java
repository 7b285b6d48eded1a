package io.runwatch.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.runwatch.api.RunKind;
import io.runwatch.api.event.ForceReset;
import io.runwatch.api.event.RunAdmitted;
import io.runwatch.api.event.RunClosed;
import io.runwatch.api.event.RunEvent;
import io.runwatch.api.event.RunUpdated;
import io.runwatch.api.event.TestCompleted;
import io.runwatch.api.event.TestStarted;
import io.runwatch.api.model.ActiveRun;
import io.runwatch.api.model.RunProgress;
import io.runwatch.api.model.RunsSnapshot;

/**
 * Viewer-side picture of the running runs.
 * <p>
 * A snapshot replaces the whole state. Events are applied on top of it; an event that does not
 * fit the current state (e.g. progress of a run the viewer has never seen) is reported so that
 * the caller can ask for a fresh snapshot. Every derived flag is computed from the active runs
 * only, so it can never outlive the run it describes.
 */
public class ViewerState {
   private final Map<String, ActiveRun> runs = new LinkedHashMap<>();
   private long timestamp;
   private boolean synced;

   public synchronized void applySnapshot(RunsSnapshot snapshot) {
      runs.clear();
      for (ActiveRun run : snapshot.activeRuns) {
         runs.put(run.runId, run);
      }
      timestamp = snapshot.timestamp;
      synced = true;
   }

   /**
    * @return false if the event could not be applied and the state should be replaced by a snapshot.
    */
   public synchronized boolean apply(RunEvent event) {
      if (!synced) {
         return false;
      }
      boolean applied = event.accept(updater);
      if (applied) {
         timestamp = Math.max(timestamp, event.timestamp);
      }
      return applied;
   }

   /**
    * Marks the state as stale, e.g. after the connection was lost. Events are not applied until
    * the next snapshot arrives.
    */
   public synchronized void invalidate() {
      synced = false;
   }

   public synchronized boolean isSynced() {
      return synced;
   }

   public synchronized List<ActiveRun> activeRuns() {
      return Collections.unmodifiableList(new ArrayList<>(runs.values()));
   }

   public synchronized ActiveRun find(String runId) {
      return runs.get(runId);
   }

   public synchronized boolean isAnyRunning() {
      return !runs.isEmpty();
   }

   public synchronized boolean isBulkRunning() {
      return runs.values().stream().anyMatch(r -> r.kind == RunKind.BULK_RUN);
   }

   public synchronized boolean isGroupRunning(String filePath) {
      return runs.values().stream().anyMatch(r -> r.kind == RunKind.GROUP_RUN && r.scope.equals(filePath));
   }

   public synchronized boolean isTestRerunning(String testId) {
      return runs.values().stream().anyMatch(r -> r.kind == RunKind.SINGLE_RERUN && r.scope.equals(testId));
   }

   /**
    * @return true if the test executes in any active run, regardless of its kind.
    */
   public synchronized boolean isTestRunning(String testId) {
      return runs.values().stream().anyMatch(r -> r.progress.isRunning(testId));
   }

   public synchronized long timestamp() {
      return timestamp;
   }

   private boolean updateProgress(String runId, RunProgress progress) {
      ActiveRun run = runs.get(runId);
      if (run == null) {
         return false;
      }
      runs.put(runId, new ActiveRun(run.runId, run.kind, run.scope, run.startedAt, progress, run.finalStatus, run.closedAt));
      return true;
   }

   private final RunEvent.Visitor<Boolean> updater = new RunEvent.Visitor<>() {
      @Override
      public Boolean visit(RunAdmitted event) {
         runs.put(event.run.runId, event.run);
         return true;
      }

      @Override
      public Boolean visit(RunUpdated event) {
         if (!runs.containsKey(event.run.runId)) {
            return false;
         }
         runs.put(event.run.runId, event.run);
         return true;
      }

      @Override
      public Boolean visit(TestStarted event) {
         return updateProgress(event.runId, event.progress);
      }

      @Override
      public Boolean visit(TestCompleted event) {
         return updateProgress(event.runId, event.progress);
      }

      @Override
      public Boolean visit(RunClosed event) {
         runs.remove(event.run.runId);
         return true;
      }

      @Override
      public Boolean visit(ForceReset event) {
         runs.clear();
         return true;
      }
   };
}
