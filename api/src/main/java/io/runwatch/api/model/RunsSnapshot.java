package io.runwatch.api.model;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.runwatch.api.RunKind;

/**
 * Complete and consistent view of everything running at {@link #timestamp}. Viewers replace
 * their state with a snapshot instead of merging it.
 */
public class RunsSnapshot {
   public final List<ActiveRun> activeRuns;
   public final List<String> activeGroups;
   @JsonProperty("isAnyRunning")
   public final boolean isAnyRunning;
   public final long timestamp;

   public RunsSnapshot(List<ActiveRun> activeRuns, long timestamp) {
      this(activeRuns, groupsOf(activeRuns), !activeRuns.isEmpty(), timestamp);
   }

   @JsonCreator
   public RunsSnapshot(@JsonProperty("activeRuns") List<ActiveRun> activeRuns,
                       @JsonProperty("activeGroups") List<String> activeGroups,
                       @JsonProperty("isAnyRunning") boolean isAnyRunning,
                       @JsonProperty("timestamp") long timestamp) {
      this.activeRuns = activeRuns == null ? Collections.emptyList() : Collections.unmodifiableList(activeRuns);
      this.activeGroups = activeGroups == null ? Collections.emptyList() : Collections.unmodifiableList(activeGroups);
      this.isAnyRunning = isAnyRunning;
      this.timestamp = timestamp;
   }

   private static List<String> groupsOf(List<ActiveRun> runs) {
      return runs.stream().filter(r -> r.kind == RunKind.GROUP_RUN && r.scope != null)
            .map(r -> r.scope).collect(Collectors.toList());
   }

   public ActiveRun find(String runId) {
      return activeRuns.stream().filter(r -> r.runId.equals(runId)).findFirst().orElse(null);
   }

   @Override
   public String toString() {
      return "RunsSnapshot{activeRuns=" + activeRuns + ", isAnyRunning=" + isAnyRunning + '}';
   }
}
