package io.runwatch.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.runwatch.api.RunKind;
import io.runwatch.api.RunStatus;

/**
 * Point-in-time view of one run. Runs listed in a {@link RunsSnapshot} are always running;
 * {@link #finalStatus} and {@link #closedAt} are set only on views of closed runs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActiveRun {
   public final String runId;
   public final RunKind kind;
   public final String scope;
   public final long startedAt;
   public final RunProgress progress;
   public final RunStatus finalStatus;
   public final Long closedAt;

   @JsonCreator
   public ActiveRun(@JsonProperty("runId") String runId,
                    @JsonProperty("kind") RunKind kind,
                    @JsonProperty("scope") String scope,
                    @JsonProperty("startedAt") long startedAt,
                    @JsonProperty("progress") RunProgress progress,
                    @JsonProperty("finalStatus") RunStatus finalStatus,
                    @JsonProperty("closedAt") Long closedAt) {
      this.runId = runId;
      this.kind = kind;
      this.scope = scope;
      this.startedAt = startedAt;
      this.progress = progress;
      this.finalStatus = finalStatus;
      this.closedAt = closedAt;
   }

   @JsonIgnore
   public boolean isClosed() {
      return finalStatus != null;
   }

   @Override
   public String toString() {
      return runId + "[" + kind.wireName() + (scope == null ? "" : " " + scope) + "] " +
            (finalStatus == null ? "running " + progress : finalStatus.wireName());
   }
}
