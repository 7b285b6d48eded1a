package io.runwatch.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.runwatch.api.RunKind;

/**
 * Describes the active run that blocked an admission, so the user can decide to wait or retry.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = { "code", "scopeMatch" }, allowGetters = true)
public class AdmissionConflict {
   public static final String CODE = "TESTS_ALREADY_RUNNING";

   public final String currentRunId;
   public final RunKind kind;
   public final String scope;
   public final long startedAt;
   public final long elapsedMs;
   public final long estimatedRemainingMs;

   @JsonCreator
   public AdmissionConflict(@JsonProperty("currentRunId") String currentRunId,
                            @JsonProperty("kind") RunKind kind,
                            @JsonProperty("scope") String scope,
                            @JsonProperty("startedAt") long startedAt,
                            @JsonProperty("elapsedMs") long elapsedMs,
                            @JsonProperty("estimatedRemainingMs") long estimatedRemainingMs) {
      this.currentRunId = currentRunId;
      this.kind = kind;
      this.scope = scope;
      this.startedAt = startedAt;
      this.elapsedMs = elapsedMs;
      this.estimatedRemainingMs = estimatedRemainingMs;
   }

   @JsonProperty("code")
   public String code() {
      return CODE;
   }

   /**
    * @return true if the conflict was caused by a scoped run with the same scope rather than by
    * an active bulk run.
    */
   public boolean isScopeMatch() {
      return scope != null;
   }

   @Override
   public String toString() {
      return "AdmissionConflict{" + kind.wireName() + (scope == null ? "" : " " + scope) + " run " + currentRunId +
            " already running for " + elapsedMs + " ms}";
   }
}
