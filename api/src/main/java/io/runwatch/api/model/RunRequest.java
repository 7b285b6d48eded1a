package io.runwatch.api.model;

import io.runwatch.api.RunKind;

/**
 * Request to launch a worker process. {@link #scope()} is derived from the kind: the group path
 * for group runs and the original test id for reruns.
 */
public final class RunRequest {
   private final RunKind kind;
   private final String scope;
   private final String filePath;
   private final String testName;
   private final Integer maxWorkers;

   private RunRequest(RunKind kind, String scope, String filePath, String testName, Integer maxWorkers) {
      this.kind = kind;
      this.scope = scope;
      this.filePath = filePath;
      this.testName = testName;
      this.maxWorkers = maxWorkers;
   }

   public static RunRequest bulk(Integer maxWorkers) {
      return new RunRequest(RunKind.BULK_RUN, null, null, null, maxWorkers);
   }

   public static RunRequest group(String filePath, Integer maxWorkers) {
      if (filePath == null || filePath.isBlank()) {
         throw new IllegalArgumentException("Group run requires a file path");
      }
      return new RunRequest(RunKind.GROUP_RUN, filePath, filePath, null, maxWorkers);
   }

   public static RunRequest rerun(String testId, String filePath, String testName, Integer maxWorkers) {
      if (testId == null || testId.isBlank()) {
         throw new IllegalArgumentException("Rerun requires the original test id");
      }
      if (filePath == null || filePath.isBlank() || testName == null || testName.isBlank()) {
         throw new IllegalArgumentException("Rerun of " + testId + " requires file path and test name");
      }
      return new RunRequest(RunKind.SINGLE_RERUN, testId, filePath, testName, maxWorkers);
   }

   public RunKind kind() {
      return kind;
   }

   public String scope() {
      return scope;
   }

   public String filePath() {
      return filePath;
   }

   public String testName() {
      return testName;
   }

   public Integer maxWorkers() {
      return maxWorkers;
   }

   @Override
   public String toString() {
      return "RunRequest{" + kind.wireName() + (scope == null ? "" : " " + scope) + '}';
   }
}
