package io.runwatch.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.runwatch.api.TestStatus;

/**
 * Result of one test execution within a run, handed to the persistence store when the run closes.
 */
public class TestResultRecord {
   public final String testId;
   public final String runId;
   public final String name;
   public final String filePath;
   public final TestStatus status;
   public final long startedAt;
   public final long finishedAt;

   @JsonCreator
   public TestResultRecord(@JsonProperty("testId") String testId,
                           @JsonProperty("runId") String runId,
                           @JsonProperty("name") String name,
                           @JsonProperty("filePath") String filePath,
                           @JsonProperty("status") TestStatus status,
                           @JsonProperty("startedAt") long startedAt,
                           @JsonProperty("finishedAt") long finishedAt) {
      this.testId = testId;
      this.runId = runId;
      this.name = name;
      this.filePath = filePath;
      this.status = status;
      this.startedAt = startedAt;
      this.finishedAt = finishedAt;
   }
}
