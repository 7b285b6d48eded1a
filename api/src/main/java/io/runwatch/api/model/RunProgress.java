package io.runwatch.api.model;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable copy of the counters of a run. {@code completedTests} always equals the sum of passed,
 * failed and skipped tests; a total of 0 means the total is not known yet.
 */
public class RunProgress {
   public final int totalTests;
   public final int completedTests;
   public final int passedTests;
   public final int failedTests;
   public final int skippedTests;
   @JsonInclude(JsonInclude.Include.NON_NULL)
   public final Long estimatedEndTime;
   public final List<RunningTest> runningTests;

   @JsonCreator
   public RunProgress(@JsonProperty("totalTests") int totalTests,
                      @JsonProperty("completedTests") int completedTests,
                      @JsonProperty("passedTests") int passedTests,
                      @JsonProperty("failedTests") int failedTests,
                      @JsonProperty("skippedTests") int skippedTests,
                      @JsonProperty("estimatedEndTime") Long estimatedEndTime,
                      @JsonProperty("runningTests") List<RunningTest> runningTests) {
      this.totalTests = totalTests;
      this.completedTests = completedTests;
      this.passedTests = passedTests;
      this.failedTests = failedTests;
      this.skippedTests = skippedTests;
      this.estimatedEndTime = estimatedEndTime;
      this.runningTests = runningTests == null ? Collections.emptyList() : Collections.unmodifiableList(runningTests);
   }

   public boolean isRunning(String testId) {
      return runningTests.stream().anyMatch(t -> t.testId.equals(testId));
   }

   @Override
   public String toString() {
      return completedTests + "/" + totalTests + " (passed " + passedTests + ", failed " + failedTests +
            ", skipped " + skippedTests + ", running " + runningTests + ")";
   }
}
