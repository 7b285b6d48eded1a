package io.runwatch.api.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.runwatch.api.TestStatus;
import io.runwatch.api.model.RunProgress;

public class TestCompleted extends RunEvent {
   public final String runId;
   public final String testId;
   public final TestStatus status;
   public final RunProgress progress;

   @JsonCreator
   public TestCompleted(@JsonProperty("timestamp") long timestamp,
                        @JsonProperty("runId") String runId,
                        @JsonProperty("testId") String testId,
                        @JsonProperty("status") TestStatus status,
                        @JsonProperty("progress") RunProgress progress) {
      super(timestamp);
      this.runId = runId;
      this.testId = testId;
      this.status = status;
      this.progress = progress;
   }

   @Override
   public Type type() {
      return Type.TEST_COMPLETED;
   }

   @Override
   public String runId() {
      return runId;
   }

   @Override
   public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
   }

   @Override
   public String toString() {
      return "TestCompleted{" + runId + ": " + testId + " " + status.wireName() + '}';
   }
}
