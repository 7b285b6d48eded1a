package io.runwatch.api.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.runwatch.api.model.RunProgress;
import io.runwatch.api.model.RunningTest;

public class TestStarted extends RunEvent {
   public final String runId;
   public final RunningTest test;
   public final RunProgress progress;

   @JsonCreator
   public TestStarted(@JsonProperty("timestamp") long timestamp,
                      @JsonProperty("runId") String runId,
                      @JsonProperty("test") RunningTest test,
                      @JsonProperty("progress") RunProgress progress) {
      super(timestamp);
      this.runId = runId;
      this.test = test;
      this.progress = progress;
   }

   @Override
   public Type type() {
      return Type.TEST_STARTED;
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
      return "TestStarted{" + runId + ": " + test + '}';
   }
}
