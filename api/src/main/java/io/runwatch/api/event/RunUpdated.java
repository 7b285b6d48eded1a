package io.runwatch.api.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.runwatch.api.model.ActiveRun;

/**
 * Run attributes changed without a test starting or completing, e.g. the total number of tests
 * became known after discovery.
 */
public class RunUpdated extends RunEvent {
   public final ActiveRun run;

   @JsonCreator
   public RunUpdated(@JsonProperty("timestamp") long timestamp, @JsonProperty("run") ActiveRun run) {
      super(timestamp);
      this.run = run;
   }

   @Override
   public Type type() {
      return Type.RUN_UPDATED;
   }

   @Override
   public String runId() {
      return run.runId;
   }

   @Override
   public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
   }

   @Override
   public String toString() {
      return "RunUpdated{" + run + '}';
   }
}
