package io.runwatch.api.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.runwatch.api.model.ActiveRun;

public class RunAdmitted extends RunEvent {
   public final ActiveRun run;

   @JsonCreator
   public RunAdmitted(@JsonProperty("timestamp") long timestamp, @JsonProperty("run") ActiveRun run) {
      super(timestamp);
      this.run = run;
   }

   @Override
   public Type type() {
      return Type.RUN_ADMITTED;
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
      return "RunAdmitted{" + run + '}';
   }
}
