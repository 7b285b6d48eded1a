package io.runwatch.api.event;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * All tracked runs were discarded by an administrator. This is not a run transition; viewers
 * should drop their state entirely.
 */
public class ForceReset extends RunEvent {
   public final List<String> discardedRunIds;

   @JsonCreator
   public ForceReset(@JsonProperty("timestamp") long timestamp,
                     @JsonProperty("discardedRunIds") List<String> discardedRunIds) {
      super(timestamp);
      this.discardedRunIds = discardedRunIds == null ? Collections.emptyList() : Collections.unmodifiableList(discardedRunIds);
   }

   @Override
   public Type type() {
      return Type.FORCE_RESET;
   }

   @Override
   public String runId() {
      return null;
   }

   @Override
   public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
   }

   @Override
   public String toString() {
      return "ForceReset{" + discardedRunIds + '}';
   }
}
