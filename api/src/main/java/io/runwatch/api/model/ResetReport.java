package io.runwatch.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Registry state around a force reset, kept for post-incident audit.
 */
public class ResetReport {
   public final RunsSnapshot before;
   public final RunsSnapshot after;

   @JsonCreator
   public ResetReport(@JsonProperty("before") RunsSnapshot before, @JsonProperty("after") RunsSnapshot after) {
      this.before = before;
      this.after = after;
   }
}
