package io.runwatch.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Final status of a closed run.
 */
public enum RunStatus {
   COMPLETED("completed"),
   FAILED("failed");

   private final String wireName;

   RunStatus(String wireName) {
      this.wireName = wireName;
   }

   @JsonValue
   public String wireName() {
      return wireName;
   }

   public static RunStatus fromExitCode(int exitCode) {
      return exitCode == 0 ? COMPLETED : FAILED;
   }

   @JsonCreator
   public static RunStatus fromWire(String name) {
      if (name == null) {
         return null;
      }
      for (RunStatus status : values()) {
         if (status.wireName.equals(name) || status.name().equalsIgnoreCase(name)) {
            return status;
         }
      }
      // workers report 'passed'/'interrupted' and similar end states, too
      switch (name) {
         case "passed":
         case "success":
            return COMPLETED;
         case "interrupted":
         case "timedout":
         case "timedOut":
            return FAILED;
         default:
            throw new IllegalArgumentException("Unknown run status '" + name + "'");
      }
   }
}
