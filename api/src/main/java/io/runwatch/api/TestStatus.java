package io.runwatch.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TestStatus {
   PASSED("passed"),
   FAILED("failed"),
   SKIPPED("skipped"),
   TIMED_OUT("timedOut"),
   INTERRUPTED("interrupted");

   private final String wireName;

   TestStatus(String wireName) {
      this.wireName = wireName;
   }

   @JsonValue
   public String wireName() {
      return wireName;
   }

   /**
    * Timeouts and interruptions are counted among the failed tests.
    */
   public boolean countsAsFailure() {
      return this == FAILED || this == TIMED_OUT || this == INTERRUPTED;
   }

   @JsonCreator
   public static TestStatus fromWire(String name) {
      if (name == null) {
         return null;
      }
      for (TestStatus status : values()) {
         if (status.wireName.equals(name) || status.name().equalsIgnoreCase(name)) {
            return status;
         }
      }
      throw new IllegalArgumentException("Unknown test status '" + name + "'");
   }
}
