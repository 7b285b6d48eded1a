package io.runwatch.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of an admitted run. Only one {@link #BULK_RUN} may be active at any time; the other kinds
 * are admitted independently, keyed by their scope.
 */
public enum RunKind {
   /**
    * Whole test suite.
    */
   BULK_RUN("run-all"),
   /**
    * One file or logical group of tests; the scope is the group path.
    */
   GROUP_RUN("run-group"),
   /**
    * Exactly one previously known test; the scope is the original test id.
    */
   SINGLE_RERUN("rerun");

   private final String wireName;

   RunKind(String wireName) {
      this.wireName = wireName;
   }

   @JsonValue
   public String wireName() {
      return wireName;
   }

   public boolean isScoped() {
      return this != BULK_RUN;
   }

   @JsonCreator
   public static RunKind fromWire(String name) {
      if (name == null) {
         return null;
      }
      for (RunKind kind : values()) {
         if (kind.wireName.equals(name) || kind.name().equalsIgnoreCase(name)) {
            return kind;
         }
      }
      throw new IllegalArgumentException("Unknown run kind '" + name + "'");
   }
}
