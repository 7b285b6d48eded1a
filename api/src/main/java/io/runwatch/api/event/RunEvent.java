package io.runwatch.api.event;

/**
 * A change of externally visible run state. Every subclass corresponds to one {@link Type};
 * consumers handle all of them through {@link Visitor}.
 */
public abstract class RunEvent {
   public final long timestamp;

   protected RunEvent(long timestamp) {
      this.timestamp = timestamp;
   }

   public abstract Type type();

   /**
    * @return id of the affected run, or null for events affecting the whole registry.
    */
   public abstract String runId();

   public abstract <R> R accept(Visitor<R> visitor);

   public enum Type {
      RUN_ADMITTED("run:admitted", RunAdmitted.class),
      RUN_UPDATED("run:updated", RunUpdated.class),
      TEST_STARTED("test:started", TestStarted.class),
      TEST_COMPLETED("test:completed", TestCompleted.class),
      RUN_CLOSED("run:closed", RunClosed.class),
      FORCE_RESET("force:reset", ForceReset.class);

      private final String wireName;
      private final Class<? extends RunEvent> eventClass;

      Type(String wireName, Class<? extends RunEvent> eventClass) {
         this.wireName = wireName;
         this.eventClass = eventClass;
      }

      public String wireName() {
         return wireName;
      }

      public Class<? extends RunEvent> eventClass() {
         return eventClass;
      }

      public static Type fromWire(String name) {
         for (Type type : values()) {
            if (type.wireName.equals(name)) {
               return type;
            }
         }
         return null;
      }
   }

   public interface Visitor<R> {
      R visit(RunAdmitted event);

      R visit(RunUpdated event);

      R visit(TestStarted event);

      R visit(TestCompleted event);

      R visit(RunClosed event);

      R visit(ForceReset event);
   }
}
