package io.runwatch.controller.supervisor;

/**
 * The worker process for an admitted run could not be started.
 */
public class WorkerSpawnException extends Exception {
   private final String runId;

   public WorkerSpawnException(String runId, String message, Throwable cause) {
      super(message, cause);
      this.runId = runId;
   }

   public String runId() {
      return runId;
   }
}
