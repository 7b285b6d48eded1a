package io.runwatch.controller.supervisor;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to a started worker.
 */
public interface WorkerProcess {
   /**
    * @return future completed with the exit code once the worker terminates.
    */
   CompletableFuture<Integer> onExit();

   boolean isAlive();

   /**
    * @return exit code of a terminated worker, or <code>null</code> if it is still running or the
    * code is not available.
    */
   Integer exitCode();

   void destroy();
}
