package io.runwatch.controller.supervisor;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.runwatch.api.RunStatus;
import io.runwatch.api.model.Admission;
import io.runwatch.api.model.RunRequest;
import io.runwatch.core.registry.ActiveRunRegistry;

/**
 * Launches one worker per admitted run and closes the run when the worker exits.
 * <p>
 * Admission happens before the worker is started: a rejected request never spawns anything.
 * Closing is idempotent in the registry, so the exit observer, the process audit and a
 * <code>run-end</code> notification from the worker itself may race freely.
 */
public class WorkerSupervisor {
   private static final Logger log = LogManager.getLogger(WorkerSupervisor.class);

   private final ActiveRunRegistry registry;
   private final WorkerDeployer deployer;
   private final Supplier<String> callbackUrl;
   private final Map<String, WorkerProcess> processes = new ConcurrentHashMap<>();

   public WorkerSupervisor(ActiveRunRegistry registry, WorkerDeployer deployer, Supplier<String> callbackUrl) {
      this.registry = registry;
      this.deployer = deployer;
      this.callbackUrl = callbackUrl;
   }

   /**
    * May block while the process is being started; do not call from an event loop.
    *
    * @return the admitted run id, or the conflict that prevented admission.
    * @throws WorkerSpawnException if the worker could not be started; the run is already closed as failed.
    */
   public Admission launch(RunRequest request) throws WorkerSpawnException {
      Admission admission = registry.admit(request.kind(), request.scope());
      if (!admission.isAdmitted()) {
         return admission;
      }
      String runId = admission.runId();
      WorkerProcess process;
      try {
         process = deployer.start(runId, request, callbackUrl.get());
      } catch (WorkerSpawnException e) {
         log.error("Failed to start worker for run {}", runId, e);
         registry.close(runId, RunStatus.FAILED);
         throw e;
      } catch (RuntimeException e) {
         log.error("Failed to start worker for run {}", runId, e);
         registry.close(runId, RunStatus.FAILED);
         throw new WorkerSpawnException(runId, "Cannot start worker: " + e.getMessage(), e);
      }
      processes.put(runId, process);
      process.onExit().whenComplete((exitCode, throwable) -> {
         if (!processes.remove(runId, process)) {
            return;
         }
         RunStatus status;
         if (throwable != null) {
            log.error("Lost track of worker for run {}", runId, throwable);
            status = RunStatus.FAILED;
         } else {
            log.info("Worker for run {} exited with code {}", runId, exitCode);
            status = RunStatus.fromExitCode(exitCode);
         }
         registry.close(runId, status);
      });
      return admission;
   }

   /**
    * Closes runs whose worker is gone but whose exit has not been observed.
    *
    * @return number of runs closed by the audit.
    */
   public int auditProcesses() {
      int closed = 0;
      for (Map.Entry<String, WorkerProcess> entry : processes.entrySet()) {
         WorkerProcess process = entry.getValue();
         if (process.isAlive() || !processes.remove(entry.getKey(), process)) {
            continue;
         }
         Integer exitCode = process.exitCode();
         RunStatus status = exitCode == null ? RunStatus.FAILED : RunStatus.fromExitCode(exitCode);
         log.warn("Worker for run {} is not running anymore (exit code {}), closing the run as {}",
               entry.getKey(), exitCode, status);
         registry.close(entry.getKey(), status);
         closed++;
      }
      return closed;
   }

   /**
    * Destroys all supervised workers. The runs are closed when their exit is observed.
    *
    * @return number of workers signalled.
    */
   public int terminateAll() {
      int count = 0;
      for (Map.Entry<String, WorkerProcess> entry : processes.entrySet()) {
         log.info("Terminating worker {} for run {}", entry.getValue(), entry.getKey());
         entry.getValue().destroy();
         count++;
      }
      return count;
   }

   public boolean isSupervised(String runId) {
      return processes.containsKey(runId);
   }

   public void close() {
      terminateAll();
      try {
         deployer.close();
      } catch (IOException e) {
         log.error("Failed to close deployer", e);
      }
   }
}
