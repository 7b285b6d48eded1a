package io.runwatch.controller.supervisor;

import java.io.Closeable;

import io.runwatch.api.model.RunRequest;
import io.vertx.core.json.JsonObject;

/**
 * Starts the external test worker for an admitted run. Implementations are looked up through
 * {@link java.util.ServiceLoader} by the {@link Factory#name() name} set in
 * {@link io.runwatch.internal.Properties#DEPLOYER}.
 */
public interface WorkerDeployer extends Closeable {

   /**
    * @param runId       id of the admitted run; the worker reports its progress under this id.
    * @param request     what should be executed.
    * @param callbackUrl base URL of the ingestion endpoints the worker reports to.
    */
   WorkerProcess start(String runId, RunRequest request, String callbackUrl) throws WorkerSpawnException;

   interface Factory {
      String name();

      WorkerDeployer create(JsonObject config);
   }
}
