package io.runwatch.controller.supervisor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kohsuke.MetaInfServices;

import io.runwatch.api.RunKind;
import io.runwatch.api.model.RunRequest;
import io.runwatch.impl.Util;
import io.runwatch.internal.Controller;
import io.runwatch.internal.Properties;
import io.vertx.core.json.JsonObject;

/**
 * Runs the worker as a child process of the controller. Output of the worker goes to
 * <code>worker.log</code> in the run directory.
 */
public class LocalProcessDeployer implements WorkerDeployer {
   private static final Logger log = LogManager.getLogger(LocalProcessDeployer.class);
   static final String DEFAULT_COMMAND = "npx playwright test";
   static final String TEST_DIR = "e2e/tests/";
   static final String LOG_FILE = "worker.log";

   public static final String ENV_API_URL = "RUNWATCH_API_URL";
   public static final String ENV_RUN_ID = "RUNWATCH_RUN_ID";
   public static final String ENV_RUN_KIND = "RUNWATCH_RUN_KIND";
   public static final String ENV_RERUN_MODE = "RERUN_MODE";
   public static final String ENV_RERUN_ID = "RERUN_ID";

   private final List<String> command;
   private final Path workDir;
   private final String reporter;
   private final Path runDir;

   public LocalProcessDeployer(List<String> command, Path workDir, String reporter, Path runDir) {
      if (command.isEmpty()) {
         throw new IllegalArgumentException("Worker command must not be empty");
      }
      this.command = command;
      this.workDir = workDir;
      this.reporter = reporter;
      this.runDir = runDir;
   }

   @Override
   public WorkerProcess start(String runId, RunRequest request, String callbackUrl) throws WorkerSpawnException {
      List<String> args = buildCommand(command, request, reporter);
      Path logFile = runDir.resolve(runId).resolve(LOG_FILE);
      ProcessBuilder pb = new ProcessBuilder(args)
            .redirectErrorStream(true)
            .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
      if (workDir != null) {
         pb.directory(workDir.toFile());
      }
      Map<String, String> env = pb.environment();
      if (callbackUrl != null) {
         env.put(ENV_API_URL, callbackUrl);
      }
      env.put(ENV_RUN_ID, runId);
      env.put(ENV_RUN_KIND, request.kind().wireName());
      if (request.kind() == RunKind.SINGLE_RERUN) {
         env.put(ENV_RERUN_MODE, "true");
         env.put(ENV_RERUN_ID, runId);
      }
      try {
         Files.createDirectories(logFile.getParent());
         log.info("Starting worker for run {}: {}", runId, args);
         Process process = pb.start();
         log.debug("Worker for run {} has PID {}", runId, process.pid());
         return new LocalWorkerProcess(process);
      } catch (IOException e) {
         throw new WorkerSpawnException(runId, "Cannot start worker " + args + ": " + Util.explainCauses(e), e);
      }
   }

   static List<String> buildCommand(List<String> command, RunRequest request, String reporter) {
      List<String> args = new ArrayList<>(command);
      switch (request.kind()) {
         case GROUP_RUN:
            String path = request.filePath();
            args.add(path.startsWith(TEST_DIR) ? path : TEST_DIR + path);
            break;
         case SINGLE_RERUN:
            args.add(request.filePath());
            args.add("--grep");
            args.add(request.testName());
            break;
         default:
            break;
      }
      if (request.maxWorkers() != null) {
         args.add("--workers=" + request.maxWorkers());
      }
      if (!Util.isBlank(reporter)) {
         args.add("--reporter=" + reporter);
      }
      return args;
   }

   @Override
   public void close() {
   }

   private static class LocalWorkerProcess implements WorkerProcess {
      private final Process process;
      private final CompletableFuture<Integer> exit;

      LocalWorkerProcess(Process process) {
         this.process = process;
         this.exit = process.onExit().thenApply(Process::exitValue);
      }

      @Override
      public CompletableFuture<Integer> onExit() {
         return exit;
      }

      @Override
      public boolean isAlive() {
         return process.isAlive();
      }

      @Override
      public Integer exitCode() {
         return process.isAlive() ? null : process.exitValue();
      }

      @Override
      public void destroy() {
         process.destroy();
      }

      @Override
      public String toString() {
         return "pid " + process.pid();
      }
   }

   @MetaInfServices(WorkerDeployer.Factory.class)
   public static class Factory implements WorkerDeployer.Factory {
      @Override
      public String name() {
         return "local";
      }

      @Override
      public WorkerDeployer create(JsonObject config) {
         String command = Properties.get(Properties.WORKER_COMMAND, config.getString(Properties.WORKER_COMMAND, DEFAULT_COMMAND));
         String workDir = Properties.get(Properties.WORKER_DIR, config.getString(Properties.WORKER_DIR));
         String reporter = Properties.get(Properties.WORKER_REPORTER, config.getString(Properties.WORKER_REPORTER));
         return new LocalProcessDeployer(Arrays.asList(command.trim().split("\\s+")),
               workDir == null ? null : Paths.get(workDir), reporter,
               Paths.get(config.getString(Properties.RUN_DIR, Controller.RUN_DIR.toString())));
      }
   }
}
