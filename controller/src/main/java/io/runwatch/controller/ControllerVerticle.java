package io.runwatch.controller;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.runwatch.controller.supervisor.WorkerDeployer;
import io.runwatch.controller.supervisor.WorkerSupervisor;
import io.runwatch.core.hub.BroadcastHub;
import io.runwatch.core.registry.ActiveRunRegistry;
import io.runwatch.impl.Util;
import io.runwatch.internal.Controller;
import io.runwatch.internal.Properties;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;

public class ControllerVerticle extends AbstractVerticle {
   private static final Logger log = LogManager.getLogger(ControllerVerticle.class);

   private ControllerServer server;
   private ActiveRunRegistry registry;
   private BroadcastHub hub;
   private WorkerSupervisor supervisor;
   private ExecutorService persistenceExecutor;
   private long sweepTimerId = -1;
   private long auditTimerId = -1;

   @Override
   public void start(Promise<Void> future) {
      Path runDir = runDir();
      log.info("Starting with run directory {}...", runDir);
      vertx.exceptionHandler(throwable -> log.error("Uncaught error: ", throwable));

      Clock clock = Clock.systemUTC();
      persistenceExecutor = Executors.newSingleThreadExecutor(Util.daemonThreadFactory("persistence"));
      registry = new ActiveRunRegistry(clock, Duration.ofMillis(configLong(Properties.CLOSED_RUN_RETENTION, 30_000)),
            new FilePersistenceStore(runDir), persistenceExecutor);
      hub = new BroadcastHub(registry, clock, Duration.ofMillis(configLong(Properties.VIEWER_TIMEOUT, 90_000)));
      registry.addListener(hub);

      WorkerDeployer deployer = null;
      String deployerName = getConfig().getString(Properties.DEPLOYER, Controller.DEPLOYER);
      for (WorkerDeployer.Factory deployerFactory : ServiceLoader.load(WorkerDeployer.Factory.class)) {
         log.debug("Found deployer {}", deployerFactory.name());
         if (deployerName.equals(deployerFactory.name())) {
            deployer = deployerFactory.create(getConfig());
            break;
         }
      }
      if (deployer == null) {
         future.fail(new IllegalStateException("Couldn't load deployer '" + deployerName + "'"));
         return;
      }
      supervisor = new WorkerSupervisor(registry, deployer, () -> server.baseURL);

      Duration maxRunAge = Duration.ofMillis(configLong(Properties.RUN_MAX_AGE, 30 * 60_000));
      sweepTimerId = vertx.setPeriodic(configLong(Properties.SWEEP_PERIOD, 5_000), timerId -> {
         hub.expireSilent();
         registry.expireStale(maxRunAge);
         registry.evictExpired();
      });
      auditTimerId = vertx.setPeriodic(configLong(Properties.PROCESS_AUDIT_PERIOD, 10_000),
            timerId -> supervisor.auditProcesses());

      server = new ControllerServer(this, future);
   }

   @Override
   public void stop(Promise<Void> stopFuture) {
      vertx.cancelTimer(sweepTimerId);
      vertx.cancelTimer(auditTimerId);
      if (supervisor != null) {
         supervisor.close();
      }
      if (persistenceExecutor != null) {
         persistenceExecutor.shutdown();
      }
      if (server != null) {
         server.stop(stopFuture);
      } else {
         stopFuture.complete();
      }
   }

   long configLong(String property, long def) {
      return Properties.getLong(property, getConfig().getLong(property, def));
   }

   String configString(String property, String def) {
      return Properties.get(property, getConfig().getString(property, def));
   }

   Path runDir() {
      return Paths.get(getConfig().getString(Properties.RUN_DIR, Controller.RUN_DIR.toString()));
   }

   public int actualPort() {
      return server.httpServer.actualPort();
   }

   public ActiveRunRegistry registry() {
      return registry;
   }

   public BroadcastHub hub() {
      return hub;
   }

   public WorkerSupervisor supervisor() {
      return supervisor;
   }

   public JsonObject getConfig() {
      return context.config();
   }
}
