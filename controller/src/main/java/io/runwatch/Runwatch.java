package io.runwatch;

import java.io.File;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import io.runwatch.api.Version;
import io.runwatch.controller.ControllerVerticle;
import io.runwatch.internal.Controller;
import io.runwatch.internal.Properties;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;

public class Runwatch {
   static final Logger log = LogManager.getLogger(Runwatch.class);

   public static void main(String[] args) {
      logVersion();
      Thread.setDefaultUncaughtExceptionHandler(Runwatch::defaultUncaughtExceptionHandler);
      log.info("Starting Vert.x...");
      Vertx vertx = Vertx.vertx();
      log.info("Deploying {}...", ControllerVerticle.class.getSimpleName());
      vertx.deployVerticle(ControllerVerticle.class, new DeploymentOptions(), event -> {
         if (event.succeeded()) {
            log.info("{} deployed.", ControllerVerticle.class.getSimpleName());
         } else {
            log.error("Failed to deploy " + ControllerVerticle.class.getSimpleName(), event.cause());
            System.exit(1);
         }
      });
      Runtime.getRuntime().addShutdownHook(new Thread(() -> vertx.close().toCompletionStage().toCompletableFuture().join(),
            "shutdown"));
   }

   private static void defaultUncaughtExceptionHandler(Thread thread, Throwable throwable) {
      log.error(new FormattedMessage("Uncaught exception in thread {}({})", thread.getName(), thread.getId()), throwable);
   }

   private static void logVersion() {
      log.info("Java: {} {} {} ({}), CWD {}",
            System.getProperty("java.vm.vendor", "<unknown VM vendor>"),
            System.getProperty("java.vm.name", "<unknown VM name>"),
            System.getProperty("java.version", "<unknown version>"),
            System.getProperty("java.home", "<unknown Java home>"),
            System.getProperty("user.dir", "<unknown current dir>"));
      String path = new File(Runwatch.class.getProtectionDomain().getCodeSource().getLocation().getPath()).getParentFile()
            .getParent();
      log.info("Runwatch: {}", Version.VERSION);
      log.info("          DISTRIBUTION: {}", path);
      log.info("          ROOT_DIR:     {}", Controller.ROOT_DIR);
      log.info("          RUN_DIR:      {}", Controller.RUN_DIR);
      log.info("          LOG_FILE:     {}", Properties.get(Properties.CONTROLLER_LOG, "<default>"));
      System.getProperties().forEach((n, value) -> {
         String name = String.valueOf(n);
         if (name.startsWith("io.runwatch.")) {
            log.debug("System property {} = {}", name, value);
         }
      });
   }
}
