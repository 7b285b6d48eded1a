package io.runwatch;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

import org.kohsuke.MetaInfServices;

import io.runwatch.controller.ControllerVerticle;
import io.runwatch.internal.Controller;
import io.runwatch.internal.Properties;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

/**
 * Controller running in the current JVM, listening on an ephemeral port of the loopback interface.
 */
public class LocalController implements Controller {
   private final Vertx vertx;
   private final String host;
   private final int port;

   public LocalController(Vertx vertx, String host, int port) {
      this.vertx = vertx;
      this.host = host;
      this.port = port;
   }

   @Override
   public String host() {
      return host;
   }

   @Override
   public int port() {
      return port;
   }

   @Override
   public void stop() {
      vertx.close().toCompletionStage().toCompletableFuture().join();
   }

   public static LocalController start(JsonObject config) {
      config.put(Properties.CONTROLLER_HOST, "127.0.0.1");
      config.put(Properties.CONTROLLER_PORT, 0);
      Vertx vertx = Vertx.vertx();
      CompletableFuture<Integer> completion = new CompletableFuture<>();
      ControllerVerticle controller = new ControllerVerticle();
      vertx.deployVerticle(controller, new DeploymentOptions().setConfig(config), event -> {
         if (event.succeeded()) {
            completion.complete(controller.actualPort());
         } else {
            completion.completeExceptionally(event.cause());
         }
      });
      try {
         return new LocalController(vertx, "127.0.0.1", completion.join());
      } catch (RuntimeException e) {
         vertx.close();
         throw e;
      }
   }

   @MetaInfServices(Controller.Factory.class)
   public static class Factory implements Controller.Factory {
      @Override
      public Controller start(Path rootDir) {
         if (rootDir == null) {
            rootDir = Controller.DEFAULT_ROOT_DIR;
         }
         JsonObject config = new JsonObject();
         config.put(Properties.RUN_DIR, rootDir.resolve("run").toFile().getAbsolutePath());
         return LocalController.start(config);
      }
   }
}
