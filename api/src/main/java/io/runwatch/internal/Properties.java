package io.runwatch.internal;

import java.util.function.Function;

public interface Properties {
   String ADMIN_TOKEN = "io.runwatch.admin.token";
   String CLIENT_REQUEST_TIMEOUT = "io.runwatch.client.request.timeout";
   String CLOSED_RUN_RETENTION = "io.runwatch.closed.retention";
   String CONTROLLER_EXTERNAL_URI = "io.runwatch.controller.external.uri";
   String CONTROLLER_HOST = "io.runwatch.controller.host";
   String CONTROLLER_LOG = "io.runwatch.controller.log.file";
   String CONTROLLER_PORT = "io.runwatch.controller.port";
   String DEPLOYER = "io.runwatch.deployer";
   String PROCESS_AUDIT_PERIOD = "io.runwatch.process.audit.period";
   String ROOT_DIR = "io.runwatch.rootdir";
   String RUN_DIR = "io.runwatch.rundir";
   String RUN_MAX_AGE = "io.runwatch.run.max.age";
   String SWEEP_PERIOD = "io.runwatch.sweep.period";
   String VIEWER_TIMEOUT = "io.runwatch.viewer.timeout";
   String WORKER_COMMAND = "io.runwatch.worker.command";
   String WORKER_DIR = "io.runwatch.worker.dir";
   String WORKER_REPORTER = "io.runwatch.worker.reporter";

   static String get(String property, String def) {
      return get(property, Function.identity(), def);
   }

   static long getLong(String property, long def) {
      return get(property, Long::valueOf, def);
   }

   static int getInt(String property, int def) {
      return get(property, Integer::valueOf, def);
   }

   static boolean getBoolean(String property) {
      return get(property, Boolean::valueOf, false);
   }

   static <T> T get(String property, Function<String, T> f, T def) {
      String value = System.getProperty(property);
      if (value != null) {
         return f.apply(value);
      }
      value = System.getenv(property.replaceAll("[^a-zA-Z0-9]", "_").toUpperCase());
      if (value != null) {
         return f.apply(value);
      }
      return def;
   }
}
