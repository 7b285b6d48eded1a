package io.runwatch.internal;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Decouples the controller implementation (in the controller module) from its users, e.g. tests
 * and embedding applications. The controller listens on {@link #host()}:{@link #port()}.
 */
public interface Controller {
   Path DEFAULT_ROOT_DIR = Paths.get(System.getProperty("java.io.tmpdir"), "runwatch");
   String DEPLOYER = Properties.get(Properties.DEPLOYER, "local");
   Path ROOT_DIR = Properties.get(Properties.ROOT_DIR, Paths::get, DEFAULT_ROOT_DIR);
   Path RUN_DIR = Properties.get(Properties.RUN_DIR, Paths::get, ROOT_DIR.resolve("run"));

   String host();

   int port();

   void stop();

   interface Factory {
      Controller start(Path rootDir);
   }
}
