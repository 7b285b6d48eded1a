package io.runwatch.controller;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import io.runwatch.api.model.ActiveRun;
import io.runwatch.api.model.TestResultRecord;
import io.runwatch.api.store.PersistenceStore;

/**
 * Stores finished runs as JSON: <code>&lt;run dir&gt;/&lt;runId&gt;/run.json</code> and one file per test
 * in <code>tests/</code> next to it.
 */
public class FilePersistenceStore implements PersistenceStore {
   private static final Logger log = LogManager.getLogger(FilePersistenceStore.class);
   static final String RUN_FILE = "run.json";
   static final String TESTS_DIR = "tests";

   private final Path runDir;
   private final ObjectWriter writer = new ObjectMapper().writerWithDefaultPrettyPrinter();

   public FilePersistenceStore(Path runDir) {
      this.runDir = runDir;
   }

   @Override
   public void saveCompletedRun(ActiveRun run) throws IOException {
      Path dir = resolve(runDir, run.runId);
      Files.createDirectories(dir);
      Path file = dir.resolve(RUN_FILE);
      writer.writeValue(file.toFile(), run);
      log.debug("Stored run {} in {}", run.runId, file);
   }

   @Override
   public void saveTestResult(TestResultRecord result) throws IOException {
      Path dir = resolve(runDir, result.runId).resolve(TESTS_DIR);
      Files.createDirectories(dir);
      writer.writeValue(resolve(dir, result.testId + ".json").toFile(), result);
   }

   /**
    * Ids come from workers; anything that is not a single file name inside <code>parent</code> is refused.
    */
   static Path resolve(Path parent, String name) throws IOException {
      Path base = parent.toAbsolutePath().normalize();
      Path resolved = base.resolve(name).normalize();
      if (!base.equals(resolved.getParent())) {
         throw new IOException("Refusing to store '" + name + "' outside of " + base);
      }
      return resolved;
   }
}
