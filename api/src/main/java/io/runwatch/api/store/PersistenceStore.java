package io.runwatch.api.store;

import java.io.IOException;

import io.runwatch.api.model.ActiveRun;
import io.runwatch.api.model.TestResultRecord;

/**
 * Durable storage of finished runs. Called only when a run closes, never for in-flight tracking
 * decisions; implementations may block.
 */
public interface PersistenceStore {
   PersistenceStore NONE = new PersistenceStore() {
      @Override
      public void saveCompletedRun(ActiveRun run) {
      }

      @Override
      public void saveTestResult(TestResultRecord result) {
      }
   };

   void saveCompletedRun(ActiveRun run) throws IOException;

   void saveTestResult(TestResultRecord result) throws IOException;
}
