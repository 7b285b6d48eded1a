package io.runwatch.core.hub;

import io.runwatch.api.event.RunEvent;
import io.runwatch.api.model.RunsSnapshot;

/**
 * Transport-specific side of a viewer subscription. Implementations must not block; delivery is
 * best effort and a thrown exception unsubscribes the viewer.
 */
public interface ViewerChannel {
   void deliver(RunEvent event);

   void deliverSnapshot(RunsSnapshot snapshot);

   void close(String reason);
}
