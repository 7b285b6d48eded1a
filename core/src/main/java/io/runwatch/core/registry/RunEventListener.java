package io.runwatch.core.registry;

import io.runwatch.api.event.RunEvent;

/**
 * Receives registry events in the order the mutations were applied. Invoked while the registry
 * lock is held: implementations must not block and must not call back into mutating operations.
 */
@FunctionalInterface
public interface RunEventListener {
   void onEvent(RunEvent event);
}
