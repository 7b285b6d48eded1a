package io.runwatch.core.hub;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.runwatch.api.event.RunEvent;
import io.runwatch.core.registry.ActiveRunRegistry;
import io.runwatch.core.registry.RunEventListener;

/**
 * Fans registry events out to every subscribed viewer.
 * <p>
 * Subscription and snapshot delivery run under the registry lock, the same lock that publishes
 * events, so a viewer never misses an event applied after its snapshot nor receives one already
 * contained in it.
 */
public class BroadcastHub implements RunEventListener {
   private static final Logger log = LogManager.getLogger(BroadcastHub.class);

   private final ActiveRunRegistry registry;
   private final Clock clock;
   private final Duration viewerTimeout;
   private final Map<String, ViewerConnection> connections = new ConcurrentHashMap<>();

   public BroadcastHub(ActiveRunRegistry registry, Clock clock, Duration viewerTimeout) {
      this.registry = registry;
      this.clock = clock;
      this.viewerTimeout = viewerTimeout;
   }

   public ViewerConnection subscribe(ViewerChannel channel) {
      return subscribe(UUID.randomUUID().toString(), channel);
   }

   /**
    * Registers the viewer and delivers the current snapshot to it before any later event.
    */
   public ViewerConnection subscribe(String connectionId, ViewerChannel channel) {
      ViewerConnection connection = new ViewerConnection(connectionId, channel, clock.millis());
      return registry.withSnapshot(snapshot -> {
         connections.put(connection.connectionId(), connection);
         try {
            channel.deliverSnapshot(snapshot);
         } catch (RuntimeException e) {
            log.warn("Failed to send initial snapshot to {}", connection, e);
            connections.remove(connection.connectionId());
            return connection;
         }
         log.debug("Subscribed {}, {} viewer(s) connected", connection, connections.size());
         return connection;
      });
   }

   public boolean unsubscribe(String connectionId) {
      ViewerConnection removed = connections.remove(connectionId);
      if (removed != null) {
         log.debug("Unsubscribed {}, {} viewer(s) connected", removed, connections.size());
      }
      return removed != null;
   }

   /**
    * Records activity of the viewer, e.g. a ping.
    */
   public boolean touch(String connectionId) {
      ViewerConnection connection = connections.get(connectionId);
      if (connection == null) {
         return false;
      }
      connection.seen(clock.millis());
      return true;
   }

   @Override
   public void onEvent(RunEvent event) {
      broadcast(event);
   }

   public void broadcast(RunEvent event) {
      for (ViewerConnection connection : connections.values()) {
         try {
            connection.channel().deliver(event);
         } catch (RuntimeException e) {
            log.warn("Dropping {} after failed delivery of {}", connection, event.type().wireName(), e);
            connections.remove(connection.connectionId());
         }
      }
   }

   public boolean sendSnapshotTo(String connectionId) {
      ViewerConnection connection = connections.get(connectionId);
      if (connection == null) {
         return false;
      }
      return registry.withSnapshot(snapshot -> {
         try {
            connection.channel().deliverSnapshot(snapshot);
            return true;
         } catch (RuntimeException e) {
            log.warn("Dropping {} after failed snapshot delivery", connection, e);
            connections.remove(connectionId);
            return false;
         }
      });
   }

   /**
    * Unsubscribes and closes viewers that have been silent for longer than the viewer timeout.
    *
    * @return ids of the dropped connections.
    */
   public List<String> expireSilent() {
      long threshold = clock.millis() - viewerTimeout.toMillis();
      List<String> expired = new ArrayList<>();
      for (ViewerConnection connection : connections.values()) {
         if (connection.lastSeenAt() < threshold && connections.remove(connection.connectionId(), connection)) {
            expired.add(connection.connectionId());
            log.info("Viewer {} timed out", connection);
            try {
               connection.channel().close("Keepalive timeout");
            } catch (RuntimeException e) {
               log.debug("Failed to close {}", connection, e);
            }
         }
      }
      return expired;
   }

   public int connectionCount() {
      return connections.size();
   }
}
