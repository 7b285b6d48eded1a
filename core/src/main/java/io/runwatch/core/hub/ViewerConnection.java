package io.runwatch.core.hub;

/**
 * A subscribed viewer. Holds no run data, only what the hub needs for keepalive.
 */
public class ViewerConnection {
   private final String connectionId;
   private final ViewerChannel channel;
   private volatile long lastSeenAt;

   ViewerConnection(String connectionId, ViewerChannel channel, long lastSeenAt) {
      this.connectionId = connectionId;
      this.channel = channel;
      this.lastSeenAt = lastSeenAt;
   }

   public String connectionId() {
      return connectionId;
   }

   public ViewerChannel channel() {
      return channel;
   }

   public long lastSeenAt() {
      return lastSeenAt;
   }

   void seen(long timestamp) {
      lastSeenAt = timestamp;
   }

   @Override
   public String toString() {
      return "ViewerConnection{" + connectionId + '}';
   }
}
