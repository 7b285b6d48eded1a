package io.runwatch.controller;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.runwatch.api.event.RunEvent;
import io.runwatch.api.model.RunsSnapshot;
import io.runwatch.core.hub.ViewerChannel;
import io.vertx.core.http.ServerWebSocket;
import io.vertx.core.json.JsonObject;

/**
 * Writes hub messages to a viewer websocket as <code>{"type": ..., "timestamp": ..., "data": ...}</code>.
 */
class WebSocketChannel implements ViewerChannel {
   private static final Logger log = LogManager.getLogger(WebSocketChannel.class);

   static final String CONNECTION = "connection";
   static final String CONNECTION_STATUS = "connection:status";
   static final String PONG = "pong";
   static final String ERROR = "error";

   private final ServerWebSocket webSocket;

   WebSocketChannel(ServerWebSocket webSocket) {
      this.webSocket = webSocket;
   }

   static String envelope(String type, long timestamp, Object data) {
      JsonObject message = new JsonObject().put("type", type).put("timestamp", timestamp);
      if (data instanceof JsonObject) {
         message.put("data", data);
      } else if (data != null) {
         message.put("data", JsonObject.mapFrom(data));
      }
      return message.encode();
   }

   @Override
   public void deliver(RunEvent event) {
      send(envelope(event.type().wireName(), event.timestamp, event));
   }

   @Override
   public void deliverSnapshot(RunsSnapshot snapshot) {
      send(envelope(CONNECTION_STATUS, snapshot.timestamp, snapshot));
   }

   void send(String text) {
      if (webSocket.isClosed()) {
         throw new IllegalStateException("Websocket is closed");
      }
      webSocket.writeTextMessage(text);
   }

   @Override
   public void close(String reason) {
      if (!webSocket.isClosed()) {
         log.debug("Closing websocket from {}: {}", webSocket.remoteAddress(), reason);
         webSocket.close((short) 1000, reason);
      }
   }
}
