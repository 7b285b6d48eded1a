package io.runwatch.controller;

import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.runwatch.api.Version;
import io.runwatch.core.hub.BroadcastHub;
import io.vertx.core.Handler;
import io.vertx.core.http.ServerWebSocket;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * Attaches viewer websockets to the {@link BroadcastHub}. The viewer first receives a welcome
 * message with its connection id, then the snapshot, then every event.
 */
class ViewerSocketHandler implements Handler<ServerWebSocket> {
   private static final Logger log = LogManager.getLogger(ViewerSocketHandler.class);

   private final BroadcastHub hub;

   ViewerSocketHandler(BroadcastHub hub) {
      this.hub = hub;
   }

   @Override
   public void handle(ServerWebSocket webSocket) {
      String connectionId = UUID.randomUUID().toString();
      WebSocketChannel channel = new WebSocketChannel(webSocket);
      webSocket.closeHandler(nil -> hub.unsubscribe(connectionId));
      webSocket.exceptionHandler(throwable -> {
         log.debug("Viewer {} failed", connectionId, throwable);
         hub.unsubscribe(connectionId);
      });
      webSocket.textMessageHandler(message -> handleMessage(connectionId, channel, message));

      channel.send(WebSocketChannel.envelope(WebSocketChannel.CONNECTION, System.currentTimeMillis(),
            new JsonObject().put("connectionId", connectionId).put("version", Version.VERSION)));
      hub.subscribe(connectionId, channel);
      log.debug("Viewer {} connected from {}", connectionId, webSocket.remoteAddress());
   }

   private void handleMessage(String connectionId, WebSocketChannel channel, String message) {
      String type;
      try {
         type = new JsonObject(message).getString("type");
      } catch (DecodeException | ClassCastException e) {
         sendError(channel, "Cannot parse message: " + e.getMessage());
         return;
      }
      hub.touch(connectionId);
      if ("ping".equals(type)) {
         channel.send(WebSocketChannel.envelope(WebSocketChannel.PONG, System.currentTimeMillis(), null));
      } else if ("snapshot".equals(type)) {
         hub.sendSnapshotTo(connectionId);
      } else {
         sendError(channel, "Unknown message type '" + type + "'");
      }
   }

   private void sendError(WebSocketChannel channel, String error) {
      channel.send(WebSocketChannel.envelope(WebSocketChannel.ERROR, System.currentTimeMillis(),
            new JsonObject().put("message", error)));
   }
}
