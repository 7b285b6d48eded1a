package io.runwatch.client;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.runwatch.api.event.RunEvent;
import io.runwatch.api.model.RunsSnapshot;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketConnectOptions;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * Keeps a {@link ViewerState} in sync with the controller over the viewer websocket.
 * <p>
 * Every (re)connection asks for a snapshot, and so does every error or event that does not fit
 * the local state. Lost connections are re-established with exponential back-off.
 */
public class ViewerSession {
   private static final Logger log = LogManager.getLogger(ViewerSession.class);
   static final String PATH = "/ws";

   private final Vertx vertx;
   private final HttpClient httpClient;
   private final WebSocketConnectOptions connectOptions;
   private final ViewerState state;
   private final long pingInterval;
   private final long minReconnectDelay;
   private final long maxReconnectDelay;
   private final List<Consumer<ViewerState>> listeners = new CopyOnWriteArrayList<>();

   private WebSocket webSocket;
   private String connectionId;
   private long reconnectDelay;
   private long pingTimerId = -1;
   private boolean stopped;

   public ViewerSession(Vertx vertx, String host, int port, ViewerState state) {
      this(vertx, host, port, state, 30_000, 500, 30_000);
   }

   public ViewerSession(Vertx vertx, String host, int port, ViewerState state, long pingInterval,
                        long minReconnectDelay, long maxReconnectDelay) {
      this.vertx = vertx;
      this.httpClient = vertx.createHttpClient();
      this.connectOptions = new WebSocketConnectOptions().setHost(host).setPort(port).setURI(PATH);
      this.state = state;
      this.pingInterval = pingInterval;
      this.minReconnectDelay = minReconnectDelay;
      this.maxReconnectDelay = maxReconnectDelay;
      this.reconnectDelay = minReconnectDelay;
   }

   /**
    * The listener is invoked on the event loop after each change of the state.
    */
   public void addListener(Consumer<ViewerState> listener) {
      listeners.add(listener);
   }

   public ViewerState state() {
      return state;
   }

   public synchronized String connectionId() {
      return connectionId;
   }

   public synchronized boolean isConnected() {
      return webSocket != null && !webSocket.isClosed();
   }

   public void start() {
      vertx.runOnContext(nil -> connect());
   }

   public synchronized void stop() {
      stopped = true;
      if (pingTimerId >= 0) {
         vertx.cancelTimer(pingTimerId);
         pingTimerId = -1;
      }
      if (webSocket != null) {
         webSocket.close();
         webSocket = null;
      }
      httpClient.close();
   }

   private void connect() {
      synchronized (this) {
         if (stopped) {
            return;
         }
      }
      httpClient.webSocket(connectOptions).onComplete(result -> {
         if (result.failed()) {
            log.debug("Cannot connect to {}:{}: {}", connectOptions.getHost(), connectOptions.getPort(), result.cause().getMessage());
            scheduleReconnect();
            return;
         }
         onConnected(result.result());
      });
   }

   private synchronized void onConnected(WebSocket ws) {
      if (stopped) {
         ws.close();
         return;
      }
      webSocket = ws;
      reconnectDelay = minReconnectDelay;
      ws.textMessageHandler(this::handleMessage);
      ws.exceptionHandler(throwable -> {
         log.debug("Viewer connection failed", throwable);
         requestSnapshot();
      });
      ws.closeHandler(nil -> onClosed(ws));
      pingTimerId = vertx.setPeriodic(pingInterval, timerId -> send("ping"));
      requestSnapshot();
   }

   private void onClosed(WebSocket ws) {
      synchronized (this) {
         if (webSocket != ws) {
            return;
         }
         webSocket = null;
         connectionId = null;
         if (pingTimerId >= 0) {
            vertx.cancelTimer(pingTimerId);
            pingTimerId = -1;
         }
         if (stopped) {
            return;
         }
      }
      log.info("Viewer connection closed, reconnecting...");
      state.invalidate();
      notifyListeners();
      scheduleReconnect();
   }

   private synchronized void scheduleReconnect() {
      if (stopped) {
         return;
      }
      long delay = reconnectDelay;
      reconnectDelay = Math.min(reconnectDelay * 2, maxReconnectDelay);
      vertx.setTimer(delay, timerId -> connect());
   }

   public void requestSnapshot() {
      send("snapshot");
   }

   private synchronized void send(String type) {
      if (webSocket != null && !webSocket.isClosed()) {
         webSocket.writeTextMessage(new JsonObject().put("type", type).encode());
      }
   }

   private void handleMessage(String message) {
      JsonObject envelope;
      try {
         envelope = new JsonObject(message);
      } catch (DecodeException e) {
         log.warn("Cannot parse viewer message: {}", message);
         requestSnapshot();
         return;
      }
      String type = envelope.getString("type", "");
      JsonObject data = envelope.getJsonObject("data");
      switch (type) {
         case "connection":
            synchronized (this) {
               connectionId = data == null ? null : data.getString("connectionId");
            }
            return;
         case "connection:status":
            if (data == null) {
               requestSnapshot();
            } else {
               state.applySnapshot(data.mapTo(RunsSnapshot.class));
               notifyListeners();
            }
            return;
         case "pong":
            return;
         case "error":
            log.warn("Controller reported an error: {}", data == null ? null : data.getString("message"));
            requestSnapshot();
            return;
         default:
            break;
      }
      RunEvent.Type eventType = RunEvent.Type.fromWire(type);
      if (eventType == null || data == null) {
         log.debug("Ignoring unknown viewer message {}", type);
         return;
      }
      RunEvent event;
      try {
         event = data.mapTo(eventType.eventClass());
      } catch (IllegalArgumentException | DecodeException e) {
         log.warn("Cannot decode {} event", type, e);
         requestSnapshot();
         return;
      }
      if (state.apply(event)) {
         notifyListeners();
      } else {
         log.debug("Event {} does not match local state, requesting snapshot", event);
         requestSnapshot();
      }
   }

   private void notifyListeners() {
      for (Consumer<ViewerState> listener : listeners) {
         listener.accept(state);
      }
   }
}
