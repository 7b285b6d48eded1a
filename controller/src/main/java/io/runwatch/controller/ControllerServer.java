package io.runwatch.controller;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.netty.handler.codec.http.HttpResponseStatus;
import io.runwatch.api.RunKind;
import io.runwatch.api.RunStatus;
import io.runwatch.api.TestStatus;
import io.runwatch.api.model.ActiveRun;
import io.runwatch.api.model.Admission;
import io.runwatch.api.model.ResetReport;
import io.runwatch.api.model.RunProgress;
import io.runwatch.api.model.RunRequest;
import io.runwatch.controller.supervisor.WorkerSpawnException;
import io.runwatch.core.identity.TestIdentity;
import io.runwatch.impl.Util;
import io.runwatch.internal.Properties;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;

class ControllerServer {
   private static final Logger log = LogManager.getLogger(ControllerServer.class);

   private static final String MIME_TYPE_JSON = "application/json";
   private static final String BEARER_PREFIX = "Bearer ";
   // Run and test ids end up in file names.
   private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._:-]*");

   final ControllerVerticle controller;
   final ViewerSocketHandler viewerSocketHandler;
   final String adminToken;
   HttpServer httpServer;
   volatile String baseURL;

   ControllerServer(ControllerVerticle controller, Promise<Void> startFuture) {
      this.controller = controller;
      this.viewerSocketHandler = new ViewerSocketHandler(controller.hub());
      this.adminToken = controller.configString(Properties.ADMIN_TOKEN, null);
      if (adminToken == null) {
         log.info("Admin token is not set, force reset is disabled.");
      }

      Router router = Router.router(controller.getVertx());
      router.route("/api/*").handler(BodyHandler.create());
      router.post("/api/ingest/run-start").handler(this::handleRunStart);
      router.post("/api/ingest/test-start").handler(this::handleTestStart);
      router.post("/api/ingest/test-end").handler(this::handleTestEnd);
      router.post("/api/ingest/run-end").handler(this::handleRunEnd);
      router.get("/api/runs/active").handler(this::handleActiveRuns);
      router.post("/api/runs/bulk").handler(ctx -> handleLaunch(ctx, RunKind.BULK_RUN));
      router.post("/api/runs/group").handler(ctx -> handleLaunch(ctx, RunKind.GROUP_RUN));
      router.post("/api/runs/rerun").handler(ctx -> handleLaunch(ctx, RunKind.SINGLE_RERUN));
      router.get("/api/runs/:runId").handler(this::handleGetRun);
      router.post("/api/admin/force-reset").handler(this::handleForceReset);
      router.get("/api/identity").handler(this::handleIdentity);
      router.get("/ws").handler(this::handleWebSocket);

      String controllerHost = Properties.get(Properties.CONTROLLER_HOST,
            controller.getConfig().getString(Properties.CONTROLLER_HOST, "0.0.0.0"));
      int controllerPort = Properties.getInt(Properties.CONTROLLER_PORT,
            controller.getConfig().getInteger(Properties.CONTROLLER_PORT, 8090));
      String externalUri = controller.configString(Properties.CONTROLLER_EXTERNAL_URI, null);
      httpServer = controller.getVertx().createHttpServer().requestHandler(router)
            .listen(controllerPort, controllerHost, serverResult -> {
               if (serverResult.succeeded()) {
                  String host = controllerHost;
                  // 0.0.0.0 is not a reachable address for the workers
                  if (host.equals("0.0.0.0")) {
                     try {
                        host = InetAddress.getLocalHost().getHostName();
                     } catch (UnknownHostException e) {
                        host = "localhost";
                     }
                  }
                  baseURL = externalUri != null ? externalUri : "http://" + host + ":" + serverResult.result().actualPort();
                  log.info("Runwatch controller listening on {}", baseURL);
                  startFuture.complete();
               } else {
                  startFuture.fail(serverResult.cause());
               }
            });
   }

   void stop(Promise<Void> stopFuture) {
      httpServer.close(result -> stopFuture.complete());
   }

   private void respondWithJson(RoutingContext ctx, HttpResponseStatus status, Object entity) {
      ctx.response()
            .setStatusCode(status.code())
            .putHeader(HttpHeaders.CONTENT_TYPE, MIME_TYPE_JSON)
            .end(Json.encode(entity));
   }

   private void badRequest(RoutingContext ctx, String message) {
      ctx.response().setStatusCode(HttpResponseStatus.BAD_REQUEST.code()).end(message);
   }

   private void applied(RoutingContext ctx, boolean applied) {
      respondWithJson(ctx, HttpResponseStatus.OK, new JsonObject().put("applied", applied).getMap());
   }

   private JsonObject bodyAsJson(RoutingContext ctx) {
      String body = ctx.body().asString();
      if (body == null || body.isBlank()) {
         return new JsonObject();
      }
      return new JsonObject(body);
   }

   private JsonObject readBody(RoutingContext ctx) {
      try {
         return bodyAsJson(ctx);
      } catch (DecodeException | ClassCastException e) {
         badRequest(ctx, "Cannot parse request body: " + Util.explainCauses(e));
         return null;
      }
   }

   private String requireId(RoutingContext ctx, JsonObject body, String field) {
      String id = require(ctx, body, field);
      if (id != null && !ID_PATTERN.matcher(id).matches()) {
         badRequest(ctx, "Invalid " + field + " '" + id + "'.");
         return null;
      }
      return id;
   }

   private String require(RoutingContext ctx, JsonObject body, String field) {
      Object value = body.getValue(field);
      if (value == null || Util.isBlank(value.toString())) {
         badRequest(ctx, "Missing field '" + field + "'.");
         return null;
      }
      return value.toString();
   }

   private void handleRunStart(RoutingContext ctx) {
      JsonObject body = readBody(ctx);
      String runId;
      String kindName;
      if (body == null || (runId = requireId(ctx, body, "runId")) == null || (kindName = require(ctx, body, "kind")) == null) {
         return;
      }
      RunKind kind;
      int totalTests;
      String scope;
      try {
         kind = RunKind.fromWire(kindName);
         totalTests = body.getInteger("totalTests", 0);
         scope = stringField(body, "scope");
      } catch (IllegalArgumentException | ClassCastException e) {
         badRequest(ctx, e.getMessage());
         return;
      }
      if (kind.isScoped() && Util.isBlank(scope)) {
         badRequest(ctx, "Missing field 'scope' for " + kind.wireName() + ".");
         return;
      }
      Admission admission = controller.registry().attach(runId, kind, scope, totalTests);
      if (admission.isAdmitted()) {
         applied(ctx, true);
      } else {
         respondWithJson(ctx, HttpResponseStatus.CONFLICT, admission.conflict());
      }
   }

   private void handleTestStart(RoutingContext ctx) {
      JsonObject body = readBody(ctx);
      String runId;
      if (body == null || (runId = requireId(ctx, body, "runId")) == null) {
         return;
      }
      TestRef test = readTest(ctx, body);
      if (test == null) {
         return;
      }
      RunProgress progress = controller.registry().startTest(runId, test.testId, test.name, test.filePath);
      applied(ctx, progress != null);
   }

   private void handleTestEnd(RoutingContext ctx) {
      JsonObject body = readBody(ctx);
      String runId;
      String statusName;
      if (body == null || (runId = requireId(ctx, body, "runId")) == null || (statusName = require(ctx, body, "status")) == null) {
         return;
      }
      TestStatus status;
      try {
         status = TestStatus.fromWire(statusName);
      } catch (IllegalArgumentException e) {
         badRequest(ctx, e.getMessage());
         return;
      }
      TestRef test = readTest(ctx, body);
      if (test == null) {
         return;
      }
      applied(ctx, controller.registry().completeTest(runId, test.testId, status, test.name, test.filePath));
   }

   /**
    * Reporters may send the test id or just the title and file, in which case the id is computed.
    */
   private TestRef readTest(RoutingContext ctx, JsonObject body) {
      String testId;
      String name;
      String filePath;
      try {
         testId = stringField(body, "testId");
         name = stringField(body, "name");
         filePath = stringField(body, "filePath");
      } catch (IllegalArgumentException e) {
         badRequest(ctx, e.getMessage());
         return null;
      }
      if (Util.isBlank(testId)) {
         if (Util.isBlank(name) || Util.isBlank(filePath)) {
            badRequest(ctx, "Missing field 'testId' (or both 'name' and 'filePath').");
            return null;
         }
         testId = TestIdentity.assign(filePath, name);
      } else if (!ID_PATTERN.matcher(testId).matches()) {
         badRequest(ctx, "Invalid testId '" + testId + "'.");
         return null;
      }
      return new TestRef(testId, name, filePath);
   }

   private static String stringField(JsonObject body, String field) {
      Object value = body.getValue(field);
      if (value == null || value instanceof String) {
         return (String) value;
      }
      throw new IllegalArgumentException("Field '" + field + "' must be a string.");
   }

   private void handleRunEnd(RoutingContext ctx) {
      JsonObject body = readBody(ctx);
      String runId;
      String statusName;
      if (body == null || (runId = requireId(ctx, body, "runId")) == null || (statusName = require(ctx, body, "status")) == null) {
         return;
      }
      RunStatus status;
      try {
         status = RunStatus.fromWire(statusName);
      } catch (IllegalArgumentException e) {
         badRequest(ctx, e.getMessage());
         return;
      }
      applied(ctx, controller.registry().close(runId, status) != null);
   }

   private void handleActiveRuns(RoutingContext ctx) {
      respondWithJson(ctx, HttpResponseStatus.OK, controller.registry().snapshot());
   }

   private void handleGetRun(RoutingContext ctx) {
      String runId = ctx.pathParam("runId");
      ActiveRun run = controller.registry().find(runId);
      if (run == null) {
         ctx.response().setStatusCode(HttpResponseStatus.NOT_FOUND.code()).end("Run " + runId + " not found.");
      } else {
         respondWithJson(ctx, HttpResponseStatus.OK, run);
      }
   }

   private void handleLaunch(RoutingContext ctx, RunKind kind) {
      JsonObject body = readBody(ctx);
      if (body == null) {
         return;
      }
      RunRequest request;
      try {
         request = parseRunRequest(kind, body);
      } catch (IllegalArgumentException | ClassCastException e) {
         badRequest(ctx, e.getMessage());
         return;
      }
      controller.getVertx().executeBlocking(() -> controller.supervisor().launch(request), false)
            .onSuccess(admission -> {
               if (admission.isAdmitted()) {
                  respondWithJson(ctx, HttpResponseStatus.ACCEPTED, new JsonObject().put("runId", admission.runId()).getMap());
               } else {
                  respondWithJson(ctx, HttpResponseStatus.CONFLICT, admission.conflict());
               }
            }).onFailure(throwable -> {
               if (throwable instanceof WorkerSpawnException) {
                  ctx.response().setStatusCode(HttpResponseStatus.INTERNAL_SERVER_ERROR.code())
                        .end(Util.explainCauses(throwable));
               } else {
                  log.error("Failed to launch {}", request, throwable);
                  ctx.response().setStatusCode(HttpResponseStatus.INTERNAL_SERVER_ERROR.code()).end();
               }
            });
   }

   private static RunRequest parseRunRequest(RunKind kind, JsonObject body) {
      Integer maxWorkers = body.getInteger("maxWorkers");
      if (maxWorkers != null && maxWorkers <= 0) {
         throw new IllegalArgumentException("'maxWorkers' must be positive.");
      }
      switch (kind) {
         case GROUP_RUN:
            return RunRequest.group(stringField(body, "filePath"), maxWorkers);
         case SINGLE_RERUN:
            return RunRequest.rerun(stringField(body, "testId"), stringField(body, "filePath"),
                  stringField(body, "testName"), maxWorkers);
         default:
            return RunRequest.bulk(maxWorkers);
      }
   }

   private void handleForceReset(RoutingContext ctx) {
      if (adminToken == null) {
         ctx.response().setStatusCode(HttpResponseStatus.FORBIDDEN.code()).end("Force reset is disabled.");
         return;
      }
      String authorization = ctx.request().getHeader(HttpHeaders.AUTHORIZATION);
      if (authorization == null || !MessageDigest.isEqual(authorization.getBytes(StandardCharsets.UTF_8),
            (BEARER_PREFIX + adminToken).getBytes(StandardCharsets.UTF_8))) {
         ctx.response().setStatusCode(HttpResponseStatus.UNAUTHORIZED.code()).end();
         return;
      }
      ResetReport report = controller.registry().forceReset();
      if (Boolean.parseBoolean(ctx.request().getParam("terminate"))) {
         int terminated = controller.supervisor().terminateAll();
         log.warn("Terminated {} worker(s) on force reset.", terminated);
      }
      respondWithJson(ctx, HttpResponseStatus.OK, report);
   }

   private void handleIdentity(RoutingContext ctx) {
      String filePath = ctx.request().getParam("filePath");
      if (Util.isBlank(filePath)) {
         badRequest(ctx, "Missing query parameter 'filePath'.");
         return;
      }
      String title = ctx.request().getParam("title");
      respondWithJson(ctx, HttpResponseStatus.OK,
            new JsonObject().put("testId", TestIdentity.assign(filePath, title)).getMap());
   }

   private void handleWebSocket(RoutingContext ctx) {
      ctx.request().toWebSocket().onSuccess(viewerSocketHandler).onFailure(throwable -> {
         log.warn("Websocket upgrade failed", throwable);
         if (!ctx.response().ended()) {
            ctx.response().setStatusCode(HttpResponseStatus.BAD_REQUEST.code()).end();
         }
      });
   }

   private static class TestRef {
      final String testId;
      final String name;
      final String filePath;

      TestRef(String testId, String name, String filePath) {
         this.testId = testId;
         this.name = name;
         this.filePath = filePath;
      }
   }
}
