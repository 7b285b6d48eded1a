package io.runwatch.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import io.runwatch.api.RunKind;
import io.runwatch.api.RunStatus;
import io.runwatch.api.TestStatus;
import io.runwatch.api.model.ActiveRun;
import io.runwatch.api.model.Admission;
import io.runwatch.api.model.AdmissionConflict;
import io.runwatch.api.model.ResetReport;
import io.runwatch.api.model.RunRequest;
import io.runwatch.api.model.RunsSnapshot;
import io.runwatch.client.RestClient;
import io.runwatch.client.ViewerSession;
import io.runwatch.client.ViewerState;
import io.runwatch.internal.Properties;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.WebSocket;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;

@ExtendWith(VertxExtension.class)
public class ControllerServerTest {
   private static final String HOST = "127.0.0.1";
   private static final String ADMIN_TOKEN = "secret";

   @TempDir
   Path runDir;
   @TempDir
   Path workerDir;

   private Vertx vertx;
   private ControllerVerticle controller;
   private RestClient client;
   private WebClient webClient;

   @BeforeEach
   public void before(Vertx vertx) throws Exception {
      this.vertx = vertx;
      // stands in for the test runner; ignores the arguments it gets
      Path worker = workerDir.resolve("worker.sh");
      Files.writeString(worker, "#!/bin/sh\nexec sleep 30\n");
      assertThat(worker.toFile().setExecutable(true)).isTrue();
      controller = deploy(new JsonObject());
      client = new RestClient(vertx, HOST, controller.actualPort());
      webClient = WebClient.create(vertx);
   }

   @AfterEach
   public void after() {
      client.close();
      webClient.close();
   }

   private ControllerVerticle deploy(JsonObject overrides) throws Exception {
      JsonObject config = new JsonObject()
            .put(Properties.CONTROLLER_HOST, HOST)
            .put(Properties.CONTROLLER_PORT, 0)
            .put(Properties.RUN_DIR, runDir.toString())
            .put(Properties.DEPLOYER, "local")
            .put(Properties.WORKER_COMMAND, workerDir.resolve("worker.sh").toString())
            .put(Properties.ADMIN_TOKEN, ADMIN_TOKEN)
            .mergeIn(overrides);
      ControllerVerticle verticle = new ControllerVerticle();
      vertx.deployVerticle(verticle, new DeploymentOptions().setConfig(config))
            .toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
      return verticle;
   }

   private HttpResponse<Buffer> post(int port, String path, JsonObject body) throws Exception {
      return webClient.post(port, HOST, path).sendJsonObject(body)
            .toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
   }

   private static void await(BooleanSupplier condition, String description) throws InterruptedException {
      long deadline = System.currentTimeMillis() + 10_000;
      while (!condition.getAsBoolean()) {
         if (System.currentTimeMillis() > deadline) {
            throw new AssertionError("Timed out waiting for " + description);
         }
         Thread.sleep(20);
      }
   }

   @Test
   public void testIngestionLifecycle() {
      assertThat(client.runStarted("ext-1", RunKind.BULK_RUN, null, 2)).isTrue();
      assertThat(client.testStarted("ext-1", "test-a", "logs in", "auth.spec.ts")).isTrue();

      RunsSnapshot snapshot = client.activeRuns();
      assertThat(snapshot.isAnyRunning).isTrue();
      assertThat(snapshot.activeRuns).hasSize(1);
      assertThat(snapshot.activeRuns.get(0).progress.runningTests).hasSize(1);
      assertThat(snapshot.activeRuns.get(0).progress.totalTests).isEqualTo(2);

      assertThat(client.testEnded("ext-1", "test-a", TestStatus.PASSED, "logs in", "auth.spec.ts")).isTrue();
      assertThat(client.testEnded("ext-1", "test-a", TestStatus.PASSED, "logs in", "auth.spec.ts")).isFalse();
      assertThat(client.testEnded("ext-1", "test-b", TestStatus.FAILED, "logs out", "auth.spec.ts")).isTrue();

      ActiveRun run = client.run("ext-1");
      assertThat(run.progress.completedTests).isEqualTo(2);
      assertThat(run.progress.passedTests).isEqualTo(1);
      assertThat(run.progress.failedTests).isEqualTo(1);

      assertThat(client.runEnded("ext-1", RunStatus.COMPLETED)).isTrue();
      assertThat(client.runEnded("ext-1", RunStatus.FAILED)).isFalse();
      assertThat(client.activeRuns().isAnyRunning).isFalse();

      ActiveRun closed = client.run("ext-1");
      assertThat(closed.isClosed()).isTrue();
      assertThat(closed.finalStatus).isEqualTo(RunStatus.COMPLETED);
      assertThat(client.run("unknown")).isNull();
   }

   @Test
   public void testProgressForUnknownRunIsNotApplied() {
      assertThat(client.testStarted("nope", "test-a", null, null)).isFalse();
      assertThat(client.testEnded("nope", "test-a", TestStatus.PASSED, null, null)).isFalse();
      assertThat(client.runEnded("nope", RunStatus.COMPLETED)).isFalse();
   }

   @Test
   public void testIdentity() {
      assertThat(client.testId("e2e/tests/auth.spec.ts", "should login")).isEqualTo("test-myj9au");
      assertThat(client.testId("checkout.spec.ts", "adds item to cart")).isEqualTo("test-74gpdi");

      // reporters may omit the id
      assertThat(client.runStarted("ext-2", RunKind.GROUP_RUN, "auth.spec.ts", 1)).isTrue();
      assertThat(client.testStarted("ext-2", null, "should login", "auth.spec.ts")).isTrue();
      assertThat(client.run("ext-2").progress.isRunning("test-myj9au")).isTrue();
   }

   @Test
   public void testBadRequests() throws Exception {
      int port = controller.actualPort();
      assertThat(post(port, "/api/ingest/run-start", new JsonObject().put("runId", "x")).statusCode()).isEqualTo(400);
      assertThat(post(port, "/api/ingest/run-start", new JsonObject().put("runId", "x").put("kind", "bogus"))
            .statusCode()).isEqualTo(400);
      assertThat(post(port, "/api/ingest/run-start", new JsonObject().put("runId", "x").put("kind", "run-group"))
            .statusCode()).isEqualTo(400);
      assertThat(post(port, "/api/ingest/test-end", new JsonObject().put("runId", "x").put("testId", "t"))
            .statusCode()).isEqualTo(400);
      assertThat(post(port, "/api/ingest/test-end", new JsonObject().put("runId", "x").put("testId", "t")
            .put("status", "exploded")).statusCode()).isEqualTo(400);
      assertThat(post(port, "/api/ingest/test-start", new JsonObject().put("runId", "x")).statusCode()).isEqualTo(400);
      assertThat(post(port, "/api/runs/bulk", new JsonObject().put("maxWorkers", 0)).statusCode()).isEqualTo(400);

      // ids end up in file names
      assertThat(post(port, "/api/ingest/run-start", new JsonObject().put("runId", "../../escaped").put("kind", "run-all"))
            .statusCode()).isEqualTo(400);
      assertThat(post(port, "/api/ingest/test-end", new JsonObject().put("runId", "x").put("testId", "../x")
            .put("status", "passed")).statusCode()).isEqualTo(400);
      assertThat(controller.registry().find("../../escaped")).isNull();

      // fields of the wrong type
      assertThat(post(port, "/api/ingest/run-start", new JsonObject().put("runId", "x").put("kind", "run-group")
            .put("scope", new JsonObject().put("nested", true))).statusCode()).isEqualTo(400);
      assertThat(post(port, "/api/ingest/test-start", new JsonObject().put("runId", "x").put("name", 42)
            .put("filePath", "a.spec.ts")).statusCode()).isEqualTo(400);
      assertThat(post(port, "/api/ingest/run-start", new JsonObject().put("runId", "x").put("kind", "run-all")
            .put("totalTests", "many")).statusCode()).isEqualTo(400);
      assertThat(post(port, "/api/runs/group", new JsonObject().put("filePath", 7)).statusCode()).isEqualTo(400);

      HttpResponse<Buffer> identity = webClient.get(port, HOST, "/api/identity").send()
            .toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
      assertThat(identity.statusCode()).isEqualTo(400);
   }

   @Test
   public void testRunStartConflict() throws Exception {
      assertThat(client.runStarted("ext-1", RunKind.BULK_RUN, null, 0)).isTrue();
      HttpResponse<Buffer> response = post(controller.actualPort(), "/api/ingest/run-start",
            new JsonObject().put("runId", "ext-2").put("kind", "run-all"));
      assertThat(response.statusCode()).isEqualTo(409);
      JsonObject conflict = response.bodyAsJsonObject();
      assertThat(conflict.getString("code")).isEqualTo(AdmissionConflict.CODE);
      assertThat(conflict.getString("currentRunId")).isEqualTo("ext-1");
   }

   @Test
   public void testLaunch() {
      Admission first = client.launch(RunRequest.group("suite-a.spec.ts", null));
      assertThat(first.isAdmitted()).isTrue();
      assertThat(controller.supervisor().isSupervised(first.runId())).isTrue();

      Admission second = client.launch(RunRequest.group("suite-a.spec.ts", 2));
      assertThat(second.isAdmitted()).isFalse();
      assertThat(second.conflict().currentRunId).isEqualTo(first.runId());
      assertThat(second.conflict().scope).isEqualTo("suite-a.spec.ts");
      assertThat(second.conflict().isScopeMatch()).isTrue();

      Admission other = client.launch(RunRequest.group("suite-b.spec.ts", null));
      assertThat(other.isAdmitted()).isTrue();
      Admission rerun = client.launch(RunRequest.rerun("test-myj9au", "auth.spec.ts", "should login", null));
      assertThat(rerun.isAdmitted()).isTrue();

      assertThat(client.activeRuns().activeRuns).hasSize(3);
   }

   @Test
   public void testLaunchSpawnFailure() throws Exception {
      ControllerVerticle broken = deploy(new JsonObject().put(Properties.WORKER_COMMAND, "/nonexistent/runwatch-worker"));
      HttpResponse<Buffer> response = post(broken.actualPort(), "/api/runs/bulk", new JsonObject());
      assertThat(response.statusCode()).isEqualTo(500);
      assertThat(broken.registry().snapshot().isAnyRunning).isFalse();
   }

   @Test
   public void testForceReset() throws Exception {
      Admission admission = client.launch(RunRequest.bulk(null));
      assertThat(admission.isAdmitted()).isTrue();

      assertThatThrownBy(() -> client.forceReset(true)).isInstanceOf(RestClient.Unauthorized.class);
      client.setToken("wrong");
      assertThatThrownBy(() -> client.forceReset(true)).isInstanceOf(RestClient.Unauthorized.class);

      client.setToken(ADMIN_TOKEN);
      ResetReport report = client.forceReset(true);
      assertThat(report.before.activeRuns).extracting(run -> run.runId).containsExactly(admission.runId());
      assertThat(report.after.activeRuns).isEmpty();
      assertThat(client.activeRuns().isAnyRunning).isFalse();

      await(() -> !controller.supervisor().isSupervised(admission.runId()), "worker to terminate");
      assertThat(client.launch(RunRequest.bulk(null)).isAdmitted()).isTrue();
   }

   @Test
   public void testForceResetDisabled() throws Exception {
      ControllerVerticle noToken = deploy(new JsonObject().putNull(Properties.ADMIN_TOKEN));
      try (RestClient other = new RestClient(vertx, HOST, noToken.actualPort())) {
         other.setToken(ADMIN_TOKEN);
         assertThatThrownBy(() -> other.forceReset(false)).isInstanceOf(RestClient.Forbidden.class);
      }
   }

   @Test
   public void testViewerProtocol() throws Exception {
      BlockingQueue<JsonObject> messages = new LinkedBlockingQueue<>();
      WebSocket ws = vertx.createHttpClient().webSocket(controller.actualPort(), HOST, "/ws")
            .onSuccess(socket -> socket.textMessageHandler(text -> messages.add(new JsonObject(text))))
            .toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);

      JsonObject welcome = messages.poll(10, TimeUnit.SECONDS);
      assertThat(welcome.getString("type")).isEqualTo("connection");
      assertThat(welcome.getJsonObject("data").getString("connectionId")).isNotBlank();
      JsonObject status = messages.poll(10, TimeUnit.SECONDS);
      assertThat(status.getString("type")).isEqualTo("connection:status");
      assertThat(status.getJsonObject("data").getBoolean("isAnyRunning")).isFalse();

      controller.registry().attach("ext-1", RunKind.SINGLE_RERUN, "test-myj9au", 0);
      JsonObject admitted = messages.poll(10, TimeUnit.SECONDS);
      assertThat(admitted.getString("type")).isEqualTo("run:admitted");
      assertThat(admitted.getJsonObject("data").getJsonObject("run").getString("runId")).isEqualTo("ext-1");

      ws.writeTextMessage(new JsonObject().put("type", "ping").encode());
      assertThat(messages.poll(10, TimeUnit.SECONDS).getString("type")).isEqualTo("pong");

      ws.writeTextMessage(new JsonObject().put("type", "snapshot").encode());
      JsonObject resync = messages.poll(10, TimeUnit.SECONDS);
      assertThat(resync.getString("type")).isEqualTo("connection:status");
      assertThat(resync.getJsonObject("data").getJsonArray("activeRuns")).hasSize(1);

      ws.writeTextMessage("not json");
      assertThat(messages.poll(10, TimeUnit.SECONDS).getString("type")).isEqualTo("error");
      ws.writeTextMessage(new JsonObject().put("type", "dance").encode());
      assertThat(messages.poll(10, TimeUnit.SECONDS).getString("type")).isEqualTo("error");
      assertThat(controller.hub().connectionCount()).isEqualTo(1);

      ws.close();
      await(() -> controller.hub().connectionCount() == 0, "viewer to disconnect");
   }

   @Test
   public void testViewerSessionFollowsRuns() throws Exception {
      ViewerState state = new ViewerState();
      ViewerSession session = new ViewerSession(vertx, HOST, controller.actualPort(), state, 1000, 50, 500);
      session.start();
      try {
         await(state::isSynced, "initial snapshot");

         controller.registry().attach("ext-1", RunKind.GROUP_RUN, "auth.spec.ts", 2);
         await(() -> state.isGroupRunning("auth.spec.ts"), "group run");
         assertThat(state.isBulkRunning()).isFalse();

         controller.registry().startTest("ext-1", "test-myj9au", "should login", "auth.spec.ts");
         await(() -> state.isTestRunning("test-myj9au"), "test start");

         controller.registry().completeTest("ext-1", "test-myj9au", TestStatus.PASSED);
         await(() -> !state.isTestRunning("test-myj9au"), "test end");
         assertThat(state.find("ext-1").progress.passedTests).isEqualTo(1);

         controller.registry().close("ext-1", RunStatus.COMPLETED);
         await(() -> !state.isAnyRunning(), "run close");
      } finally {
         session.stop();
      }
   }

   @Test
   public void testViewerSessionReconnects() throws Exception {
      // the controller drops viewers that stay silent for 300 ms
      ControllerVerticle strict = deploy(new JsonObject()
            .put(Properties.VIEWER_TIMEOUT, 300).put(Properties.SWEEP_PERIOD, 100));
      ViewerState state = new ViewerState();
      ViewerSession session = new ViewerSession(vertx, HOST, strict.actualPort(), state, 60_000, 50, 200);
      session.start();
      try {
         await(() -> session.connectionId() != null, "first connection");
         String firstConnection = session.connectionId();

         strict.registry().attach("ext-1", RunKind.BULK_RUN, null, 0);
         await(() -> session.connectionId() != null && !session.connectionId().equals(firstConnection), "reconnection");
         await(() -> state.isSynced() && state.isBulkRunning(), "resynchronized state");
      } finally {
         session.stop();
      }
   }
}
