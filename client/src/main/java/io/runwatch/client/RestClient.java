package io.runwatch.client;

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

import io.runwatch.api.RunKind;
import io.runwatch.api.RunStatus;
import io.runwatch.api.TestStatus;
import io.runwatch.api.model.ActiveRun;
import io.runwatch.api.model.Admission;
import io.runwatch.api.model.AdmissionConflict;
import io.runwatch.api.model.ResetReport;
import io.runwatch.api.model.RunRequest;
import io.runwatch.api.model.RunsSnapshot;
import io.runwatch.internal.Properties;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;

/**
 * Blocking client of the controller HTTP API, used by tools and by workers written in Java.
 * Must not be called from a Vert.x event loop.
 */
public class RestClient implements Closeable {
   private static final long REQUEST_TIMEOUT = Properties.getLong(Properties.CLIENT_REQUEST_TIMEOUT, 30000);

   final Vertx vertx;
   final WebClientOptions options;
   private final WebClient client;
   private String authorization;

   public RestClient(Vertx vertx, String host, int port) {
      this.vertx = vertx;
      // Actually there's little point in using async client, but let's stay in Vert.x libs
      options = new WebClientOptions().setDefaultHost(host).setDefaultPort(port);
      client = WebClient.create(this.vertx, options.setFollowRedirects(false));
   }

   public void setToken(String token) {
      if (token != null) {
         authorization = "Bearer " + token;
      } else {
         authorization = null;
      }
   }

   static RestClientException unexpected(HttpResponse<Buffer> response) {
      StringBuilder sb = new StringBuilder("Server responded with unexpected code: ");
      sb.append(response.statusCode()).append(", ").append(response.statusMessage());
      String body = response.bodyAsString();
      if (body != null && !body.isEmpty()) {
         sb.append(":\n").append(body);
      }
      return new RestClientException(sb.toString());
   }

   public String host() {
      return options.getDefaultHost();
   }

   public int port() {
      return options.getDefaultPort();
   }

   HttpRequest<Buffer> request(HttpMethod method, String path) {
      HttpRequest<Buffer> request = client.request(method, path);
      if (authorization != null) {
         request.putHeader(HttpHeaders.AUTHORIZATION.toString(), authorization);
      }
      return request;
   }

   public RunsSnapshot activeRuns() {
      return sync(() -> request(HttpMethod.GET, "/api/runs/active").send(), 200,
            response -> Json.decodeValue(response.body(), RunsSnapshot.class));
   }

   /**
    * @return the run, or <code>null</code> if the controller does not know it (anymore).
    */
   public ActiveRun run(String runId) {
      return sync(() -> request(HttpMethod.GET, "/api/runs/" + runId).send(), 0, response -> {
         if (response.statusCode() == 404) {
            return null;
         } else if (response.statusCode() != 200) {
            throw unexpected(response);
         }
         return Json.decodeValue(response.body(), ActiveRun.class);
      });
   }

   public Admission launch(RunRequest request) {
      JsonObject body = new JsonObject();
      String path;
      switch (request.kind()) {
         case GROUP_RUN:
            path = "/api/runs/group";
            body.put("filePath", request.filePath());
            break;
         case SINGLE_RERUN:
            path = "/api/runs/rerun";
            body.put("testId", request.scope()).put("filePath", request.filePath()).put("testName", request.testName());
            break;
         default:
            path = "/api/runs/bulk";
      }
      if (request.maxWorkers() != null) {
         body.put("maxWorkers", request.maxWorkers());
      }
      return sync(() -> request(HttpMethod.POST, path).sendJsonObject(body), 0, response -> {
         if (response.statusCode() == 202) {
            return Admission.admitted(response.bodyAsJsonObject().getString("runId"));
         } else if (response.statusCode() == 409) {
            return Admission.rejected(Json.decodeValue(response.body(), AdmissionConflict.class));
         }
         throw unexpected(response);
      });
   }

   public ResetReport forceReset(boolean terminate) {
      return sync(() -> request(HttpMethod.POST, "/api/admin/force-reset")
            .addQueryParam("terminate", String.valueOf(terminate)).send(), 0, response -> {
         if (response.statusCode() == 200) {
            return Json.decodeValue(response.body(), ResetReport.class);
         } else if (response.statusCode() == 401) {
            throw new Unauthorized();
         } else if (response.statusCode() == 403) {
            throw new Forbidden();
         }
         throw unexpected(response);
      });
   }

   public String testId(String filePath, String title) {
      return sync(() -> request(HttpMethod.GET, "/api/identity")
                  .addQueryParam("filePath", filePath).addQueryParam("title", title).send(), 200,
            response -> response.bodyAsJsonObject().getString("testId"));
   }

   public boolean runStarted(String runId, RunKind kind, String scope, int totalTests) {
      return ingest("run-start", new JsonObject().put("runId", runId).put("kind", kind.wireName())
            .put("scope", scope).put("totalTests", totalTests));
   }

   public boolean testStarted(String runId, String testId, String name, String filePath) {
      return ingest("test-start", new JsonObject().put("runId", runId).put("testId", testId)
            .put("name", name).put("filePath", filePath));
   }

   public boolean testEnded(String runId, String testId, TestStatus status, String name, String filePath) {
      return ingest("test-end", new JsonObject().put("runId", runId).put("testId", testId)
            .put("status", status.wireName()).put("name", name).put("filePath", filePath));
   }

   public boolean runEnded(String runId, RunStatus status) {
      return ingest("run-end", new JsonObject().put("runId", runId).put("status", status.wireName()));
   }

   private boolean ingest(String notification, JsonObject body) {
      return sync(() -> request(HttpMethod.POST, "/api/ingest/" + notification).sendJsonObject(body), 200,
            response -> response.bodyAsJsonObject().getBoolean("applied", false));
   }

   static <T> T waitFor(CompletableFuture<T> future) {
      try {
         return future.get(REQUEST_TIMEOUT, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
         Thread.currentThread().interrupt();
         throw new RestClientException(e);
      } catch (ExecutionException e) {
         if (e.getCause() instanceof RestClientException) {
            throw (RestClientException) e.getCause();
         }
         throw new RestClientException(e.getCause() == null ? e : e.getCause());
      } catch (TimeoutException e) {
         throw new RestClientException("Request did not complete within " + REQUEST_TIMEOUT + " ms");
      }
   }

   <T> T sync(Supplier<Future<HttpResponse<Buffer>>> invoker, int statusCode, Function<HttpResponse<Buffer>, T> f) {
      CompletableFuture<T> future = new CompletableFuture<>();
      vertx.runOnContext(ctx -> {
         try {
            invoker.get().onComplete(rsp -> {
               if (rsp.succeeded()) {
                  HttpResponse<Buffer> response = rsp.result();
                  if (statusCode != 0 && response.statusCode() != statusCode) {
                     future.completeExceptionally(unexpected(response));
                     return;
                  }
                  try {
                     future.complete(f.apply(response));
                  } catch (Throwable t) {
                     future.completeExceptionally(t);
                  }
               } else {
                  future.completeExceptionally(rsp.cause());
               }
            });
         } catch (Throwable t) {
            future.completeExceptionally(t);
         }
      });
      return waitFor(future);
   }

   @Override
   public void close() {
      client.close();
   }

   public String toString() {
      return options.getDefaultHost() + ":" + options.getDefaultPort();
   }

   public static class Unauthorized extends RestClientException {
      public Unauthorized() {
         super("Unauthorized: admin token required");
      }
   }

   public static class Forbidden extends RestClientException {
      public Forbidden() {
         super("Forbidden: force reset is disabled on the controller");
      }
   }
}
