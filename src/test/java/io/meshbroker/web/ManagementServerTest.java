package io.meshbroker.web;

import com.fasterxml.jackson.databind.JsonNode;
import io.meshbroker.config.BrokerSettings;
import io.meshbroker.model.FrameType;
import io.meshbroker.runtime.MeshBroker;
import io.meshbroker.store.InMemoryBrokerStore;
import io.meshbroker.transport.RecordingConnection;
import io.meshbroker.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;

final class ManagementServerTest {
    private MeshBroker broker;
    private ManagementServer server;
    private HttpClient client;
    private RecordingConnection worker;

    @BeforeEach
    void setUp() throws Exception {
        broker = new MeshBroker(BrokerSettings.defaults(), new InMemoryBrokerStore(), candidates -> candidates.get(0), Clock.systemUTC());
        broker.init();
        worker = new RecordingConnection("W");
        broker.onOpen(worker);
        broker.onFrame("W", "{\"event\":\"register\",\"data\":{\"name\":\"crawler\",\"capabilities\":[\"scrape\"]}}");
        server = new ManagementServer(broker, 0);
        server.start();
        client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void tearDown() {
        server.close();
        broker.close();
    }

    @Test
    void healthAndNodeProjections() throws Exception {
        JsonNode health = Jsons.readTree(get("/health").body());
        Assertions.assertEquals("healthy", health.path("status").asText());
        Assertions.assertEquals(1, health.path("nodes").asInt());

        JsonNode nodes = Jsons.readTree(get("/api/nodes").body());
        Assertions.assertEquals(1, nodes.path("totalNodes").asInt());
        Assertions.assertEquals("crawler", nodes.path("nodes").get(0).path("name").asText());

        JsonNode capabilities = Jsons.readTree(get("/api/capabilities").body());
        Assertions.assertEquals("scrape", capabilities.path("W").path("capabilities").get(0).asText());
    }

    @Test
    void broadcastReachesNodesAndIsAudited() throws Exception {
        HttpResponse<String> response = post("/api/broadcast", "{\"notice\":\"restart at noon\"}");

        Assertions.assertEquals(200, response.statusCode());
        Assertions.assertEquals(1, Jsons.readTree(response.body()).path("delivered").asInt());
        Assertions.assertEquals("restart at noon", worker.last(FrameType.BROADCAST).orElseThrow().path("notice").asText());

        JsonNode audit = Jsons.readTree(get("/api/audit?limit=1").body());
        Assertions.assertEquals(1, audit.size());
        Assertions.assertEquals("message.broadcast", audit.get(0).path("action").asText());
    }

    @Test
    void badBroadcastBodiesAreRejected() throws Exception {
        Assertions.assertEquals(400, post("/api/broadcast", "{oops").statusCode());
        Assertions.assertEquals(400, post("/api/broadcast", "").statusCode());
        Assertions.assertEquals(0, worker.count(FrameType.BROADCAST));
    }

    @Test
    void oversizedBroadcastBodyIsRefusedWith413() throws Exception {
        String body = "{\"pad\":\"" + "x".repeat(ManagementServer.MAX_BODY_BYTES) + "\"}";

        HttpResponse<String> response = post("/api/broadcast", body);

        Assertions.assertEquals(413, response.statusCode());
        Assertions.assertEquals("request body too large", Jsons.readTree(response.body()).path("error").asText());
        Assertions.assertEquals(0, worker.count(FrameType.BROADCAST));
    }

    @Test
    void inFlightTasksAreListed() throws Exception {
        RecordingConnection requester = new RecordingConnection("R");
        broker.onOpen(requester);
        broker.onFrame("R", "{\"event\":\"register\",\"data\":{}}");
        broker.onFrame("R", "{\"event\":\"task\",\"data\":{\"capability\":\"scrape\",\"timeoutMs\":60000}}");
        String taskId = requester.last(FrameType.TASK_DISPATCHED).orElseThrow().path("taskId").asText();

        JsonNode tasks = Jsons.readTree(get("/api/tasks").body());

        Assertions.assertEquals(1, tasks.size());
        Assertions.assertEquals(taskId, tasks.get(0).path("taskId").asText());
        Assertions.assertEquals("W", tasks.get(0).path("assignedTo").asText());
        Assertions.assertEquals("DISPATCHED", tasks.get(0).path("state").asText());
    }

    @Test
    void queuedMessagesCanBeDrained() throws Exception {
        broker.onFrame("W", "{\"event\":\"message\",\"data\":{\"to\":\"offline-node\",\"type\":\"chat\",\"messageId\":\"m1\"}}");

        JsonNode peek = Jsons.readTree(get("/api/messages/offline-node").body());
        Assertions.assertEquals("m1", peek.get(0).path("message").path("id").asText());
        JsonNode drained = Jsons.readTree(get("/api/messages/offline-node?drain=true").body());
        Assertions.assertEquals(1, drained.size());
        Assertions.assertEquals(0, Jsons.readTree(get("/api/messages/offline-node").body()).size());
    }

    @Test
    void metricsAreExposedAsPrometheusText() throws Exception {
        HttpResponse<String> response = get("/metrics");

        Assertions.assertEquals(200, response.statusCode());
        Assertions.assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));
        Assertions.assertTrue(response.body().contains("meshbroker_connected_nodes 1\n"));
    }

    @Test
    void wrongMethodAndUnknownPath() throws Exception {
        HttpResponse<String> wrong = post("/api/nodes", "{}");
        Assertions.assertEquals(405, wrong.statusCode());
        Assertions.assertEquals("GET", wrong.headers().firstValue("Allow").orElse(""));
        Assertions.assertEquals(404, get("/api/nowhere").statusCode());
        Assertions.assertEquals(400, get("/api/audit?limit=many").statusCode());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.localPort() + path);
    }
}
