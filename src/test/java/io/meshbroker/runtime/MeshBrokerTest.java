package io.meshbroker.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.meshbroker.config.BrokerSettings;
import io.meshbroker.config.CapabilityFramePolicy;
import io.meshbroker.config.RegistrationPolicy;
import io.meshbroker.dispatch.NodeSelector;
import io.meshbroker.model.FrameType;
import io.meshbroker.store.InMemoryBrokerStore;
import io.meshbroker.transport.RecordingConnection;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Set;

final class MeshBrokerTest {
    private static final NodeSelector FIRST = candidates -> candidates.get(0);

    @Test
    void workerScenarioFromRegistrationToCompletion() throws Exception {
        try (MeshBroker broker = broker(BrokerSettings.defaults())) {
            RecordingConnection requester = connect(broker, "R");
            RecordingConnection worker = connect(broker, "W");
            broker.onFrame("R", "{\"event\":\"register\",\"data\":{\"type\":\"agent\",\"name\":\"planner\"}}");
            broker.onFrame("W", "{\"event\":\"register\",\"data\":{\"type\":\"worker\",\"capabilities\":[\"scrape\"]}}");

            Assertions.assertEquals(1, requester.count(FrameType.NODE_JOINED));
            Assertions.assertEquals(2, worker.last(FrameType.NETWORK_STATUS).orElseThrow().path("totalNodes").asInt());

            broker.onFrame("R", "{\"event\":\"task\",\"data\":{\"capability\":\"scrape\",\"payload\":{\"url\":\"u\"},\"timeout\":5000}}");
            JsonNode assigned = worker.last(FrameType.TASK_ASSIGNED).orElseThrow();
            String taskId = assigned.path("taskId").asText();
            Assertions.assertEquals(5_000L, assigned.path("timeoutMs").asLong());
            Assertions.assertEquals(taskId, requester.last(FrameType.TASK_DISPATCHED).orElseThrow().path("taskId").asText());

            broker.onFrame("W", "{\"event\":\"task_result\",\"data\":{\"taskId\":\"" + taskId + "\",\"result\":{\"ok\":true}}}");
            Assertions.assertTrue(requester.last(FrameType.TASK_COMPLETED).orElseThrow().path("result").path("ok").asBoolean());
            Assertions.assertEquals(0, broker.dispatcher().inFlightCount());
            Assertions.assertEquals(1L, broker.stats().tasksCompleted());
        }
    }

    @Test
    void malformedAndUnknownFramesGetErrorReplies() {
        try (MeshBroker broker = broker(BrokerSettings.defaults())) {
            RecordingConnection a = connect(broker, "A");

            broker.onFrame("A", "not json");
            broker.onFrame("A", "{\"event\":\"teleport\",\"data\":{}}");
            broker.onFrame("A", "{\"event\":\"node_joined\",\"data\":{}}");
            broker.onFrame("A", "{\"event\":\"message\",\"data\":\"hello\"}");

            List<JsonNode> errors = a.dataOf(FrameType.ERROR);
            Assertions.assertEquals(4, errors.size());
            Assertions.assertEquals("malformed_frame", errors.get(0).path("code").asText());
            Assertions.assertEquals("unsupported_event", errors.get(1).path("code").asText());
            Assertions.assertEquals("unsupported_event", errors.get(2).path("code").asText());
            Assertions.assertEquals("malformed_frame", errors.get(3).path("code").asText());
            Assertions.assertEquals(4L, broker.stats().malformedFrames());
        }
    }

    @Test
    void unregisteredSenderCannotReceiveButStillRoutes() {
        try (MeshBroker broker = broker(BrokerSettings.defaults())) {
            RecordingConnection pending = connect(broker, "P");
            RecordingConnection b = connect(broker, "B");
            broker.onFrame("B", "{\"event\":\"register\",\"data\":{}}");

            broker.onFrame("B", "{\"event\":\"message\",\"data\":{\"type\":\"ping\"}}");
            broker.onFrame("P", "{\"event\":\"message\",\"data\":{\"to\":\"B\",\"type\":\"ping\"}}");

            Assertions.assertEquals(0, pending.count(FrameType.MESSAGE));
            Assertions.assertEquals(1, b.count(FrameType.MESSAGE));
            Assertions.assertEquals("P", b.last(FrameType.MESSAGE).orElseThrow().path("from").asText());
        }
    }

    @Test
    void capabilitiesBeforeRegisterAreIgnoredOrRejected() {
        try (MeshBroker broker = broker(BrokerSettings.defaults())) {
            RecordingConnection a = connect(broker, "A");
            broker.onFrame("A", "{\"event\":\"capabilities\",\"data\":{\"capabilities\":[\"scrape\"]}}");

            Assertions.assertEquals(0, a.count(FrameType.ERROR));
            Assertions.assertEquals(Set.of(), broker.capabilityIndex().nodesWith("scrape"));
        }
        BrokerSettings strict = BrokerSettings.defaults().withCapabilityFramePolicy(CapabilityFramePolicy.REJECT_UNREGISTERED);
        try (MeshBroker broker = broker(strict)) {
            RecordingConnection a = connect(broker, "A");
            broker.onFrame("A", "{\"event\":\"capabilities\",\"data\":[\"scrape\"]}");

            Assertions.assertEquals("not_registered", a.last(FrameType.ERROR).orElseThrow().path("code").asText());
        }
    }

    @Test
    void capabilitiesFrameAcceptsBareArray() {
        try (MeshBroker broker = broker(BrokerSettings.defaults())) {
            connect(broker, "A");
            broker.onFrame("A", "{\"event\":\"register\",\"data\":{\"capabilities\":[\"scrape\"]}}");
            broker.onFrame("A", "{\"event\":\"capabilities\",\"data\":[\"llm\"]}");

            Assertions.assertEquals(Set.of("A"), broker.capabilityIndex().nodesWith("llm"));
            Assertions.assertEquals(Set.of(), broker.capabilityIndex().nodesWith("scrape"));
        }
    }

    @Test
    void duplicateRegistrationUnderRejectPolicy() {
        BrokerSettings settings = BrokerSettings.defaults().withRegistrationPolicy(RegistrationPolicy.REJECT);
        try (MeshBroker broker = broker(settings)) {
            RecordingConnection a = connect(broker, "A");
            broker.onFrame("A", "{\"event\":\"register\",\"data\":{\"name\":\"first\"}}");
            broker.onFrame("A", "{\"event\":\"register\",\"data\":{\"name\":\"second\"}}");

            Assertions.assertEquals("duplicate_registration", a.last(FrameType.ERROR).orElseThrow().path("code").asText());
            Assertions.assertEquals("first", broker.registry().lookup("A").orElseThrow().name());
        }
    }

    @Test
    void foreignTaskResultIsAnsweredWithError() {
        try (MeshBroker broker = broker(BrokerSettings.defaults())) {
            RecordingConnection a = connect(broker, "A");
            broker.onFrame("A", "{\"event\":\"register\",\"data\":{}}");

            broker.onFrame("A", "{\"event\":\"task_result\",\"data\":{\"taskId\":\"nope\"}}");

            Assertions.assertEquals("task_not_in_flight", a.last(FrameType.ERROR).orElseThrow().path("code").asText());
        }
    }

    @Test
    void closeEvictsAndAnnounces() {
        try (MeshBroker broker = broker(BrokerSettings.defaults())) {
            RecordingConnection a = connect(broker, "A");
            connect(broker, "B");
            broker.onFrame("A", "{\"event\":\"register\",\"data\":{}}");
            broker.onFrame("B", "{\"event\":\"register\",\"data\":{\"capabilities\":[\"scrape\"]}}");

            broker.onClose("B");

            Assertions.assertEquals("B", a.last(FrameType.NODE_LEFT).orElseThrow().path("nodeId").asText());
            Assertions.assertEquals(1, broker.nodes().totalNodes());
            Assertions.assertEquals(Set.of(), broker.capabilityIndex().nodesWith("scrape"));
        }
    }

    private static MeshBroker broker(BrokerSettings settings) {
        MeshBroker broker = new MeshBroker(settings, new InMemoryBrokerStore(), FIRST, Clock.systemUTC());
        broker.init();
        return broker;
    }

    private static RecordingConnection connect(MeshBroker broker, String id) {
        RecordingConnection connection = new RecordingConnection(id);
        broker.onOpen(connection);
        return connection;
    }
}
