package io.meshbroker.cli;

import io.meshbroker.config.BrokerConfig;
import io.meshbroker.config.BrokerSettings;
import io.meshbroker.model.QueuedMessage;
import io.meshbroker.runtime.MeshBroker;
import io.meshbroker.transport.WebSocketTransport;
import io.meshbroker.util.Jsons;
import io.meshbroker.web.ManagementServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "meshbroker",
        mixinStandardHelpOptions = true,
        description = "Presence-aware message and task broker",
        subcommands = {
                MeshBrokerCommand.InitCommand.class,
                MeshBrokerCommand.ServeCommand.class,
                MeshBrokerCommand.QueueCommand.class,
                MeshBrokerCommand.AuditTailCommand.class,
                MeshBrokerCommand.SettingsCommand.class
        }
)
public final class MeshBrokerCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(MeshBrokerCommand.class);

    @Option(names = {"--root"}, description = "Broker data root directory", defaultValue = BrokerConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | serve | queue | audit-tail | settings");
    }

    BrokerConfig config() {
        return BrokerConfig.fromRoot(root);
    }

    BrokerSettings settings() {
        return BrokerSettings.load(config());
    }

    MeshBroker broker(BrokerSettings settings) {
        return broker(settings, false);
    }

    MeshBroker broker(BrokerSettings settings, boolean ephemeral) {
        return ephemeral ? MeshBroker.ephemeral(settings) : MeshBroker.open(config(), settings);
    }

    @Command(name = "init", description = "Create the data root and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        MeshBrokerCommand parent;

        @Override
        public Integer call() {
            try (MeshBroker broker = parent.broker(parent.settings())) {
                broker.init();
            }
            System.out.println("Initialized MeshBroker at: " + parent.config().rootDir());
            return 0;
        }
    }

    @Command(name = "serve", description = "Run the broker: node WebSocket endpoint plus management API")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        MeshBrokerCommand parent;

        @Option(names = {"--ws-port"}, description = "Node WebSocket port (overrides settings)")
        Integer wsPort;

        @Option(names = {"--http-port"}, description = "Management API port (overrides settings)")
        Integer httpPort;

        @Option(names = {"--ephemeral"}, defaultValue = "false",
                description = "Keep the offline queue and audit trail in memory instead of SQLite")
        boolean ephemeral;

        @Override
        public Integer call() throws Exception {
            BrokerSettings settings = parent.settings().withPorts(wsPort, httpPort);
            MeshBroker broker = parent.broker(settings, ephemeral);
            broker.init();
            WebSocketTransport transport = new WebSocketTransport(
                    broker, settings.wsPort(), settings.wsPath(), settings.maxFrameBytes());
            ManagementServer management = new ManagementServer(broker, settings.httpPort());
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutting down MeshBroker...");
                management.close();
                transport.close();
                broker.close();
                stopped.countDown();
            }, "meshbroker-shutdown"));
            transport.start();
            management.start();
            log.info("MeshBroker running (ws={}, http={})", transport.localPort(), management.localPort());
            stopped.await();
            return 0;
        }
    }

    @Command(name = "queue", description = "Print messages queued for an offline node")
    static final class QueueCommand implements Callable<Integer> {
        @ParentCommand
        MeshBrokerCommand parent;

        @Parameters(index = "0", description = "Node id")
        String nodeId;

        @Option(names = {"--drain"}, defaultValue = "false", description = "Clear the queue after reading")
        boolean drain;

        @Override
        public Integer call() {
            try (MeshBroker broker = parent.broker(parent.settings())) {
                broker.init();
                List<QueuedMessage> messages = broker.queuedMessages(nodeId, drain);
                System.out.println(Jsons.toJson(messages));
            }
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print the most recent audit entries, newest first")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        MeshBrokerCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Number of entries")
        int limit;

        @Override
        public Integer call() {
            try (MeshBroker broker = parent.broker(parent.settings())) {
                broker.init();
                broker.auditRecent(limit).forEach(row -> System.out.println(Jsons.toCompactJson(row)));
            }
            return 0;
        }
    }

    @Command(name = "settings", description = "Print resolved broker settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        MeshBrokerCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.settings()));
            return 0;
        }
    }
}
