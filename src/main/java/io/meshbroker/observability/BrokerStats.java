package io.meshbroker.observability;

import java.util.concurrent.atomic.AtomicLong;

public final class BrokerStats {
    private final AtomicLong registrations = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong messagesBroadcast = new AtomicLong();
    private final AtomicLong messagesByCapability = new AtomicLong();
    private final AtomicLong messagesDirect = new AtomicLong();
    private final AtomicLong messagesQueued = new AtomicLong();
    private final AtomicLong tasksDispatched = new AtomicLong();
    private final AtomicLong tasksRejected = new AtomicLong();
    private final AtomicLong tasksCompleted = new AtomicLong();
    private final AtomicLong tasksFailed = new AtomicLong();
    private final AtomicLong tasksTimedOut = new AtomicLong();
    private final AtomicLong sendFailures = new AtomicLong();
    private final AtomicLong storeFailures = new AtomicLong();
    private final AtomicLong malformedFrames = new AtomicLong();

    public void registration() {
        registrations.incrementAndGet();
    }

    public void eviction() {
        evictions.incrementAndGet();
    }

    public void broadcastRouted() {
        messagesBroadcast.incrementAndGet();
    }

    public void capabilityRouted() {
        messagesByCapability.incrementAndGet();
    }

    public void directRouted() {
        messagesDirect.incrementAndGet();
    }

    public void queued() {
        messagesQueued.incrementAndGet();
    }

    public void taskDispatched() {
        tasksDispatched.incrementAndGet();
    }

    public void taskRejected() {
        tasksRejected.incrementAndGet();
    }

    public void taskCompleted() {
        tasksCompleted.incrementAndGet();
    }

    public void taskFailed() {
        tasksFailed.incrementAndGet();
    }

    public void taskTimedOut() {
        tasksTimedOut.incrementAndGet();
    }

    public void sendFailure() {
        sendFailures.incrementAndGet();
    }

    public void storeFailure() {
        storeFailures.incrementAndGet();
    }

    public void malformedFrame() {
        malformedFrames.incrementAndGet();
    }

    public Snapshot snapshot(int connectedNodes, int pendingConnections, int inFlightTasks, int capabilities) {
        return new Snapshot(
                registrations.get(),
                evictions.get(),
                messagesBroadcast.get(),
                messagesByCapability.get(),
                messagesDirect.get(),
                messagesQueued.get(),
                tasksDispatched.get(),
                tasksRejected.get(),
                tasksCompleted.get(),
                tasksFailed.get(),
                tasksTimedOut.get(),
                sendFailures.get(),
                storeFailures.get(),
                malformedFrames.get(),
                connectedNodes,
                pendingConnections,
                inFlightTasks,
                capabilities
        );
    }

    public record Snapshot(
            long registrations,
            long evictions,
            long messagesBroadcast,
            long messagesByCapability,
            long messagesDirect,
            long messagesQueued,
            long tasksDispatched,
            long tasksRejected,
            long tasksCompleted,
            long tasksFailed,
            long tasksTimedOut,
            long sendFailures,
            long storeFailures,
            long malformedFrames,
            int connectedNodes,
            int pendingConnections,
            int inFlightTasks,
            int capabilities
    ) {
    }
}
