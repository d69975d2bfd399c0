package io.meshbroker.observability;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(BrokerStats.Snapshot stats) {
        StringBuilder sb = new StringBuilder();
        appendCounter(sb, "meshbroker_registrations_total", "Accepted register frames", null, null, stats.registrations());
        appendCounter(sb, "meshbroker_evictions_total", "Registered nodes evicted on disconnect", null, null, stats.evictions());

        appendCounter(sb, "meshbroker_messages_routed_total", "Messages routed grouped by destination kind", "route", "broadcast", stats.messagesBroadcast());
        appendCounter(sb, "meshbroker_messages_routed_total", "Messages routed grouped by destination kind", "route", "capability", stats.messagesByCapability());
        appendCounter(sb, "meshbroker_messages_routed_total", "Messages routed grouped by destination kind", "route", "direct", stats.messagesDirect());
        appendCounter(sb, "meshbroker_messages_queued_total", "Messages written to the offline queue", null, null, stats.messagesQueued());

        appendCounter(sb, "meshbroker_tasks_total", "Tasks grouped by outcome", "outcome", "dispatched", stats.tasksDispatched());
        appendCounter(sb, "meshbroker_tasks_total", "Tasks grouped by outcome", "outcome", "rejected", stats.tasksRejected());
        appendCounter(sb, "meshbroker_tasks_total", "Tasks grouped by outcome", "outcome", "completed", stats.tasksCompleted());
        appendCounter(sb, "meshbroker_tasks_total", "Tasks grouped by outcome", "outcome", "failed", stats.tasksFailed());
        appendCounter(sb, "meshbroker_tasks_total", "Tasks grouped by outcome", "outcome", "timed_out", stats.tasksTimedOut());

        appendCounter(sb, "meshbroker_send_failures_total", "Frames that could not be written to a connection", null, null, stats.sendFailures());
        appendCounter(sb, "meshbroker_store_failures_total", "Audit or queue writes that failed", null, null, stats.storeFailures());
        appendCounter(sb, "meshbroker_malformed_frames_total", "Inbound frames rejected as malformed", null, null, stats.malformedFrames());

        appendGauge(sb, "meshbroker_connected_nodes", "Registered nodes with an open connection", stats.connectedNodes());
        appendGauge(sb, "meshbroker_pending_connections", "Open connections that have not registered", stats.pendingConnections());
        appendGauge(sb, "meshbroker_inflight_tasks", "Dispatched tasks awaiting a result or timeout", stats.inFlightTasks());
        appendGauge(sb, "meshbroker_capabilities", "Distinct capabilities currently advertised", stats.capabilities());
        return sb.toString();
    }

    private static void appendCounter(StringBuilder sb, String metric, String help, String labelName, String labelValue, long value) {
        appendHeader(sb, metric, help, "counter");
        sb.append(metric);
        if (labelName != null) {
            sb.append('{').append(labelName).append("=\"").append(escape(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, long value) {
        appendHeader(sb, metric, help, "gauge");
        sb.append(metric).append(' ').append(value).append('\n');
    }

    private static void appendHeader(StringBuilder sb, String metric, String help, String type) {
        String helpLine = "# HELP " + metric + " ";
        if (sb.indexOf(helpLine) >= 0) {
            return;
        }
        sb.append(helpLine).append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
    }

    private static String escape(String raw) {
        return raw.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
