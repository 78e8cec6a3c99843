package org.pulsecheck.monitor.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a raw failure message into a deterministic "five whys" causal chain.
 * <p>
 * The chain always has six entries: five numbered causal steps, the first of which quotes
 * the observed error, followed by one remediation sentence. Known components get a
 * component-specific template; anything else gets a generic one. The output depends only
 * on the inputs, which keeps diagnostic text stable across runs and easy to assert on.
 */
public final class RootCauseAnalyzer {

    private record Template(String dependency, List<String> causes, String remediation) {
    }

    private static final Template DATABASE = new Template(
        "primary relational database",
        List.of(
            "The application could not open or validate a connection to the database",
            "The database server is unreachable, refusing connections, or has exhausted its connection slots",
            "The server process is down, the network path is blocked, or credentials/URL are misconfigured",
            "Recent deployment, failover, or resource exhaustion on the database host was not detected in time"),
        "Verify the database host is running and reachable, check connection URL and credentials, "
            + "and inspect max_connections and pool usage before restarting dependent services.");

    private static final Template CACHE = new Template(
        "cache",
        List.of(
            "Cache reads and writes are failing or timing out",
            "The cache server is unreachable or rejecting commands",
            "The cache process was evicted, restarted, or hit its memory limit",
            "Memory limits, eviction policy, or network rules for the cache were not sized for current load"),
        "Check that the cache server is up and reachable, review its memory usage and eviction policy, "
            + "and confirm host, port, and authentication settings.");

    private static final Template REALTIME_TRANSPORT = new Template(
        "real-time transport",
        List.of(
            "Clients cannot establish or keep real-time connections",
            "The transport endpoint is not accepting upgrades or is dropping connections",
            "The endpoint handler is not started, overloaded, or behind a proxy that strips upgrade headers",
            "Connection limits, idle timeouts, or proxy configuration do not match the deployment"),
        "Confirm the real-time endpoint is started and bound, verify proxy/load-balancer upgrade support "
            + "and timeouts, and check the active connection count against configured limits.");

    private static final Template ANALYTICS_STORE = new Template(
        "analytics store",
        List.of(
            "Analytical queries or inserts are failing",
            "The analytics database is unreachable or rejecting queries",
            "The analytics server is down, overloaded by heavy queries, or out of disk",
            "Capacity planning for the analytics cluster did not account for current ingest volume"),
        "Check analytics server availability and disk space, look for long-running queries, "
            + "and verify connection settings; dependent features can run degraded meanwhile.");

    private static final Template AUTH_SERVICE = new Template(
        "authentication service",
        List.of(
            "Requests cannot be authenticated or tokens cannot be validated",
            "The authentication service is unreachable or returning errors",
            "The service is down, its signing keys are unavailable, or its own dependencies failed",
            "Service discovery, secrets rotation, or deployment ordering left the service unavailable"),
        "Verify the authentication service is running and reachable, check its health endpoint and logs, "
            + "and confirm shared secrets and service URLs are current.");

    private static final Template RESOURCES = new Template(
        "host resources",
        List.of(
            "The process is running close to a resource limit",
            "CPU, memory, or disk usage exceeded the configured thresholds",
            "Workload growth, a leak, or a runaway task is consuming resources",
            "Capacity limits and alert thresholds were not revisited as load changed"),
        "Inspect top resource consumers, free disk space or memory, and scale the instance "
            + "or lower concurrency if usage keeps growing.");

    private static final Template BACKGROUND_TASKS = new Template(
        "background task threads",
        List.of(
            "Background work is not making progress",
            "One or more worker threads are blocked or deadlocked",
            "Threads are waiting on locks held by each other or on an unresponsive dependency",
            "Lock ordering or timeouts on blocking calls were not enforced"),
        "Capture a thread dump, identify the blocked threads and the locks they hold, "
            + "and restart the instance if the deadlock cannot be resolved.");

    private static final Map<String, Template> TEMPLATES = Map.ofEntries(
        Map.entry("postgres", DATABASE),
        Map.entry("database", DATABASE),
        Map.entry("db", DATABASE),
        Map.entry("redis", CACHE),
        Map.entry("cache", CACHE),
        Map.entry("websocket", REALTIME_TRANSPORT),
        Map.entry("clickhouse", ANALYTICS_STORE),
        Map.entry("auth_service", AUTH_SERVICE),
        Map.entry("system_resources", RESOURCES),
        Map.entry("background_tasks", BACKGROUND_TASKS)
    );

    private RootCauseAnalyzer() {
    }

    /**
     * Builds the causal chain for a failing component.
     *
     * @param componentName The component that failed.
     * @param errorMessage  The observed failure message, may be {@code null}.
     * @return Five causal steps followed by a remediation sentence.
     */
    public static List<String> fiveWhys(String componentName, String errorMessage) {
        String name = componentName == null ? "unknown" : componentName;
        String error = (errorMessage == null || errorMessage.isBlank()) ? "no error message" : errorMessage;
        Template template = TEMPLATES.get(name.toLowerCase(Locale.ROOT));

        List<String> chain = new ArrayList<>(6);
        if (template == null) {
            chain.add("1. Why is '" + name + "' failing? The health check reported: " + error);
            chain.add("2. Why did the check report that? The dependency behind '" + name + "' did not answer as expected");
            chain.add("3. Why did it not answer? It is unreachable, overloaded, or rejecting requests");
            chain.add("4. Why is it unreachable or overloaded? Its process, network path, or configuration changed");
            chain.add("5. Why was the change not caught? No earlier signal covered this dependency");
            chain.add("Investigate '" + name + "' logs and connectivity, verify its configuration, "
                + "and add monitoring for the failure mode once identified.");
            return List.copyOf(chain);
        }

        chain.add("1. Why is the " + template.dependency() + " ('" + name + "') failing? The health check reported: " + error);
        List<String> causes = template.causes();
        for (int i = 0; i < causes.size(); i++) {
            chain.add((i + 2) + ". " + causes.get(i));
        }
        chain.add(template.remediation());
        return List.copyOf(chain);
    }
}
