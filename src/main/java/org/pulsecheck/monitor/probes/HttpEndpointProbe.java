package org.pulsecheck.monitor.probes;

import com.typesafe.config.Config;
import org.pulsecheck.monitor.api.probes.AbstractProbe;
import org.pulsecheck.monitor.api.probes.ProbeOutcome;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checks an HTTP health endpoint with a GET request. Any 2xx or 3xx status counts as healthy;
 * a response slower than {@code slow-threshold} is reported as degraded.
 * <p>
 * <strong>Options:</strong> {@code url} (required), {@code request-timeout} (default 5s),
 * {@code slow-threshold} (default 2s).
 */
public class HttpEndpointProbe extends AbstractProbe {

    private final URI uri;
    private final Duration requestTimeout;
    private final Duration slowThreshold;
    private final HttpClient client;

    public HttpEndpointProbe(String name, Config options) {
        super(name, options);
        if (!this.options.hasPath("url")) {
            throw new IllegalArgumentException("HttpEndpointProbe '" + name + "' requires option 'url'");
        }
        this.uri = URI.create(this.options.getString("url"));
        this.requestTimeout = this.options.getDuration("request-timeout");
        this.slowThreshold = this.options.getDuration("slow-threshold");
        this.client = HttpClient.newBuilder()
            .connectTimeout(requestTimeout)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
    }

    @Override
    protected Map<String, Object> defaults() {
        return Map.of("request-timeout", "5s", "slow-threshold", "2s");
    }

    @Override
    public ProbeOutcome probe() throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(requestTimeout)
            .GET()
            .build();
        long start = System.nanoTime();
        HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("url", uri.toString());
        detail.put("status_code", response.statusCode());
        detail.put("response_ms", elapsedMs);

        int status = response.statusCode();
        if (status < 200 || status >= 400) {
            return ProbeOutcome.failure("HTTP " + status + " from " + uri, detail);
        }
        if (elapsedMs > slowThreshold.toMillis()) {
            return ProbeOutcome.degraded(detail);
        }
        return ProbeOutcome.healthy(detail);
    }
}
