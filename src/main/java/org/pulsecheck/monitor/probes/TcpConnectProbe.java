package org.pulsecheck.monitor.probes;

import com.typesafe.config.Config;
import org.pulsecheck.monitor.api.probes.AbstractProbe;
import org.pulsecheck.monitor.api.probes.ProbeOutcome;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Checks that a TCP endpoint accepts connections. Suitable for caches, brokers and
 * any service without a richer health protocol.
 * <p>
 * <strong>Options:</strong> {@code host} (default localhost), {@code port} (required),
 * {@code connect-timeout} (default 3s).
 */
public class TcpConnectProbe extends AbstractProbe {

    private final String host;
    private final int port;
    private final int connectTimeoutMs;

    public TcpConnectProbe(String name, Config options) {
        super(name, options);
        if (!this.options.hasPath("port")) {
            throw new IllegalArgumentException("TcpConnectProbe '" + name + "' requires option 'port'");
        }
        this.host = this.options.getString("host");
        this.port = this.options.getInt("port");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port out of range for TcpConnectProbe '" + name + "': " + port);
        }
        this.connectTimeoutMs = (int) this.options.getDuration("connect-timeout", TimeUnit.MILLISECONDS);
    }

    @Override
    protected Map<String, Object> defaults() {
        return Map.of("host", "localhost", "connect-timeout", "3s");
    }

    @Override
    public ProbeOutcome probe() throws IOException {
        long start = System.nanoTime();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), connectTimeoutMs);
        }
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("endpoint", host + ":" + port);
        detail.put("connect_ms", (System.nanoTime() - start) / 1_000_000);
        return ProbeOutcome.healthy(detail);
    }
}
