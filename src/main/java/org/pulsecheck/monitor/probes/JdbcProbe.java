package org.pulsecheck.monitor.probes;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.pulsecheck.monitor.api.probes.AbstractProbe;
import org.pulsecheck.monitor.api.probes.ProbeOutcome;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Checks a relational database by opening a connection and validating it.
 * <p>
 * <strong>Options:</strong>
 * <ul>
 *   <li>{@code url} (required when no {@link DataSource} is given): JDBC URL</li>
 *   <li>{@code user}, {@code password}: credentials, empty by default</li>
 *   <li>{@code validation-timeout}: seconds passed to {@link Connection#isValid(int)}, default 5</li>
 *   <li>{@code login-timeout}: passed to the driver as the {@code loginTimeout} connection property
 *       (whole seconds), default 5s, {@code 0s} to leave it to the driver</li>
 *   <li>{@code properties}: extra driver connection properties, e.g. MySQL's {@code connectTimeout};
 *       these win over the keys above</li>
 * </ul>
 * The runner interrupts a probe that overruns its timeout, but {@link DriverManager} does not react
 * to interruption. The login timeout keeps a hung connect from holding a worker thread indefinitely.
 */
public class JdbcProbe extends AbstractProbe {

    private final DataSource dataSource;

    public JdbcProbe(String name, Config options) {
        super(name, options);
        this.dataSource = null;
        if (!this.options.hasPath("url") || this.options.getString("url").isBlank()) {
            throw new IllegalArgumentException("JdbcProbe '" + name + "' requires option 'url'");
        }
    }

    /**
     * Creates a probe that borrows connections from an existing pool.
     */
    public JdbcProbe(String name, DataSource dataSource) {
        super(name, ConfigFactory.empty());
        if (dataSource == null) {
            throw new IllegalArgumentException("DataSource for JdbcProbe '" + name + "' must not be null");
        }
        this.dataSource = dataSource;
    }

    @Override
    protected Map<String, Object> defaults() {
        return Map.of("user", "", "password", "", "validation-timeout", 5, "login-timeout", "5s");
    }

    @Override
    public ProbeOutcome probe() throws SQLException {
        try (Connection connection = openConnection()) {
            if (!connection.isValid(options.getInt("validation-timeout"))) {
                return ProbeOutcome.failure("connection is not valid");
            }
            DatabaseMetaData meta = connection.getMetaData();
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("database", meta.getDatabaseProductName());
            detail.put("version", meta.getDatabaseProductVersion());
            return ProbeOutcome.healthy(detail);
        }
    }

    private Connection openConnection() throws SQLException {
        if (dataSource != null) {
            return dataSource.getConnection();
        }
        return DriverManager.getConnection(options.getString("url"), connectionProperties());
    }

    Properties connectionProperties() {
        Properties properties = new Properties();
        properties.setProperty("user", options.getString("user"));
        properties.setProperty("password", options.getString("password"));
        Duration loginTimeout = options.getDuration("login-timeout");
        if (!loginTimeout.isZero() && !loginTimeout.isNegative()) {
            long seconds = Math.max(1, (loginTimeout.toMillis() + 999) / 1000);
            properties.setProperty("loginTimeout", Long.toString(seconds));
        }
        if (options.hasPath("properties")) {
            for (Map.Entry<String, ConfigValue> entry : options.getConfig("properties").root().entrySet()) {
                properties.setProperty(entry.getKey(), String.valueOf(entry.getValue().unwrapped()));
            }
        }
        return properties;
    }
}
