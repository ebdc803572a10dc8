package com.overflowgrid.config;

import com.overflowgrid.simulation.TraversalOrder;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Optional;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class AppProperties {

    static final int DEFAULT_MAX_ROUNDS = 100_000;
    static final int DEFAULT_MAX_CELLS = 1_000_000;

    private final String bindHost;
    private final int bindPort;
    private final int maxRounds;
    private final int maxCells;
    private final TraversalOrder defaultTraversal;
    private final Integer progressLogPercentStep;

    public AppProperties(Environment environment) {
        BindAddress address = determineBindAddress(environment);
        this.bindHost = address.host();
        this.bindPort = address.port();

        this.maxRounds = resolvePositiveInt(environment, "app.max-rounds", "APP_MAX_ROUNDS", DEFAULT_MAX_ROUNDS);
        this.maxCells = resolvePositiveInt(environment, "app.max-cells", "APP_MAX_CELLS", DEFAULT_MAX_CELLS);
        this.defaultTraversal = resolveTraversal(environment);
        this.progressLogPercentStep = resolvePercentStep(environment);
    }

    public String getBindHost() {
        return bindHost;
    }

    public int getBindPort() {
        return bindPort;
    }

    public InetAddress getBindAddress() {
        try {
            return InetAddress.getByName(bindHost);
        } catch (UnknownHostException ex) {
            throw new IllegalStateException("Failed to resolve bind host: " + bindHost, ex);
        }
    }

    public int getMaxRounds() {
        return maxRounds;
    }

    public int getMaxCells() {
        return maxCells;
    }

    public TraversalOrder getDefaultTraversal() {
        return defaultTraversal;
    }

    public Optional<Integer> getProgressLogPercentStep() {
        return Optional.ofNullable(progressLogPercentStep);
    }

    private String resolveOptional(Environment environment, String propertyKey, String envKey) {
        String value = environment.getProperty(propertyKey);
        if (StringUtils.hasText(value)) {
            return value.trim();
        }
        value = environment.getProperty(envKey);
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private int resolvePositiveInt(Environment environment, String propertyKey, String envKey, int defaultValue) {
        String raw = resolveOptional(environment, propertyKey, envKey);
        if (raw == null) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw);
            if (value <= 0) {
                throw new IllegalArgumentException();
            }
            return value;
        } catch (Exception ex) {
            throw new IllegalStateException(envKey + " must be a positive integer but was '" + raw + "'", ex);
        }
    }

    private TraversalOrder resolveTraversal(Environment environment) {
        String raw = resolveOptional(environment, "app.default-traversal", "APP_DEFAULT_TRAVERSAL");
        if (raw == null) {
            return TraversalOrder.ROW_MAJOR;
        }
        try {
            return TraversalOrder.valueOf(raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Unsupported traversal order: " + raw, ex);
        }
    }

    private Integer resolvePercentStep(Environment environment) {
        String raw = resolveOptional(environment, "app.progress-log-percent-step", "APP_PROGRESS_LOG_PERCENT_STEP");
        if (raw == null) {
            return null;
        }
        int value = resolvePositiveInt(environment,
                "app.progress-log-percent-step", "APP_PROGRESS_LOG_PERCENT_STEP", 0);
        if (value > 100) {
            throw new IllegalStateException("APP_PROGRESS_LOG_PERCENT_STEP must be between 1 and 100");
        }
        return value;
    }

    private BindAddress determineBindAddress(Environment environment) {
        String bindRaw = resolveOptional(environment, "app.bind-address", "APP_BIND_ADDR");
        String defaultHost = "0.0.0.0";
        int defaultPort = 8080;

        if (StringUtils.hasText(bindRaw)) {
            String[] parts = bindRaw.split(":", 2);
            if (parts.length != 2 || !StringUtils.hasText(parts[0]) || !StringUtils.hasText(parts[1])) {
                throw new IllegalStateException("APP_BIND_ADDR must follow host:port format");
            }
            int port = parsePort(parts[1]);
            return new BindAddress(parts[0].trim(), port);
        }

        String portValue = resolveOptional(environment, "server.port", "PORT");
        if (StringUtils.hasText(portValue)) {
            int port = parsePort(portValue);
            return new BindAddress(defaultHost, port);
        }

        return new BindAddress(defaultHost, defaultPort);
    }

    private int parsePort(String value) {
        try {
            int port = Integer.parseInt(value.trim());
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException();
            }
            return port;
        } catch (Exception ex) {
            throw new IllegalStateException("Invalid port value: " + value, ex);
        }
    }

    private record BindAddress(String host, int port) {}
}
