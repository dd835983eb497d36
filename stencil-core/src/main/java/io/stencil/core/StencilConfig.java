package io.stencil.core;

import io.stencil.core.pipeline.FailureScope;
import io.stencil.core.render.DefaultValueFormatter;
import io.stencil.core.render.RenderOptions;
import io.stencil.core.render.ValueFormatter;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Supplier;

/// Configuration options for a {@link StencilEngine}.
///
/// Controls the rendering policy, the size of the worker pool and the per-unit time limit.
/// Use the {@link Builder} for fluent configuration, the setters for mutable configuration,
/// or {@link #fromProperties(Properties)} to read a properties file.
///
/// ### Default Values
/// - `strict`: `false` (missing data is substituted and recorded)
/// - `failureScope`: {@link FailureScope#INVOCATION}
/// - `nullGetter`: empty string
/// - `concurrency`: `4`
/// - `unitTimeout`: none
/// - `valueFormatter`: {@link DefaultValueFormatter#INSTANCE}
///
/// ### Property keys
/// | key | type |
/// |-----|------|
/// | `stencil.strict` | `true` / `false` |
/// | `stencil.failure-scope` | `unit` / `invocation` |
/// | `stencil.concurrency` | positive integer |
/// | `stencil.unit-timeout` | ISO-8601 duration (`PT30S`) or milliseconds |
///
/// @implNote **Not thread-safe**. Configure before passing to {@link StencilFactory}; do not
/// modify after the engine is created.
///
/// @see StencilFactory#createEngine(StencilConfig)
public class StencilConfig {

    public static final String STRICT = "stencil.strict";
    public static final String FAILURE_SCOPE = "stencil.failure-scope";
    public static final String CONCURRENCY = "stencil.concurrency";
    public static final String UNIT_TIMEOUT = "stencil.unit-timeout";

    private boolean strict = false;
    private FailureScope failureScope = FailureScope.INVOCATION;
    private Supplier<String> nullGetter = () -> "";
    private int concurrency = 4;
    private Duration unitTimeout = null;
    private ValueFormatter valueFormatter = DefaultValueFormatter.INSTANCE;

    public StencilConfig() {}

    /// Reads a configuration from properties. Missing keys keep their defaults.
    ///
    /// @param properties source properties, not null
    /// @return a new configuration, never null
    /// @throws IllegalArgumentException if a present key has an invalid value
    public static StencilConfig fromProperties(Properties properties) {
        StencilConfig config = new StencilConfig();

        String strict = properties.getProperty(STRICT);
        if (strict != null) {
            String value = strict.trim().toLowerCase(Locale.ROOT);
            if (!value.equals("true") && !value.equals("false")) {
                throw invalid(STRICT, strict);
            }
            config.setStrict(Boolean.parseBoolean(value));
        }

        String scope = properties.getProperty(FAILURE_SCOPE);
        if (scope != null) {
            try {
                config.setFailureScope(
                        FailureScope.valueOf(scope.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw invalid(FAILURE_SCOPE, scope);
            }
        }

        String concurrency = properties.getProperty(CONCURRENCY);
        if (concurrency != null) {
            try {
                config.setConcurrency(Integer.parseInt(concurrency.trim()));
            } catch (IllegalArgumentException e) {
                throw invalid(CONCURRENCY, concurrency);
            }
        }

        String timeout = properties.getProperty(UNIT_TIMEOUT);
        if (timeout != null) {
            try {
                config.setUnitTimeout(parseDuration(timeout.trim()));
            } catch (IllegalArgumentException e) {
                throw invalid(UNIT_TIMEOUT, timeout);
            }
        }

        return config;
    }

    private static Duration parseDuration(String value) {
        try {
            if (value.chars().allMatch(Character::isDigit) && !value.isEmpty()) {
                return Duration.ofMillis(Long.parseLong(value));
            }
            return Duration.parse(value);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw invalid(UNIT_TIMEOUT, value);
        }
    }

    private static IllegalArgumentException invalid(String key, String value) {
        return new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'");
    }

    /// Returns whether missing data and module failures are fatal.
    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }

    public FailureScope getFailureScope() {
        return failureScope;
    }

    /// Sets how far a strict-mode failure reaches.
    ///
    /// @param failureScope the scope, not null
    public void setFailureScope(FailureScope failureScope) {
        this.failureScope = Objects.requireNonNull(failureScope, "failureScope must not be null");
    }

    public Supplier<String> getNullGetter() {
        return nullGetter;
    }

    /// Sets the supplier of the text used for missing and null values in lenient mode.
    ///
    /// @param nullGetter the supplier, not null
    public void setNullGetter(Supplier<String> nullGetter) {
        this.nullGetter = Objects.requireNonNull(nullGetter, "nullGetter must not be null");
    }

    public int getConcurrency() {
        return concurrency;
    }

    /// Sets how many content units render at the same time.
    ///
    /// @param concurrency worker count, must be positive
    /// @throws IllegalArgumentException if not positive
    public void setConcurrency(int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
        }
        this.concurrency = concurrency;
    }

    /// Returns the per-unit time limit.
    ///
    /// @return the limit, or null when units may run indefinitely
    public Duration getUnitTimeout() {
        return unitTimeout;
    }

    /// Sets the per-unit time limit.
    ///
    /// @param unitTimeout positive duration, or null for none
    /// @throws IllegalArgumentException if zero or negative
    public void setUnitTimeout(Duration unitTimeout) {
        if (unitTimeout != null && (unitTimeout.isZero() || unitTimeout.isNegative())) {
            throw new IllegalArgumentException("unitTimeout must be positive: " + unitTimeout);
        }
        this.unitTimeout = unitTimeout;
    }

    public ValueFormatter getValueFormatter() {
        return valueFormatter;
    }

    /// Sets the formatter for resolved values.
    ///
    /// @param valueFormatter the formatter, not null
    public void setValueFormatter(ValueFormatter valueFormatter) {
        this.valueFormatter =
                Objects.requireNonNull(valueFormatter, "valueFormatter must not be null");
    }

    /// Returns the renderer policy described by this configuration.
    ///
    /// @return render options, never null
    public RenderOptions toRenderOptions() {
        return new RenderOptions(strict, nullGetter, valueFormatter);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link StencilConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final StencilConfig config = new StencilConfig();

        public Builder strict(boolean strict) {
            config.setStrict(strict);
            return this;
        }

        public Builder failureScope(FailureScope failureScope) {
            config.setFailureScope(failureScope);
            return this;
        }

        public Builder nullGetter(Supplier<String> nullGetter) {
            config.setNullGetter(nullGetter);
            return this;
        }

        public Builder concurrency(int concurrency) {
            config.setConcurrency(concurrency);
            return this;
        }

        public Builder unitTimeout(Duration unitTimeout) {
            config.setUnitTimeout(unitTimeout);
            return this;
        }

        public Builder valueFormatter(ValueFormatter valueFormatter) {
            config.setValueFormatter(valueFormatter);
            return this;
        }

        public StencilConfig build() {
            return config;
        }
    }
}
