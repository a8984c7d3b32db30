package io.flowc.core;

import java.util.Properties;

/// Configuration options for the workflow compiler.
///
/// Controls the defaults applied to agents that do not set them, how validation warnings are
/// treated, and whether build-time substitution runs. Use the {@link Builder} for fluent
/// configuration, {@link #fromProperties(Properties)} for file-based configuration, or the
/// setters for mutable configuration.
///
/// ### Default Values
/// - `defaultModel`: `"gemini-2.5-flash"`
/// - `defaultTemperature`: `0.7`
/// - `defaultMaxIterations`: `5` (loop constructs)
/// - `failOnWarnings`: `false`
/// - `substituteGlobals`: `true`
///
/// ### Property Keys
/// ```
/// flowc.default-model           string
/// flowc.default-temperature     decimal
/// flowc.default-max-iterations  positive integer
/// flowc.fail-on-warnings        true | false
/// flowc.substitute-globals      true | false
/// ```
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended to be
/// configured before passing to {@link WorkflowCompiler}. Do not modify after the compiler is
/// built.
///
/// @see WorkflowCompiler.Builder#config(FlowcConfig)
public class FlowcConfig {

    static final String PREFIX = "flowc.";

    private String defaultModel = "gemini-2.5-flash";
    private double defaultTemperature = 0.7;
    private int defaultMaxIterations = 5;
    private boolean failOnWarnings = false;
    private boolean substituteGlobals = true;

    /// Creates a configuration with default values.
    public FlowcConfig() {}

    /// Returns the model assigned to agents that do not name one.
    ///
    /// @return model identifier, never null
    public String getDefaultModel() {
        return defaultModel;
    }

    /// Sets the model assigned to agents that do not name one.
    ///
    /// @param defaultModel model identifier, not null
    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    /// @return temperature assigned to agents that do not set one
    public double getDefaultTemperature() {
        return defaultTemperature;
    }

    /// @param defaultTemperature temperature for agents that do not set one
    public void setDefaultTemperature(double defaultTemperature) {
        this.defaultTemperature = defaultTemperature;
    }

    /// @return iteration bound of loop markers that do not set `max_iterations`
    public int getDefaultMaxIterations() {
        return defaultMaxIterations;
    }

    /// Sets the iteration bound of loop markers that do not set `max_iterations`.
    ///
    /// ### Contracts
    /// - **Precondition**: `defaultMaxIterations` should be positive
    ///
    /// @param defaultMaxIterations positive iteration bound
    public void setDefaultMaxIterations(int defaultMaxIterations) {
        this.defaultMaxIterations = defaultMaxIterations;
    }

    /// Returns whether validation warnings fail the compile.
    ///
    /// @return `true` if warnings are promoted to errors
    public boolean isFailOnWarnings() {
        return failOnWarnings;
    }

    /// @param failOnWarnings `true` to promote validation warnings to errors
    public void setFailOnWarnings(boolean failOnWarnings) {
        this.failOnWarnings = failOnWarnings;
    }

    /// Returns whether global variables are substituted into the compiled IR.
    ///
    /// @return `true` if the substitution pass runs
    public boolean isSubstituteGlobals() {
        return substituteGlobals;
    }

    /// @param substituteGlobals `false` to keep every placeholder for the runtime
    public void setSubstituteGlobals(boolean substituteGlobals) {
        this.substituteGlobals = substituteGlobals;
    }

    /// Creates a configuration from `flowc.*` properties.
    ///
    /// Absent keys keep their default. Blank values are treated as absent.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a numeric property cannot be parsed or is out of range
    public static FlowcConfig fromProperties(Properties properties) {
        FlowcConfig config = new FlowcConfig();
        String model = value(properties, "default-model");
        if (model != null) {
            config.defaultModel = model;
        }
        String temperature = value(properties, "default-temperature");
        if (temperature != null) {
            config.defaultTemperature = parseDouble("default-temperature", temperature);
        }
        String maxIterations = value(properties, "default-max-iterations");
        if (maxIterations != null) {
            int parsed = parseInt("default-max-iterations", maxIterations);
            if (parsed < 1) {
                throw new IllegalArgumentException(
                        PREFIX + "default-max-iterations must be positive: " + parsed);
            }
            config.defaultMaxIterations = parsed;
        }
        String failOnWarnings = value(properties, "fail-on-warnings");
        if (failOnWarnings != null) {
            config.failOnWarnings = Boolean.parseBoolean(failOnWarnings);
        }
        String substitute = value(properties, "substitute-globals");
        if (substitute != null) {
            config.substituteGlobals = Boolean.parseBoolean(substitute);
        }
        return config;
    }

    private static String value(Properties properties, String key) {
        String raw = properties.getProperty(PREFIX + key);
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    private static double parseDouble(String key, String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not a number: " + raw, e);
        }
    }

    private static int parseInt(String key, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PREFIX + key + " is not an integer: " + raw, e);
        }
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link FlowcConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final FlowcConfig config = new FlowcConfig();

        public Builder defaultModel(String defaultModel) {
            config.defaultModel = defaultModel;
            return this;
        }

        public Builder defaultTemperature(double defaultTemperature) {
            config.defaultTemperature = defaultTemperature;
            return this;
        }

        public Builder defaultMaxIterations(int defaultMaxIterations) {
            config.defaultMaxIterations = defaultMaxIterations;
            return this;
        }

        public Builder failOnWarnings(boolean failOnWarnings) {
            config.failOnWarnings = failOnWarnings;
            return this;
        }

        public Builder substituteGlobals(boolean substituteGlobals) {
            config.substituteGlobals = substituteGlobals;
            return this;
        }

        /// Builds and returns the configured {@link FlowcConfig} instance.
        ///
        /// @return the configured instance, never null
        public FlowcConfig build() {
            return config;
        }
    }
}
