package com.schemaflow.checker.config;

import java.util.Map;
import java.util.Objects;

/**
 * Checker and composer settings, built directly or loaded from environment variables.
 * <p>
 * SCHEMAFLOW_PRODUCED_KEY_POLICY: OVERWRITE (default) or FLAG_CONFLICT.
 * SCHEMAFLOW_REPORT_UNEXPECTED_PARAMETERS: report fit parameters the contract does not declare (default true).
 * SCHEMAFLOW_FAIL_FAST: throw on the first violation instead of collecting (default false).
 * SCHEMAFLOW_STAGE_FAIL_ON_VIOLATION: checked stages refuse to run on violations instead of logging them (default false).
 */
public final class SchemaFlowConfig {

    private static final String ENV_PRODUCED_KEY_POLICY = "SCHEMAFLOW_PRODUCED_KEY_POLICY";
    private static final String ENV_REPORT_UNEXPECTED_PARAMETERS = "SCHEMAFLOW_REPORT_UNEXPECTED_PARAMETERS";
    private static final String ENV_FAIL_FAST = "SCHEMAFLOW_FAIL_FAST";
    private static final String ENV_STAGE_FAIL_ON_VIOLATION = "SCHEMAFLOW_STAGE_FAIL_ON_VIOLATION";

    private static final ProducedKeyPolicy DEFAULT_PRODUCED_KEY_POLICY = ProducedKeyPolicy.OVERWRITE;
    private static final boolean DEFAULT_REPORT_UNEXPECTED_PARAMETERS = true;
    private static final boolean DEFAULT_FAIL_FAST = false;
    private static final boolean DEFAULT_STAGE_FAIL_ON_VIOLATION = false;

    private static final SchemaFlowConfig DEFAULTS = builder().build();

    private final ProducedKeyPolicy producedKeyPolicy;
    private final boolean reportUnexpectedParameters;
    private final boolean failFast;
    private final boolean stageFailOnViolation;

    private SchemaFlowConfig(Builder b) {
        this.producedKeyPolicy = b.producedKeyPolicy != null ? b.producedKeyPolicy : DEFAULT_PRODUCED_KEY_POLICY;
        this.reportUnexpectedParameters = b.reportUnexpectedParameters;
        this.failFast = b.failFast;
        this.stageFailOnViolation = b.stageFailOnViolation;
    }

    public static SchemaFlowConfig defaults() {
        return DEFAULTS;
    }

    public static SchemaFlowConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Reads the SCHEMAFLOW_* variables from {@code env}; missing or unparsable values fall back to defaults. */
    public static SchemaFlowConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .producedKeyPolicy(ProducedKeyPolicy.fromName(env.get(ENV_PRODUCED_KEY_POLICY), DEFAULT_PRODUCED_KEY_POLICY))
                .reportUnexpectedParameters(parseBoolean(env.get(ENV_REPORT_UNEXPECTED_PARAMETERS), DEFAULT_REPORT_UNEXPECTED_PARAMETERS))
                .failFast(parseBoolean(env.get(ENV_FAIL_FAST), DEFAULT_FAIL_FAST))
                .stageFailOnViolation(parseBoolean(env.get(ENV_STAGE_FAIL_ON_VIOLATION), DEFAULT_STAGE_FAIL_ON_VIOLATION))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ProducedKeyPolicy getProducedKeyPolicy() {
        return producedKeyPolicy;
    }

    public boolean isReportUnexpectedParameters() {
        return reportUnexpectedParameters;
    }

    /** When true the checker throws {@link com.schemaflow.checker.SchemaFlowException} at the first violation. */
    public boolean isFailFast() {
        return failFast;
    }

    public boolean isStageFailOnViolation() {
        return stageFailOnViolation;
    }

    public Builder toBuilder() {
        return builder()
                .producedKeyPolicy(producedKeyPolicy)
                .reportUnexpectedParameters(reportUnexpectedParameters)
                .failFast(failFast)
                .stageFailOnViolation(stageFailOnViolation);
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String v = value.trim();
        if ("true".equalsIgnoreCase(v) || "1".equals(v)) return true;
        if ("false".equalsIgnoreCase(v) || "0".equals(v)) return false;
        return defaultValue;
    }

    public static final class Builder {
        private ProducedKeyPolicy producedKeyPolicy = DEFAULT_PRODUCED_KEY_POLICY;
        private boolean reportUnexpectedParameters = DEFAULT_REPORT_UNEXPECTED_PARAMETERS;
        private boolean failFast = DEFAULT_FAIL_FAST;
        private boolean stageFailOnViolation = DEFAULT_STAGE_FAIL_ON_VIOLATION;

        private Builder() {
        }

        public Builder producedKeyPolicy(ProducedKeyPolicy producedKeyPolicy) {
            this.producedKeyPolicy = producedKeyPolicy;
            return this;
        }

        public Builder reportUnexpectedParameters(boolean reportUnexpectedParameters) {
            this.reportUnexpectedParameters = reportUnexpectedParameters;
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public Builder stageFailOnViolation(boolean stageFailOnViolation) {
            this.stageFailOnViolation = stageFailOnViolation;
            return this;
        }

        public SchemaFlowConfig build() {
            return new SchemaFlowConfig(this);
        }
    }
}
