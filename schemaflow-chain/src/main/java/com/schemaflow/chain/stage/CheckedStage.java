package com.schemaflow.chain.stage;

import com.schemaflow.checker.SchemaFlowException;
import com.schemaflow.checker.StageChecker;
import com.schemaflow.checker.Violation;
import com.schemaflow.checker.config.SchemaFlowConfig;
import com.schemaflow.contract.StageContract;
import com.schemaflow.types.TypeInference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs a {@link Stage} with its contract checked on the way in. Violations are logged at ERROR; when
 * {@link SchemaFlowConfig#isStageFailOnViolation()} is set the stage is not run and a {@link SchemaFlowException}
 * is thrown instead. Tracks whether the stage has been fit so transform can report NOT_FITTED.
 */
public final class CheckedStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(CheckedStage.class);

    private final String name;
    private final Stage delegate;
    private final SchemaFlowConfig config;
    private final StageChecker checker;
    private volatile boolean fitted;

    public CheckedStage(String name, Stage delegate) {
        this(name, delegate, SchemaFlowConfig.defaults());
    }

    public CheckedStage(String name, Stage delegate, SchemaFlowConfig config) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Stage name must not be blank");
        }
        this.name = name;
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.config = Objects.requireNonNull(config, "config");
        this.checker = new StageChecker(config);
    }

    public String getName() {
        return name;
    }

    public Stage getDelegate() {
        return delegate;
    }

    public boolean isFitted() {
        return fitted;
    }

    @Override
    public StageContract contract() {
        return delegate.contract();
    }

    @Override
    public void fit(Map<String, Object> data, Map<String, ?> parameters) {
        Map<String, ?> params = parameters != null ? parameters : Collections.emptyMap();
        List<Violation> violations = checker.checkFit(name, contract(), data, params);
        handle("fit", violations);
        if (log.isDebugEnabled()) {
            log.debug("Stage {} fit input schema: {}", name, describe(data));
        }
        delegate.fit(data, params);
        fitted = true;
        log.info("Stage {} fitted", name);
    }

    @Override
    public Map<String, Object> transform(Map<String, Object> data) {
        List<Violation> violations = checker.checkTransform(name, contract(), data, fitted);
        handle("transform", violations);
        if (log.isDebugEnabled()) {
            log.debug("Stage {} transform input schema: {}", name, describe(data));
        }
        Map<String, Object> result = delegate.transform(data);
        if (result == null) {
            throw new IllegalStateException("Stage " + name + " returned no payload from transform");
        }
        if (log.isInfoEnabled()) {
            log.info("Stage {} transformed; output schema: {}", name, describe(result));
        }
        return result;
    }

    private void handle(String phase, List<Violation> violations) {
        if (violations.isEmpty()) {
            return;
        }
        for (Violation v : violations) {
            log.error("Stage {} {} violation: {}", name, phase, v);
        }
        if (config.isStageFailOnViolation()) {
            throw new SchemaFlowException(violations);
        }
    }

    private static String describe(Map<String, ?> data) {
        return data.entrySet().stream()
                .map(e -> e.getKey() + ": " + TypeInference.infer(e.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public String toString() {
        return "CheckedStage{" + name + ", fitted=" + fitted + "}";
    }
}
