package com.schemaflow.checker;

import com.schemaflow.checker.config.SchemaFlowConfig;
import com.schemaflow.contract.StageContract;
import com.schemaflow.types.Compatibility;
import com.schemaflow.types.Schema;
import com.schemaflow.types.TableType;
import com.schemaflow.types.TypeInference;
import com.schemaflow.types.TypeSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks one stage contract against a payload (data-backed) or against an upstream-declared schema (static).
 * <p>
 * Payload maps may hold concrete values, whose runtime types are observed through {@link TypeInference}, or
 * {@link TypeSpec} values, which are taken as already-declared types. Every check returns the complete list of
 * violations in a deterministic order unless the configuration asks for fail-fast, in which case the first
 * violation is thrown as a {@link SchemaFlowException}.
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public final class StageChecker {

    private static final Logger log = LoggerFactory.getLogger(StageChecker.class);

    private final SchemaFlowConfig config;

    public StageChecker() {
        this(SchemaFlowConfig.defaults());
    }

    public StageChecker(SchemaFlowConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public SchemaFlowConfig getConfig() {
        return config;
    }

    /** Fit check of a stand-alone stage. */
    public List<Violation> checkFit(StageContract contract, Map<String, ?> data, Map<String, ?> parameters) {
        return checkFit(null, contract, data, parameters);
    }

    /**
     * Checks {@code data} against {@code fitRequires}, then {@code parameters} against {@code fitParameters}.
     * Parameters not declared by the contract are reported as UNEXPECTED_PARAMETER unless disabled in configuration.
     *
     * @param stage      stage name used in violation locations; null for a stand-alone stage
     * @param parameters supplied fit parameters; null is treated as empty
     */
    public List<Violation> checkFit(String stage, StageContract contract, Map<String, ?> data, Map<String, ?> parameters) {
        Objects.requireNonNull(contract, "contract");
        Objects.requireNonNull(data, "data");
        Map<String, ?> params = parameters != null ? parameters : Collections.emptyMap();

        Collector collector = new Collector();
        checkRequirements(stage, Phase.FIT, contract.getFitRequires(), data, collector);
        checkParameters(stage, contract.getFitParameters(), params, collector);
        log.debug("Fit check of stage {}: {} requirement(s), {} parameter(s), {} violation(s)",
                stageLabel(stage), contract.getFitRequires().size(), params.size(), collector.size());
        return collector.result();
    }

    /** Transform check of a stand-alone stage. */
    public List<Violation> checkTransform(StageContract contract, Map<String, ?> data, boolean hasBeenFit) {
        return checkTransform(null, contract, data, hasBeenFit);
    }

    /**
     * Checks {@code data} against {@code transformRequires}. A stateful contract (non-empty {@code fittedState})
     * that has not been fit yields one NOT_FITTED violation ahead of the data violations.
     */
    public List<Violation> checkTransform(String stage, StageContract contract, Map<String, ?> data, boolean hasBeenFit) {
        Objects.requireNonNull(contract, "contract");
        Objects.requireNonNull(data, "data");

        Collector collector = new Collector();
        if (!hasBeenFit && contract.isStateful()) {
            collector.add(new Violation(new Location(stage, null), ViolationKind.NOT_FITTED, null, null,
                    "Stage " + stageLabel(stage) + " holds fitted state " + contract.getFittedState().keys()
                            + " and must be fit before transform"));
        }
        checkRequirements(stage, Phase.TRANSFORM, contract.getTransformRequires(), data, collector);
        log.debug("Transform check of stage {}: {} requirement(s), fitted={}, {} violation(s)",
                stageLabel(stage), contract.getTransformRequires().size(), hasBeenFit, collector.size());
        return collector.result();
    }

    /** Static check of a stand-alone stage. */
    public List<Violation> checkContractStatic(StageContract contract, Schema incoming, Phase phase) {
        return checkContractStatic(null, contract, incoming, phase);
    }

    /**
     * Data-free check: compares the declared {@code incoming} schema against the requirement slot of {@code phase}
     * ({@code fitRequires} or {@code transformRequires}). Parameters and fitted state are not involved.
     */
    public List<Violation> checkContractStatic(String stage, StageContract contract, Schema incoming, Phase phase) {
        Objects.requireNonNull(contract, "contract");
        Objects.requireNonNull(incoming, "incoming");
        Objects.requireNonNull(phase, "phase");

        Schema required = phase == Phase.FIT ? contract.getFitRequires() : contract.getTransformRequires();
        Collector collector = new Collector();
        checkRequirements(stage, phase, required, incoming.asMap(), collector);
        log.debug("Static {} check of stage {} against {} incoming key(s): {} violation(s)",
                phase.label(), stageLabel(stage), incoming.size(), collector.size());
        return collector.result();
    }

    private void checkRequirements(String stage, Phase phase, Schema required, Map<String, ?> data, Collector collector) {
        for (Map.Entry<String, TypeSpec> e : required.asMap().entrySet()) {
            String key = e.getKey();
            TypeSpec declared = e.getValue();
            if (!data.containsKey(key)) {
                collector.add(new Violation(new Location(stage, key), ViolationKind.MISSING_KEY, declared, null,
                        "Key '" + key + "' required for " + phase.label() + " is missing"));
                continue;
            }
            TypeSpec observed = TypeInference.observe(declared, data.get(key));
            compare(stage, key, declared, observed, collector);
        }
    }

    private void checkParameters(String stage, Schema declaredParameters, Map<String, ?> parameters, Collector collector) {
        for (Map.Entry<String, TypeSpec> e : declaredParameters.asMap().entrySet()) {
            String name = e.getKey();
            TypeSpec declared = e.getValue();
            if (!parameters.containsKey(name)) {
                collector.add(new Violation(new Location(stage, name), ViolationKind.MISSING_KEY, declared, null,
                        "Fit parameter '" + name + "' is missing"));
                continue;
            }
            compare(stage, name, declared, TypeInference.observe(declared, parameters.get(name)), collector);
        }
        if (!config.isReportUnexpectedParameters()) {
            return;
        }
        for (Map.Entry<String, ?> e : parameters.entrySet()) {
            if (!declaredParameters.contains(e.getKey())) {
                collector.add(new Violation(new Location(stage, e.getKey()), ViolationKind.UNEXPECTED_PARAMETER,
                        null, TypeInference.infer(e.getValue()),
                        "Fit parameter '" + e.getKey() + "' is not declared by the stage"));
            }
        }
    }

    // Tables are compared column by column so each broken column gets its own violation.
    private void compare(String stage, String key, TypeSpec declared, TypeSpec observed, Collector collector) {
        if (declared instanceof TableType && observed instanceof TableType) {
            Schema observedColumns = ((TableType) observed).getColumns();
            for (Map.Entry<String, TypeSpec> column : ((TableType) declared).getColumns().asMap().entrySet()) {
                String path = key + "." + column.getKey();
                Optional<TypeSpec> actual = observedColumns.get(column.getKey());
                if (actual.isEmpty()) {
                    collector.add(new Violation(new Location(stage, path), ViolationKind.MISSING_KEY,
                            column.getValue(), null, "Column '" + path + "' is missing"));
                } else {
                    compare(stage, path, column.getValue(), actual.get(), collector);
                }
            }
            return;
        }
        switch (Compatibility.mismatch(declared, observed)) {
            case NONE:
                return;
            case SHAPE:
                collector.add(new Violation(new Location(stage, key), ViolationKind.SHAPE_MISMATCH, declared, observed,
                        "Key '" + key + "' expected shape " + declared + " but observed " + observed));
                return;
            default:
                collector.add(new Violation(new Location(stage, key), ViolationKind.TYPE_MISMATCH, declared, observed,
                        "Key '" + key + "' expected " + declared + " but observed " + observed));
        }
    }

    private static String stageLabel(String stage) {
        return stage != null ? stage : "<stand-alone>";
    }

    private final class Collector {
        private final List<Violation> violations = new ArrayList<>();

        void add(Violation violation) {
            if (config.isFailFast()) {
                throw new SchemaFlowException(List.of(violation));
            }
            violations.add(violation);
        }

        int size() {
            return violations.size();
        }

        List<Violation> result() {
            return List.copyOf(violations);
        }
    }
}
