package com.schemaflow.chain;

import com.schemaflow.checker.StageChecker;
import com.schemaflow.checker.Violation;
import com.schemaflow.checker.ViolationKind;
import com.schemaflow.checker.config.SchemaFlowConfig;
import com.schemaflow.contract.ChainDefinition;
import com.schemaflow.contract.ChainLink;
import com.schemaflow.contract.SchemaOperation;
import com.schemaflow.contract.StageContract;
import com.schemaflow.types.Compatibility;
import com.schemaflow.types.Schema;
import com.schemaflow.types.TypeSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, named stage contracts checked for end-to-end consistency before any stage runs.
 * <p>
 * Checks never throw on inconsistency (unless fail-fast is configured); an empty violation list is the only
 * "chain is consistent" signal. A chain is immutable and may be checked from several threads at once: all
 * per-check state lives in a {@link ChainCheckRun}.
 */
public final class Chain {

    private static final String DEFAULT_NAME = "chain";

    private final ChainDefinition definition;
    private final SchemaFlowConfig config;
    private final StageChecker checker;

    /**
     * @throws com.schemaflow.types.MalformedContractException when {@code links} is empty or names repeat
     */
    public Chain(List<ChainLink> links) {
        this(new ChainDefinition(null, null, links), SchemaFlowConfig.defaults());
    }

    public Chain(List<ChainLink> links, SchemaFlowConfig config) {
        this(new ChainDefinition(null, null, links), config);
    }

    public Chain(ChainDefinition definition, SchemaFlowConfig config) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.config = Objects.requireNonNull(config, "config");
        this.checker = new StageChecker(config);
    }

    public static Chain of(ChainLink... links) {
        return new Chain(List.of(links));
    }

    public static Chain fromDefinition(ChainDefinition definition) {
        return new Chain(definition, SchemaFlowConfig.defaults());
    }

    public String getName() {
        return definition.getName() != null ? definition.getName() : DEFAULT_NAME;
    }

    public List<ChainLink> getLinks() {
        return definition.getLinks();
    }

    public Schema getInitialInput() {
        return definition.getInitialInput();
    }

    public SchemaFlowConfig getConfig() {
        return config;
    }

    public boolean hasLink(String name) {
        return findLink(name).isPresent();
    }

    public Optional<ChainLink> findLink(String name) {
        return getLinks().stream().filter(l -> l.getName().equals(name)).findFirst();
    }

    /** Opens a run with no stage fitted yet. */
    public ChainCheckRun newRun() {
        return new ChainCheckRun(this, checker);
    }

    /**
     * Fit-phase simulation against a concrete payload.
     *
     * @param perStageParameters fit parameters by link name
     */
    public List<Violation> checkFit(Map<String, ?> initialData, Map<String, ? extends Map<String, ?>> perStageParameters) {
        return newRun().checkFit(initialData, perStageParameters);
    }

    /** Fit-phase simulation against a declared input schema. */
    public List<Violation> checkFit(Schema initialInput, Map<String, ? extends Map<String, ?>> perStageParameters) {
        return newRun().checkFit(initialInput, perStageParameters);
    }

    /** Fit-phase simulation against the chain's declared initial input. */
    public List<Violation> checkFit(Map<String, ? extends Map<String, ?>> perStageParameters) {
        return checkFit(getInitialInput(), perStageParameters);
    }

    /**
     * Transform-phase simulation in a fresh run: every stateful link is reported NOT_FITTED. Use
     * {@link #checkFitAndTransform} or a {@link ChainCheckRun} to check transform after fit.
     */
    public List<Violation> checkTransform(Map<String, ?> initialData) {
        return newRun().checkTransform(initialData);
    }

    public List<Violation> checkTransform(Schema initialInput) {
        return newRun().checkTransform(initialInput);
    }

    /**
     * Fit simulation followed by transform simulation in the same run; fit violations come first. TYPE_CONFLICT
     * comes from the declarations alone, so it is reported once, by the fit pass.
     */
    public List<Violation> checkFitAndTransform(Map<String, ?> initialData,
                                                Map<String, ? extends Map<String, ?>> perStageParameters) {
        ChainCheckRun run = newRun();
        List<Violation> violations = new ArrayList<>(run.checkFit(initialData, perStageParameters));
        for (Violation v : run.checkTransform(initialData)) {
            if (v.getKind() != ViolationKind.TYPE_CONFLICT) {
                violations.add(v);
            }
        }
        return List.copyOf(violations);
    }

    /**
     * Net transform requirement: keys some link needs for transform that no earlier link produces, with the type
     * first declared for them.
     */
    public Schema requiredInput() {
        return unmetRequirements(false);
    }

    /**
     * Net fit requirement. Each link needs its {@code fitRequires}, or its {@code transformRequires} when it
     * declares no fit requirement, since the fit pass transforms each link's output for the next one.
     */
    public Schema requiredFitInput() {
        return unmetRequirements(true);
    }

    /** Keys whose final type differs from the declared initial input (new keys included), in fold order. */
    public Schema producedOutput() {
        return foldOutput().produced;
    }

    /**
     * Net schema operations on keys the chain does not produce: drops of keys it receives, and column edits of
     * tables that reach it from outside the declared initial input.
     */
    public Map<String, SchemaOperation> schemaOperations() {
        return foldOutput().operations;
    }

    /** Every link's fit parameters, addressed {@code link/parameter}. */
    public Schema fitParameters() {
        Schema.Builder builder = Schema.builder();
        for (ChainLink link : getLinks()) {
            link.getContract().getFitParameters().asMap()
                    .forEach((key, type) -> builder.put(qualify(link, key), type));
        }
        return builder.build();
    }

    /** Every link's fitted state, addressed {@code link/key}. */
    public Schema fittedState() {
        Schema.Builder builder = Schema.builder();
        for (ChainLink link : getLinks()) {
            link.getContract().getFittedState().asMap()
                    .forEach((key, type) -> builder.put(qualify(link, key), type));
        }
        return builder.build();
    }

    /** The chain as a single stage contract, for nesting inside a larger chain. */
    public StageContract derivedContract() {
        return StageContract.builder()
                .fitRequires(requiredFitInput())
                .transformRequires(requiredInput())
                .fitParameters(fitParameters())
                .fittedState(fittedState())
                .producedOrModified(producedOutput())
                .schemaOperations(schemaOperations())
                .build();
    }

    /** This chain as a link of an outer chain. */
    public ChainLink asLink(String name) {
        return ChainLink.of(name, derivedContract());
    }

    private Schema unmetRequirements(boolean fitPhase) {
        Set<String> produced = new HashSet<>();
        Schema.Builder required = Schema.builder();
        Set<String> seen = new HashSet<>();
        for (ChainLink link : getLinks()) {
            StageContract contract = link.getContract();
            Schema needs = fitPhase && !contract.getFitRequires().isEmpty()
                    ? contract.getFitRequires()
                    : contract.getTransformRequires();
            for (Map.Entry<String, TypeSpec> e : needs.asMap().entrySet()) {
                if (!produced.contains(e.getKey()) && seen.add(e.getKey())) {
                    required.put(e.getKey(), e.getValue());
                }
            }
            contract.getOutputOperations().forEach((key, op) -> {
                if (op instanceof SchemaOperation.SetKey) {
                    produced.add(key);
                } else if (op instanceof SchemaOperation.DropKey) {
                    produced.remove(key);
                }
            });
        }
        return required.build();
    }

    // Applies every link's output operations to the declared initial input. Operations on a key that is neither
    // declared nor produced earlier act on the outer payload, so they are kept as operations instead of types.
    private OutputFold foldOutput() {
        Schema initial = getInitialInput();
        Schema working = initial;
        Set<String> seen = new HashSet<>(initial.keys());
        Map<String, SchemaOperation> external = new LinkedHashMap<>();
        for (ChainLink link : getLinks()) {
            for (Map.Entry<String, SchemaOperation> e : link.getContract().getOutputOperations().entrySet()) {
                String key = e.getKey();
                SchemaOperation op = e.getValue();
                if (external.containsKey(key) || !seen.contains(key)) {
                    SchemaOperation prior = external.get(key);
                    if (op instanceof SchemaOperation.SetKey
                            || (op instanceof SchemaOperation.ModifyTable && prior instanceof SchemaOperation.DropKey)) {
                        external.remove(key);
                    } else if (op instanceof SchemaOperation.ModifyTable && prior instanceof SchemaOperation.ModifyTable) {
                        external.put(key, ((SchemaOperation.ModifyTable) prior).andThen((SchemaOperation.ModifyTable) op));
                        continue;
                    } else {
                        external.put(key, op);
                        continue;
                    }
                }
                working = op.apply(key, working);
                seen.add(key);
            }
        }

        Schema.Builder produced = Schema.builder();
        for (Map.Entry<String, TypeSpec> e : working.asMap().entrySet()) {
            Optional<TypeSpec> before = initial.get(e.getKey());
            if (before.isEmpty() || !Compatibility.isEquivalent(before.get(), e.getValue())) {
                produced.put(e.getKey(), e.getValue());
            }
        }
        for (String key : initial.keys()) {
            if (!working.contains(key)) {
                external.put(key, SchemaOperation.drop());
            }
        }
        return new OutputFold(produced.build(), Collections.unmodifiableMap(external));
    }

    private static final class OutputFold {
        final Schema produced;
        final Map<String, SchemaOperation> operations;

        OutputFold(Schema produced, Map<String, SchemaOperation> operations) {
            this.produced = produced;
            this.operations = operations;
        }
    }

    private static String qualify(ChainLink link, String key) {
        return link.getName() + ChainLink.PATH_SEPARATOR + key;
    }

    @Override
    public String toString() {
        List<String> names = new ArrayList<>();
        getLinks().forEach(l -> names.add(l.getName()));
        return "Chain{" + getName() + ": " + String.join(" -> ", names) + "}";
    }
}
