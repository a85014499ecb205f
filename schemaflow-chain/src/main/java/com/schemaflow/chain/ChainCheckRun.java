package com.schemaflow.chain;

import com.schemaflow.checker.Location;
import com.schemaflow.checker.SchemaFlowException;
import com.schemaflow.checker.StageChecker;
import com.schemaflow.checker.Violation;
import com.schemaflow.checker.ViolationKind;
import com.schemaflow.checker.config.ProducedKeyPolicy;
import com.schemaflow.contract.ChainLink;
import com.schemaflow.types.Compatibility;
import com.schemaflow.types.Schema;
import com.schemaflow.types.TypeSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One invocation of the chain composer. A run remembers which links its fit simulation has checked, so a
 * transform simulation in the same run gates NOT_FITTED on those flags. Runs are cheap and single-threaded;
 * open one per caller through {@link Chain#newRun()}.
 */
public final class ChainCheckRun {

    private static final Logger log = LoggerFactory.getLogger(ChainCheckRun.class);

    private final Chain chain;
    private final StageChecker checker;
    private final Set<String> fitted = new HashSet<>();

    ChainCheckRun(Chain chain, StageChecker checker) {
        this.chain = chain;
        this.checker = checker;
    }

    /**
     * Fit-phase simulation: checks each link's {@code fitRequires} and fit parameters against the working schema,
     * marks the link fitted, then folds its output operations. Parameters keyed by a name that is not a link are
     * reported as UNEXPECTED_PARAMETER at {@code (name, null)} after the link violations. Under
     * {@link ProducedKeyPolicy#FLAG_CONFLICT} every pass reports TYPE_CONFLICT for incompatible re-production.
     *
     * @param initialData        payload entering the first link (concrete values or declared types)
     * @param perStageParameters fit parameters by link name; a link without an entry gets an empty map
     */
    public List<Violation> checkFit(Map<String, ?> initialData, Map<String, ? extends Map<String, ?>> perStageParameters) {
        Objects.requireNonNull(initialData, "initialData");
        return checkFit(WorkingSchema.fromPayload(initialData), perStageParameters);
    }

    /** Fit-phase simulation against a declared input schema. */
    public List<Violation> checkFit(Schema initialInput, Map<String, ? extends Map<String, ?>> perStageParameters) {
        Objects.requireNonNull(initialInput, "initialInput");
        return checkFit(WorkingSchema.fromSchema(initialInput), perStageParameters);
    }

    private List<Violation> checkFit(WorkingSchema working, Map<String, ? extends Map<String, ?>> perStageParameters) {
        Map<String, ? extends Map<String, ?>> parameters =
                perStageParameters != null ? perStageParameters : Collections.emptyMap();
        List<Violation> violations = new ArrayList<>();
        for (ChainLink link : chain.getLinks()) {
            Map<String, ?> linkParameters = parameters.get(link.getName());
            violations.addAll(checker.checkFit(link.getName(), link.getContract(), working.entries(),
                    linkParameters != null ? linkParameters : Collections.emptyMap()));
            fitted.add(link.getName());
            fold(working, link, violations);
        }
        for (Map.Entry<String, ? extends Map<String, ?>> e : parameters.entrySet()) {
            if (!chain.hasLink(e.getKey())) {
                Violation v = new Violation(new Location(e.getKey(), null), ViolationKind.UNEXPECTED_PARAMETER,
                        null, null, "Parameters supplied for unknown stage '" + e.getKey() + "'");
                if (checker.getConfig().isFailFast()) {
                    throw new SchemaFlowException(List.of(v));
                }
                violations.add(v);
            }
        }
        report("fit", violations);
        return List.copyOf(violations);
    }

    /**
     * Transform-phase simulation: checks each link's {@code transformRequires} against the working schema and
     * reports NOT_FITTED for stateful links this run has not fit.
     */
    public List<Violation> checkTransform(Map<String, ?> initialData) {
        Objects.requireNonNull(initialData, "initialData");
        return checkTransform(WorkingSchema.fromPayload(initialData));
    }

    public List<Violation> checkTransform(Schema initialInput) {
        Objects.requireNonNull(initialInput, "initialInput");
        return checkTransform(WorkingSchema.fromSchema(initialInput));
    }

    private List<Violation> checkTransform(WorkingSchema working) {
        List<Violation> violations = new ArrayList<>();
        for (ChainLink link : chain.getLinks()) {
            violations.addAll(checker.checkTransform(link.getName(), link.getContract(), working.entries(),
                    fitted.contains(link.getName())));
            fold(working, link, violations);
        }
        report("transform", violations);
        return List.copyOf(violations);
    }

    public boolean isFitted(String linkName) {
        return fitted.contains(linkName);
    }

    // Only producedOrModified keys are checked for conflicts; schema operations edit keys on purpose.
    private void fold(WorkingSchema working, ChainLink link, List<Violation> violations) {
        Schema produced = link.getContract().getProducedOrModified();
        if (checker.getConfig().getProducedKeyPolicy() == ProducedKeyPolicy.FLAG_CONFLICT) {
            for (Map.Entry<String, TypeSpec> e : produced.asMap().entrySet()) {
                Optional<String> earlier = working.producerOf(e.getKey());
                if (earlier.isEmpty()) {
                    continue;
                }
                TypeSpec previous = working.typeOf(e.getKey()).orElseThrow();
                if (!Compatibility.isEquivalent(previous, e.getValue())) {
                    Violation v = new Violation(new Location(link.getName(), e.getKey()), ViolationKind.TYPE_CONFLICT,
                            previous, e.getValue(), "Key '" + e.getKey() + "' produced as " + previous + " by stage '"
                            + earlier.get() + "' is produced again as " + e.getValue());
                    if (checker.getConfig().isFailFast()) {
                        throw new SchemaFlowException(List.of(v));
                    }
                    violations.add(v);
                }
            }
        }
        working.fold(link.getName(), link.getContract().getOutputOperations());
    }

    private void report(String phase, List<Violation> violations) {
        if (violations.isEmpty()) {
            log.debug("Chain {} {} check: {} stage(s), no violations", chain.getName(), phase, chain.getLinks().size());
        } else {
            log.warn("Chain {} {} check found {} violation(s)", chain.getName(), phase, violations.size());
        }
    }
}
