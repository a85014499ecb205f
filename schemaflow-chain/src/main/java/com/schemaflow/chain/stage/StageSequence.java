package com.schemaflow.chain.stage;

import com.schemaflow.chain.Chain;
import com.schemaflow.checker.config.SchemaFlowConfig;
import com.schemaflow.contract.ChainDefinition;
import com.schemaflow.contract.ChainLink;
import com.schemaflow.contract.StageContract;
import com.schemaflow.types.Schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named stages run in order. Fit fits each stage and transforms its output to feed the next one; transform
 * threads the payload through every stage. The sequence is itself a {@link Stage}: its contract is the derived
 * contract of {@link #chain()}, and its fit parameters are addressed {@code stage/parameter}.
 */
public final class StageSequence implements Stage {

    private final String name;
    private final List<CheckedStage> stages;
    private final Chain chain;

    private StageSequence(Builder b) {
        this.name = b.name;
        this.stages = List.copyOf(b.stages);
        List<ChainLink> links = new ArrayList<>(stages.size());
        for (CheckedStage stage : stages) {
            links.add(ChainLink.of(stage.getName(), stage.contract()));
        }
        this.chain = new Chain(new ChainDefinition(name, b.initialInput, links), b.config);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public List<CheckedStage> getStages() {
        return stages;
    }

    /** Contract-only view for static verification; no stage is run. */
    public Chain chain() {
        return chain;
    }

    public boolean isFitted() {
        return stages.stream().allMatch(CheckedStage::isFitted);
    }

    @Override
    public StageContract contract() {
        return chain.derivedContract();
    }

    @Override
    public void fit(Map<String, Object> data, Map<String, ?> parameters) {
        Map<String, Map<String, Object>> byStage = splitParameters(parameters);
        Map<String, Object> current = data;
        for (int i = 0; i < stages.size(); i++) {
            CheckedStage stage = stages.get(i);
            stage.fit(current, byStage.getOrDefault(stage.getName(), Collections.emptyMap()));
            if (i < stages.size() - 1) {
                current = stage.transform(current);
            }
        }
    }

    @Override
    public Map<String, Object> transform(Map<String, Object> data) {
        Map<String, Object> current = data;
        for (CheckedStage stage : stages) {
            current = stage.transform(current);
        }
        return current;
    }

    // "scale/alpha" goes to stage "scale" as "alpha"; the remainder may address a nested sequence.
    private Map<String, Map<String, Object>> splitParameters(Map<String, ?> parameters) {
        Map<String, Map<String, Object>> byStage = new LinkedHashMap<>();
        if (parameters == null) {
            return byStage;
        }
        for (Map.Entry<String, ?> e : parameters.entrySet()) {
            int sep = e.getKey().indexOf(ChainLink.PATH_SEPARATOR);
            if (sep <= 0 || sep == e.getKey().length() - 1) {
                throw new IllegalArgumentException("Parameter '" + e.getKey() + "' of sequence " + name
                        + " must be addressed as stage" + ChainLink.PATH_SEPARATOR + "parameter");
            }
            String stage = e.getKey().substring(0, sep);
            if (stages.stream().noneMatch(st -> st.getName().equals(stage))) {
                throw new IllegalArgumentException("Parameter '" + e.getKey() + "' of sequence " + name
                        + " addresses unknown stage '" + stage + "'");
            }
            byStage.computeIfAbsent(stage, k -> new LinkedHashMap<>())
                    .put(e.getKey().substring(sep + 1), e.getValue());
        }
        return byStage;
    }

    @Override
    public String toString() {
        return "StageSequence{" + name + ", stages=" + stages + "}";
    }

    public static final class Builder {
        private final String name;
        private final List<CheckedStage> stages = new ArrayList<>();
        private SchemaFlowConfig config = SchemaFlowConfig.defaults();
        private Schema initialInput = Schema.empty();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        /** Applies to stages added after this call. */
        public Builder config(SchemaFlowConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder initialInput(Schema initialInput) {
            this.initialInput = initialInput != null ? initialInput : Schema.empty();
            return this;
        }

        public Builder stage(String stageName, Stage stage) {
            stages.add(stage instanceof CheckedStage && ((CheckedStage) stage).getName().equals(stageName)
                    ? (CheckedStage) stage
                    : new CheckedStage(stageName, stage, config));
            return this;
        }

        /**
         * @throws com.schemaflow.types.MalformedContractException when no stage was added or names repeat
         */
        public StageSequence build() {
            return new StageSequence(this);
        }
    }
}
