package com.schemaflow.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.schemaflow.types.MalformedContractException;
import com.schemaflow.types.Schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Declared contract of one stage. Every slot defaults to the empty schema.
 * <ul>
 *   <li>{@code fitRequires} – payload keys read by fit</li>
 *   <li>{@code transformRequires} – payload keys read by transform</li>
 *   <li>{@code fitParameters} – parameters passed to fit</li>
 *   <li>{@code fittedState} – state computed by fit; private to the stage and only gates its transform</li>
 *   <li>{@code producedOrModified} – payload keys written by transform</li>
 *   <li>{@code schemaOperations} – other changes transform makes to payload keys: drops and table column edits,
 *   applied after {@code producedOrModified}</li>
 * </ul>
 * A key may appear in {@code producedOrModified} or in {@code schemaOperations}, not both.
 */
@JsonPropertyOrder({"fitRequires", "transformRequires", "fitParameters", "fittedState", "producedOrModified",
        "schemaOperations"})
public final class StageContract {

    private static final StageContract EMPTY = builder().build();

    private final Schema fitRequires;
    private final Schema transformRequires;
    private final Schema fitParameters;
    private final Schema fittedState;
    private final Schema producedOrModified;
    private final Map<String, SchemaOperation> schemaOperations;

    public StageContract(Schema fitRequires, Schema transformRequires, Schema fitParameters, Schema fittedState,
                         Schema producedOrModified) {
        this(fitRequires, transformRequires, fitParameters, fittedState, producedOrModified, null);
    }

    /**
     * @throws MalformedContractException when a key is both produced and the target of a schema operation
     */
    @JsonCreator
    public StageContract(
            @JsonProperty("fitRequires") Schema fitRequires,
            @JsonProperty("transformRequires") Schema transformRequires,
            @JsonProperty("fitParameters") Schema fitParameters,
            @JsonProperty("fittedState") Schema fittedState,
            @JsonProperty("producedOrModified") Schema producedOrModified,
            @JsonProperty("schemaOperations") Map<String, SchemaOperation> schemaOperations) {
        this.fitRequires = fitRequires != null ? fitRequires : Schema.empty();
        this.transformRequires = transformRequires != null ? transformRequires : Schema.empty();
        this.fitParameters = fitParameters != null ? fitParameters : Schema.empty();
        this.fittedState = fittedState != null ? fittedState : Schema.empty();
        this.producedOrModified = producedOrModified != null ? producedOrModified : Schema.empty();
        Map<String, SchemaOperation> ops = new LinkedHashMap<>();
        if (schemaOperations != null) {
            for (Map.Entry<String, SchemaOperation> e : schemaOperations.entrySet()) {
                if (e.getKey() == null || e.getKey().isBlank() || e.getValue() == null) {
                    throw new MalformedContractException("Schema operation with a blank key or no operation");
                }
                if (this.producedOrModified.contains(e.getKey())) {
                    throw new MalformedContractException("Key '" + e.getKey()
                            + "' is both in producedOrModified and in schemaOperations");
                }
                ops.put(e.getKey(), e.getValue());
            }
        }
        this.schemaOperations = Collections.unmodifiableMap(ops);
    }

    public static StageContract empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Schema getFitRequires() {
        return fitRequires;
    }

    public Schema getTransformRequires() {
        return transformRequires;
    }

    public Schema getFitParameters() {
        return fitParameters;
    }

    public Schema getFittedState() {
        return fittedState;
    }

    public Schema getProducedOrModified() {
        return producedOrModified;
    }

    public Map<String, SchemaOperation> getSchemaOperations() {
        return schemaOperations;
    }

    /**
     * Everything transform does to the payload, in application order: each {@code producedOrModified} key as a set
     * operation, then {@code schemaOperations}.
     */
    @JsonIgnore
    public Map<String, SchemaOperation> getOutputOperations() {
        Map<String, SchemaOperation> ops = new LinkedHashMap<>();
        producedOrModified.asMap().forEach((key, type) -> ops.put(key, SchemaOperation.set(type)));
        ops.putAll(schemaOperations);
        return ops;
    }

    /** True when transform depends on fitted state, i.e. {@code fittedState} is not empty. */
    @JsonIgnore
    public boolean isStateful() {
        return !fittedState.isEmpty();
    }

    public Builder toBuilder() {
        return new Builder()
                .fitRequires(fitRequires)
                .transformRequires(transformRequires)
                .fitParameters(fitParameters)
                .fittedState(fittedState)
                .producedOrModified(producedOrModified)
                .schemaOperations(schemaOperations);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StageContract that = (StageContract) o;
        return fitRequires.equals(that.fitRequires)
                && transformRequires.equals(that.transformRequires)
                && fitParameters.equals(that.fitParameters)
                && fittedState.equals(that.fittedState)
                && producedOrModified.equals(that.producedOrModified)
                && schemaOperations.equals(that.schemaOperations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fitRequires, transformRequires, fitParameters, fittedState, producedOrModified,
                schemaOperations);
    }

    @Override
    public String toString() {
        return "StageContract{fitRequires=" + fitRequires
                + ", transformRequires=" + transformRequires
                + ", fitParameters=" + fitParameters
                + ", fittedState=" + fittedState
                + ", producedOrModified=" + producedOrModified
                + (schemaOperations.isEmpty() ? "" : ", schemaOperations=" + schemaOperations) + "}";
    }

    public static final class Builder {
        private Schema fitRequires = Schema.empty();
        private Schema transformRequires = Schema.empty();
        private Schema fitParameters = Schema.empty();
        private Schema fittedState = Schema.empty();
        private Schema producedOrModified = Schema.empty();
        private final Map<String, SchemaOperation> schemaOperations = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder fitRequires(Schema fitRequires) {
            this.fitRequires = fitRequires;
            return this;
        }

        public Builder transformRequires(Schema transformRequires) {
            this.transformRequires = transformRequires;
            return this;
        }

        public Builder fitParameters(Schema fitParameters) {
            this.fitParameters = fitParameters;
            return this;
        }

        public Builder fittedState(Schema fittedState) {
            this.fittedState = fittedState;
            return this;
        }

        public Builder producedOrModified(Schema producedOrModified) {
            this.producedOrModified = producedOrModified;
            return this;
        }

        /** Replaces all schema operations. */
        public Builder schemaOperations(Map<String, SchemaOperation> schemaOperations) {
            this.schemaOperations.clear();
            if (schemaOperations != null) {
                this.schemaOperations.putAll(schemaOperations);
            }
            return this;
        }

        public Builder schemaOperation(String key, SchemaOperation operation) {
            this.schemaOperations.put(key, operation);
            return this;
        }

        public StageContract build() {
            return new StageContract(fitRequires, transformRequires, fitParameters, fittedState, producedOrModified,
                    schemaOperations);
        }
    }
}
