package com.schemaflow.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.schemaflow.types.MalformedContractException;

import java.util.Objects;

/**
 * A named stage contract inside a chain. The name addresses per-stage parameters and appears in
 * violation locations; it must be non-blank and must not contain {@value #PATH_SEPARATOR}, which is
 * reserved for addressing stages of nested chains.
 */
@JsonPropertyOrder({"name", "contract"})
public final class ChainLink {

    public static final String PATH_SEPARATOR = "/";

    private final String name;
    private final StageContract contract;

    @JsonCreator
    public ChainLink(
            @JsonProperty("name") String name,
            @JsonProperty("contract") StageContract contract) {
        if (name == null || name.isBlank()) {
            throw new MalformedContractException("Chain link name must not be blank");
        }
        if (name.contains(PATH_SEPARATOR)) {
            throw new MalformedContractException("Chain link name must not contain '" + PATH_SEPARATOR + "': " + name);
        }
        this.name = name;
        this.contract = contract != null ? contract : StageContract.empty();
    }

    public static ChainLink of(String name, StageContract contract) {
        return new ChainLink(name, contract);
    }

    public String getName() {
        return name;
    }

    public StageContract getContract() {
        return contract;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChainLink that = (ChainLink) o;
        return name.equals(that.name) && contract.equals(that.contract);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, contract);
    }

    @Override
    public String toString() {
        return name;
    }
}
