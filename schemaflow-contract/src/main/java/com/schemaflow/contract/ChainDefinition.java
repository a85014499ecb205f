package com.schemaflow.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.schemaflow.types.MalformedContractException;
import com.schemaflow.types.Schema;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Declared chain: optional name, the declared initial input schema and the ordered links.
 * At least one link is required and link names are unique.
 */
@JsonPropertyOrder({"name", "initialInput", "links"})
public final class ChainDefinition {

    private final String name;
    private final Schema initialInput;
    private final List<ChainLink> links;

    @JsonCreator
    public ChainDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("initialInput") Schema initialInput,
            @JsonProperty("links") List<ChainLink> links) {
        if (links == null || links.isEmpty()) {
            throw new MalformedContractException("Chain " + (name != null ? name + " " : "") + "has no links");
        }
        Set<String> names = new HashSet<>();
        for (ChainLink link : links) {
            if (link == null) {
                throw new MalformedContractException("Chain link is missing");
            }
            if (!names.add(link.getName())) {
                throw new MalformedContractException("Duplicate chain link name: " + link.getName());
            }
        }
        this.name = name;
        this.initialInput = initialInput != null ? initialInput : Schema.empty();
        this.links = List.copyOf(links);
    }

    public ChainDefinition(Schema initialInput, List<ChainLink> links) {
        this(null, initialInput, links);
    }

    public String getName() {
        return name;
    }

    /** Declared input of the first link; empty when the chain only runs against concrete payloads. */
    public Schema getInitialInput() {
        return initialInput;
    }

    public List<ChainLink> getLinks() {
        return links;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChainDefinition that = (ChainDefinition) o;
        return Objects.equals(name, that.name) && initialInput.equals(that.initialInput) && links.equals(that.links);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, initialInput, links);
    }
}
