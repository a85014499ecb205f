package com.schemaflow.types;

import com.fasterxml.jackson.annotation.JsonValue;

/** Discriminator of the {@link TypeSpec} variants; also the {@code "type"} field in JSON. */
public enum TypeTag {
    SCALAR("scalar"),
    SEQUENCE("sequence"),
    SHAPED_ARRAY("shapedArray"),
    MAPPING("mapping"),
    TABLE("table"),
    OPAQUE("opaque");

    private final String jsonName;

    TypeTag(String jsonName) {
        this.jsonName = jsonName;
    }

    @JsonValue
    public String getJsonName() {
        return jsonName;
    }

    public static TypeTag fromJsonName(String name) {
        if (name == null || name.isBlank()) {
            throw new MalformedContractException("Type descriptor has no \"type\" field");
        }
        for (TypeTag tag : values()) {
            if (tag.jsonName.equalsIgnoreCase(name.trim())) {
                return tag;
            }
        }
        throw new MalformedContractException("Unknown type descriptor: " + name);
    }
}
