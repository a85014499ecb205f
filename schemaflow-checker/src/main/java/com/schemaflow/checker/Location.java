package com.schemaflow.checker;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Where a violation was found: the stage name (null for a stand-alone stage check) and the key
 * (null for stage-level violations such as NOT_FITTED). Table columns are addressed as {@code table.column}.
 */
public final class Location {

    private final String stage;
    private final String key;

    @JsonCreator
    public Location(@JsonProperty("stage") String stage, @JsonProperty("key") String key) {
        this.stage = stage;
        this.key = key;
    }

    public String getStage() {
        return stage;
    }

    public String getKey() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Location that = (Location) o;
        return Objects.equals(stage, that.stage) && Objects.equals(key, that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stage, key);
    }

    @Override
    public String toString() {
        return "(" + (stage != null ? stage : "-") + ", " + (key != null ? key : "-") + ")";
    }
}
