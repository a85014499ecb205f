package com.schemaflow.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.schemaflow.types.MalformedContractException;
import com.schemaflow.types.Schema;
import com.schemaflow.types.TableType;
import com.schemaflow.types.TypeSpec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a stage's transform does to one payload key: set it to a type, drop it, or set and drop individual
 * columns of a table. In JSON the operation is named by {@code "op"}:
 * <pre>
 * {"op": "set", "valueType": "float"}
 * {"op": "drop"}
 * {"op": "modifyTable", "columns": {"price": {"op": "set", "valueType": "float"}, "street": {"op": "drop"}}}
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "op")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SchemaOperation.SetKey.class, name = "set"),
        @JsonSubTypes.Type(value = SchemaOperation.DropKey.class, name = "drop"),
        @JsonSubTypes.Type(value = SchemaOperation.ModifyTable.class, name = "modifyTable")
})
public abstract class SchemaOperation {

    SchemaOperation() {
    }

    public static SetKey set(TypeSpec valueType) {
        return new SetKey(valueType);
    }

    public static DropKey drop() {
        return new DropKey();
    }

    public static ModifyTable modifyTable(Map<String, SchemaOperation> columns) {
        return new ModifyTable(columns);
    }

    /** Returns {@code schema} after applying this operation to {@code key}. */
    public abstract Schema apply(String key, Schema schema);

    /** Sets the key to a type, replacing any previous type. */
    public static final class SetKey extends SchemaOperation {

        private final TypeSpec valueType;

        @JsonCreator
        SetKey(@JsonProperty("valueType") TypeSpec valueType) {
            if (valueType == null) {
                throw new MalformedContractException("Set operation has no value type");
            }
            this.valueType = valueType;
        }

        public TypeSpec getValueType() {
            return valueType;
        }

        @Override
        public Schema apply(String key, Schema schema) {
            return schema.with(key, valueType);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return valueType.equals(((SetKey) o).valueType);
        }

        @Override
        public int hashCode() {
            return valueType.hashCode();
        }

        @Override
        public String toString() {
            return "Set(" + valueType + ")";
        }
    }

    /** Removes the key. Dropping an absent key leaves the schema unchanged. */
    public static final class DropKey extends SchemaOperation {

        @JsonCreator
        DropKey() {
        }

        @Override
        public Schema apply(String key, Schema schema) {
            return schema.without(key);
        }

        @Override
        public boolean equals(Object o) {
            return o != null && getClass() == o.getClass();
        }

        @Override
        public int hashCode() {
            return DropKey.class.hashCode();
        }

        @Override
        public String toString() {
            return "Drop()";
        }
    }

    /**
     * Applies column operations, in order, to the table held by the key. A key that is absent or does not hold a
     * table starts from a table with no columns.
     */
    public static final class ModifyTable extends SchemaOperation {

        private final Map<String, SchemaOperation> columns;

        @JsonCreator
        ModifyTable(@JsonProperty("columns") Map<String, SchemaOperation> columns) {
            if (columns == null || columns.isEmpty()) {
                throw new MalformedContractException("Table modification has no column operations");
            }
            for (Map.Entry<String, SchemaOperation> e : columns.entrySet()) {
                if (e.getKey() == null || e.getKey().isBlank() || e.getValue() == null) {
                    throw new MalformedContractException("Table modification has a blank column or a missing operation");
                }
            }
            this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        }

        public Map<String, SchemaOperation> getColumns() {
            return columns;
        }

        @Override
        public Schema apply(String key, Schema schema) {
            Schema table = schema.get(key)
                    .filter(TableType.class::isInstance)
                    .map(t -> ((TableType) t).getColumns())
                    .orElse(Schema.empty());
            for (Map.Entry<String, SchemaOperation> column : columns.entrySet()) {
                table = column.getValue().apply(column.getKey(), table);
            }
            return schema.with(key, TypeSpec.table(table));
        }

        /** This modification followed by {@code later}; later column operations win. */
        public ModifyTable andThen(ModifyTable later) {
            Map<String, SchemaOperation> merged = new LinkedHashMap<>(columns);
            later.columns.forEach((column, op) -> {
                merged.remove(column);
                merged.put(column, op);
            });
            return new ModifyTable(merged);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return columns.equals(((ModifyTable) o).columns);
        }

        @Override
        public int hashCode() {
            return Objects.hash(columns);
        }

        @Override
        public String toString() {
            return "ModifyTable(" + columns + ")";
        }
    }
}
