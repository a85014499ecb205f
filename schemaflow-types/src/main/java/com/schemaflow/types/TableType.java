package com.schemaflow.types;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Tabular container described by its column schema (e.g. a data frame).
 * An observed table satisfies a declared one when it has every declared column with a compatible type;
 * extra columns are allowed.
 */
@JsonPropertyOrder({"type", "columns"})
public final class TableType extends TypeSpec {

    private final Schema columns;

    TableType(Schema columns) {
        if (columns == null) {
            throw new MalformedContractException("Table columns are missing");
        }
        this.columns = columns;
    }

    @Override
    public TypeTag getTag() {
        return TypeTag.TABLE;
    }

    public Schema getColumns() {
        return columns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return columns.equals(((TableType) o).columns);
    }

    @Override
    public int hashCode() {
        return 31 * TypeTag.TABLE.hashCode() + columns.hashCode();
    }

    @Override
    public String toString() {
        return "Table" + columns;
    }
}
