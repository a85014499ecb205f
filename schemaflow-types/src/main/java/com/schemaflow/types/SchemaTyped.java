package com.schemaflow.types;

/**
 * Implemented by runtime containers (tables, model handles, ...) that know their own structural type.
 * {@link TypeInference} asks them instead of guessing from the Java class.
 */
public interface SchemaTyped {

    TypeSpec typeSpec();
}
