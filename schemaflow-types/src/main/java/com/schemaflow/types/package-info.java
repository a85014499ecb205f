/**
 * Structural type model for stage contracts.
 *
 * <ul>
 *   <li>{@link com.schemaflow.types.TypeSpec} – closed set of descriptors: scalar, sequence, shaped array,
 *       mapping, table and opaque handle (factories on {@code TypeSpec})</li>
 *   <li>{@link com.schemaflow.types.Schema} – ordered, immutable key → type mapping</li>
 *   <li>{@link com.schemaflow.types.Compatibility} – the single declared-vs-observed predicate</li>
 *   <li>{@link com.schemaflow.types.TypeInference} – observed type of a runtime value
 *       (primitives, arrays, collections, {@link com.schemaflow.types.SchemaTyped} containers)</li>
 *   <li>{@link com.schemaflow.types.MalformedContractException} – invalid descriptor at construction time</li>
 * </ul>
 */
package com.schemaflow.types;
