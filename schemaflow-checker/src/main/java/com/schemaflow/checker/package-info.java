/**
 * Stage checker: compares a stage contract against a concrete payload or a declared upstream schema
 * without running the stage.
 *
 * <ul>
 *   <li>{@link com.schemaflow.checker.StageChecker} – {@code checkFit}, {@code checkTransform},
 *       {@code checkContractStatic}; collect-all by default</li>
 *   <li>{@link com.schemaflow.checker.Violation} – one inconsistency, located by
 *       {@link com.schemaflow.checker.Location} (stage, key) and classified by
 *       {@link com.schemaflow.checker.ViolationKind}</li>
 *   <li>{@link com.schemaflow.checker.Violations} – reporting helpers and {@code requireNone}</li>
 *   <li>{@link com.schemaflow.checker.config} – {@link com.schemaflow.checker.config.SchemaFlowConfig}
 *       (builder, environment)</li>
 * </ul>
 */
package com.schemaflow.checker;
