package com.schemaflow.checker.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaFlowConfigTest {

    @Test
    void defaults() {
        SchemaFlowConfig config = SchemaFlowConfig.defaults();

        assertEquals(ProducedKeyPolicy.OVERWRITE, config.getProducedKeyPolicy());
        assertTrue(config.isReportUnexpectedParameters());
        assertFalse(config.isFailFast());
        assertFalse(config.isStageFailOnViolation());
    }

    @Test
    void fromEnvironment_readsEveryVariable() {
        SchemaFlowConfig config = SchemaFlowConfig.fromEnvironment(Map.of(
                "SCHEMAFLOW_PRODUCED_KEY_POLICY", "flag-conflict",
                "SCHEMAFLOW_REPORT_UNEXPECTED_PARAMETERS", "false",
                "SCHEMAFLOW_FAIL_FAST", "1",
                "SCHEMAFLOW_STAGE_FAIL_ON_VIOLATION", "TRUE"));

        assertEquals(ProducedKeyPolicy.FLAG_CONFLICT, config.getProducedKeyPolicy());
        assertFalse(config.isReportUnexpectedParameters());
        assertTrue(config.isFailFast());
        assertTrue(config.isStageFailOnViolation());
    }

    @Test
    void fromEnvironment_fallsBackOnMissingOrInvalidValues() {
        SchemaFlowConfig config = SchemaFlowConfig.fromEnvironment(Map.of(
                "SCHEMAFLOW_PRODUCED_KEY_POLICY", "merge",
                "SCHEMAFLOW_FAIL_FAST", "sometimes"));

        assertEquals(ProducedKeyPolicy.OVERWRITE, config.getProducedKeyPolicy());
        assertFalse(config.isFailFast());
        assertTrue(config.isReportUnexpectedParameters());
    }

    @Test
    void toBuilder_copiesSettings() {
        SchemaFlowConfig config = SchemaFlowConfig.builder()
                .producedKeyPolicy(ProducedKeyPolicy.FLAG_CONFLICT)
                .failFast(true)
                .build();

        SchemaFlowConfig copy = config.toBuilder().stageFailOnViolation(true).build();

        assertSame(ProducedKeyPolicy.FLAG_CONFLICT, copy.getProducedKeyPolicy());
        assertTrue(copy.isFailFast());
        assertTrue(copy.isStageFailOnViolation());
        assertFalse(config.isStageFailOnViolation());
    }
}
