package com.schemaflow.chain.stage;

import com.schemaflow.checker.SchemaFlowException;
import com.schemaflow.checker.ViolationKind;
import com.schemaflow.checker.config.SchemaFlowConfig;
import com.schemaflow.contract.StageContract;
import com.schemaflow.types.Schema;
import com.schemaflow.types.TypeSpec;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CheckedStageTest {

    private static final SchemaFlowConfig STRICT = SchemaFlowConfig.builder().stageFailOnViolation(true).build();

    /** Centers "values" on the mean seen during fit. */
    static final class CenteringStage implements Stage {
        double mean = Double.NaN;
        int fitCalls;
        int transformCalls;

        @Override
        public StageContract contract() {
            return StageContract.builder()
                    .fitRequires(Schema.of("values", TypeSpec.sequence(TypeSpec.floating())))
                    .transformRequires(Schema.of("values", TypeSpec.sequence(TypeSpec.floating())))
                    .fittedState(Schema.of("mean", TypeSpec.floating()))
                    .producedOrModified(Schema.of("centered", TypeSpec.sequence(TypeSpec.floating())))
                    .build();
        }

        @Override
        @SuppressWarnings("unchecked")
        public void fit(Map<String, Object> data, Map<String, ?> parameters) {
            fitCalls++;
            List<Double> values = (List<Double>) data.get("values");
            mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        }

        @Override
        @SuppressWarnings("unchecked")
        public Map<String, Object> transform(Map<String, Object> data) {
            transformCalls++;
            Map<String, Object> out = new HashMap<>(data);
            List<Double> values = (List<Double>) data.get("values");
            out.put("centered", values.stream().map(v -> v - mean).collect(java.util.stream.Collectors.toList()));
            return out;
        }
    }

    @Test
    void fitThenTransform_delegatesAndTracksFittedFlag() {
        CenteringStage delegate = new CenteringStage();
        CheckedStage stage = new CheckedStage("center", delegate, STRICT);
        Map<String, Object> data = Map.of("values", List.of(1.0, 3.0));

        stage.fit(data, null);
        Map<String, Object> out = stage.transform(data);

        assertTrue(stage.isFitted());
        assertEquals(2.0, delegate.mean);
        assertEquals(List.of(-1.0, 1.0), out.get("centered"));
    }

    @Test
    void transformBeforeFit_isLoggedAndStillRunByDefault() {
        CenteringStage delegate = new CenteringStage();
        CheckedStage stage = new CheckedStage("center", delegate);

        stage.transform(Map.of("values", List.of(1.0)));

        assertFalse(stage.isFitted());
        assertEquals(1, delegate.transformCalls);
    }

    @Test
    void transformBeforeFit_isRefusedWhenConfigured() {
        CenteringStage delegate = new CenteringStage();
        CheckedStage stage = new CheckedStage("center", delegate, STRICT);

        SchemaFlowException e = assertThrows(SchemaFlowException.class,
                () -> stage.transform(Map.of("values", List.of(1.0))));

        assertEquals(1, e.getViolations().size());
        assertEquals(ViolationKind.NOT_FITTED, e.getViolations().get(0).getKind());
        assertEquals("center", e.getViolations().get(0).stage());
        assertEquals(0, delegate.transformCalls);
    }

    @Test
    void fitWithWrongPayload_isRefusedWhenConfigured() {
        CenteringStage delegate = new CenteringStage();
        CheckedStage stage = new CheckedStage("center", delegate, STRICT);

        SchemaFlowException e = assertThrows(SchemaFlowException.class,
                () -> stage.fit(Map.of("values", List.of("a", "b")), Map.of("unknown", 1)));

        assertEquals(List.of(ViolationKind.TYPE_MISMATCH, ViolationKind.UNEXPECTED_PARAMETER),
                List.of(e.getViolations().get(0).getKind(), e.getViolations().get(1).getKind()));
        assertEquals(0, delegate.fitCalls);
        assertFalse(stage.isFitted());
    }

    @Test
    void constructor_rejectsBlankName() {
        assertThrows(IllegalArgumentException.class, () -> new CheckedStage(" ", new CenteringStage()));
    }
}
