package com.schemaflow.chain.stage;

import com.schemaflow.contract.StageContract;

import java.util.Map;

/**
 * User-supplied transformation with a declared contract. The checker never calls {@link #fit} or
 * {@link #transform}; {@link CheckedStage} and {@link StageSequence} do, after checking the contract.
 */
public interface Stage {

    StageContract contract();

    /** Computes fitted state from {@code data}. Stateless stages keep the default no-op. */
    default void fit(Map<String, Object> data, Map<String, ?> parameters) {
    }

    /** Returns the payload with this stage's output operations applied. */
    Map<String, Object> transform(Map<String, Object> data);
}
