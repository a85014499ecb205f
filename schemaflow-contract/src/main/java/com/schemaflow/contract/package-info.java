/**
 * Stage contracts and chain declarations, and their JSON form.
 *
 * <ul>
 *   <li>{@link com.schemaflow.contract.StageContract} – the five schema slots of one stage</li>
 *   <li>{@link com.schemaflow.contract.ChainLink} – a named contract inside a chain</li>
 *   <li>{@link com.schemaflow.contract.ChainDefinition} – declared initial input plus ordered links</li>
 *   <li>{@link com.schemaflow.contract.ContractConfig} – {@code fromJson}/{@code toJson} for contracts and chains</li>
 *   <li>{@link com.schemaflow.contract.load} – {@link com.schemaflow.contract.load.ChainDefinitionLoader}
 *       (reads {@code <chain>.json} from a directory)</li>
 * </ul>
 */
package com.schemaflow.contract;
