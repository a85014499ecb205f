/**
 * Execution adapters that check contracts around real fit/transform calls.
 */
package com.schemaflow.chain.stage;
