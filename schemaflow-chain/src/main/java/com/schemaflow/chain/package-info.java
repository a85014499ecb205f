/**
 * Chain composer: folds declared stage contracts over a working schema to verify a whole chain before any
 * stage runs, and derives the chain's own contract so chains nest as stages.
 */
package com.schemaflow.chain;
