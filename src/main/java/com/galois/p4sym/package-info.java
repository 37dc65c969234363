/**
 * The main package for the P4 symbolic semantics engine, a framework for
 * turning a decomposed P4 program into a closed-form formula over
 * bit-vectors and struct datatypes.
 *
 * <p>
 * To evaluate a pipeline, one first populates a
 * {@link com.galois.p4sym.engine.ProgramRegistry} and then constructs a
 * {@link com.galois.p4sym.SymbolicEvaluator} over it.
 */
package com.galois.p4sym;
