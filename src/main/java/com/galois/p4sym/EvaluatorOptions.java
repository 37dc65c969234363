package com.galois.p4sym;

import com.galois.p4sym.proto.Protos;

public class EvaluatorOptions {
    /** Nesting depth allowed when no explicit limit is configured. */
    public static final int DEFAULT_MAX_CALL_DEPTH = 256;

    private Protos.EvaluatorOptions.Builder opts;

    public EvaluatorOptions() {
        opts = Protos.EvaluatorOptions.newBuilder();
        opts.setFoldConstants( true );
        opts.setTraceSteps( false );
        opts.setMaxCallDepth( DEFAULT_MAX_CALL_DEPTH );
    }

    /**
     * Should literal sub-terms be folded while formulas are built?  Turning
     * this off keeps every operation as written, which is mostly useful when
     * debugging a translation.
     */
    public EvaluatorOptions setFoldConstants( boolean b ) {
        opts.setFoldConstants( b );
        return this;
    }

    public boolean getFoldConstants() {
        return opts.getFoldConstants();
    }

    /**
     * Should every evaluated continuation step be written to the status
     * stream?
     */
    public EvaluatorOptions setTraceSteps( boolean b ) {
        opts.setTraceSteps( b );
        return this;
    }

    public boolean getTraceSteps() {
        return opts.getTraceSteps();
    }

    /**
     * Set the maximum number of nested callable invocations.  A program
     * graph that recurses deeper than this is rejected as malformed.
     */
    public EvaluatorOptions setMaxCallDepth( int depth ) {
        if( depth <= 0 ) {
            throw new IllegalArgumentException( "maximum call depth must be positive: " + depth );
        }
        opts.setMaxCallDepth( depth );
        return this;
    }

    public int getMaxCallDepth() {
        return opts.getMaxCallDepth();
    }

    public Protos.EvaluatorOptions getRep() {
        return opts.build();
    }
}
