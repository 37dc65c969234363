package com.galois.p4sym.callable;

import com.galois.p4sym.stmt.BlockStatement;

/**
 * A parser, evaluated exactly like a {@link Control}.
 */
public class Parser extends Control {
    public Parser(String name, BlockStatement body) {
        super(name, body);
    }
}
