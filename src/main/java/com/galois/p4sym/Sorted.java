package com.galois.p4sym;

/**
 * An object with a sort associated.
 */
public interface Sorted {
    /**
     * Return sort of object.
     * @return the sort
     */
    Sort sort();
}
