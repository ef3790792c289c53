package com.phillippitts.fstintent.service.fst;

/**
 * Which side of a transducer survives a projection.
 */
public enum ProjectType {
    /** Copy input labels onto the output side. */
    INPUT,
    /** Copy output labels onto the input side. */
    OUTPUT
}
