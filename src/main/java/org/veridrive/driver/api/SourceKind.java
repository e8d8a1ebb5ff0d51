package org.veridrive.driver.api;

/**
 * The role of an input file.
 */
public enum SourceKind {
    /** A program in the verified source language. */
    PROGRAM,
    /** A native source file compiled together with the generated code. */
    NATIVE_SOURCE,
    /** A prebuilt native library added as a link reference. */
    NATIVE_LIBRARY
}
