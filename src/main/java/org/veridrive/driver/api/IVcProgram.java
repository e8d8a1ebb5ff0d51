package org.veridrive.driver.api;

/**
 * Marker for a lowered, solver-checkable program. Its structure belongs to the proof engine.
 */
public interface IVcProgram {
}
