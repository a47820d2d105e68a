package com.screening.engine;

/**
 * Where a match result's data came from.
 */
public enum Provenance {
    AUTHORITATIVE,  // Current snapshot of the official list
    FALLBACK,       // Built-in reference list, snapshot could not be loaded
    UNAVAILABLE     // No data at all for this source
}
