package com.screening.model;

/**
 * Ordinal risk classification assigned after screening.
 */
public enum RiskTier {
    LOW,      // No list hit, score below the review band
    MEDIUM,   // Score inside the review band
    HIGH,     // Score above the review band
    CRITICAL  // Hard-block list hit
}
