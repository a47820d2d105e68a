package com.screening.engine;

/**
 * Reference watchlists the engine screens against.
 *
 * Weights are fixed and feed the composite score: domestic blocked persons and
 * the deregistered-entity registry weigh most, sanctions lists next, PEPs least.
 * They are constants on purpose; a score must be reproducible years later.
 */
public enum ListSource {

    OFAC("OFAC", "ofac", 40),
    UN_SECURITY_COUNCIL("CSNU/ONU", "un-security-council", 40),
    DOMESTIC_BLOCKED("UIF Personas Bloqueadas", "domestic-blocked", 70),
    PEP("PEPs", "pep", 30),
    DEREGISTERED_ENTITY("Lista 69B", "deregistered-entities", 50);

    private final String label;
    private final String snapshotName;
    private final int weight;

    ListSource(String label, String snapshotName, int weight) {
        this.label = label;
        this.snapshotName = snapshotName;
        this.weight = weight;
    }

    /** Human readable name used in alert strings. */
    public String label() {
        return label;
    }

    /** Base file name of the snapshot inside the snapshot directory. */
    public String snapshotName() {
        return snapshotName;
    }

    public int weight() {
        return weight;
    }
}
