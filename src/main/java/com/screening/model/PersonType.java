package com.screening.model;

/**
 * Kind of subject being screened.
 */
public enum PersonType {
    INDIVIDUAL,    // Natural person (persona fisica)
    LEGAL_ENTITY   // Company or other legal person (persona moral)
}
