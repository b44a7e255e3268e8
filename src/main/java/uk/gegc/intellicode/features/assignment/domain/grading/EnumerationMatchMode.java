package uk.gegc.intellicode.features.assignment.domain.grading;

/**
 * How repeated candidates in an enumeration answer are counted.
 */
public enum EnumerationMatchMode {
    /**
     * Every candidate found in the correct list counts, so a correct item
     * listed twice counts twice.
     */
    COUNT_EVERY_MATCH,
    /**
     * Candidates are deduplicated after normalization before counting.
     */
    DISTINCT_CANDIDATES
}
