package com.screening.engine;

/**
 * One row of a reference watchlist.
 *
 * The normalized name is computed once when the snapshot is loaded.
 * Optional fields are null when the source does not carry them.
 */
public record ListEntry(
    ListSource source,
    String uid,
    String fullName,
    String normalizedName,
    String category,
    String inclusionDate,
    String position,
    String institution,
    String taxId
) {
    public ListEntry {
        if (source == null) {
            throw new IllegalArgumentException("List entry source cannot be null");
        }
        fullName = fullName == null ? "" : fullName.trim();
        if (normalizedName == null) {
            normalizedName = NameNormalizer.normalizeText(fullName);
        }
    }

    public static ListEntry named(ListSource source, String fullName) {
        return new ListEntry(source, null, fullName, null, null, null, null, null, null);
    }

    public static ListEntry taxpayer(String taxId, String fullName, String category) {
        return new ListEntry(ListSource.DEREGISTERED_ENTITY, taxId, fullName, null, category, null, null, null, taxId);
    }
}
