package com.screening.engine;

import com.screening.engine.snapshot.ListSnapshot;

import java.util.regex.Pattern;

/**
 * Matcher for the deregistered-entity registry (SAT list 69-B), keyed by RFC.
 *
 * With a tax identifier the lookup is an exact RFC match; a malformed RFC is
 * reported as a note and does not match. Without one, the registry is
 * searched by name tokens like any other list.
 */
public class TaxIdMatcher extends AbstractSourceMatcher {

    // 12 characters for legal entities, 13 for individuals; homoclave checksum not verified
    private static final Pattern RFC = Pattern.compile("^[A-ZÑ&]{3,4}\\d{6}[A-Z0-9]{3}$");

    public TaxIdMatcher(int maxEntries) {
        super(ListSource.DEREGISTERED_ENTITY, maxEntries);
    }

    public static boolean isValidRfc(String taxId) {
        return taxId != null && RFC.matcher(taxId).matches();
    }

    @Override
    protected MatchResult matchAvailable(IdentityRecord identity, NormalizedName name, ListSnapshot snapshot) {
        if (identity.hasTaxId()) {
            if (!isValidRfc(identity.taxId())) {
                return noMatch(snapshot, "tax identifier has an invalid RFC format, not checked");
            }
            return result(snapshot.findByTaxId(identity.taxId()), snapshot, null);
        }
        if (!name.isMatchable()) {
            return noMatch(snapshot, NameTokenMatcher.UNMATCHABLE_NOTE);
        }
        return result(snapshot.findContainingAll(name.tokens()), snapshot,
                "no tax identifier supplied, matched by name");
    }
}
