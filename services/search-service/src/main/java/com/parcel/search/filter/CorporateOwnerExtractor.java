package com.parcel.search.filter;

import java.util.List;

/**
 * Restricts to parcels held by a company. Synonyms are matched as substrings, so "inc" also fires
 * on words such as "income".
 */
public class CorporateOwnerExtractor implements FilterExtractor {
    static final List<String> SYNONYMS = List.of("corporate", "company", "corporation", "llc", "inc");

    @Override
    public void extract(ParseInput input, FilterPlan.Builder plan) {
        if (input.containsAny(SYNONYMS)) {
            plan.filter(new Condition.NestedTerm(
                PropertyFields.OWNER_NAMES_PATH,
                PropertyFields.OWNER_IS_CORPORATE,
                Boolean.TRUE
            ));
        }
    }
}
