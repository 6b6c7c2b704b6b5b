package com.parcel.search.filter;

import java.util.List;

/**
 * Maps ordering words to a single sort clause. Categories are checked in a fixed order and the
 * first one with a hit decides.
 */
public class SortIntentExtractor implements FilterExtractor {
    private static final List<Intent> INTENTS = List.of(
        new Intent(
            List.of("cheap", "affordable", "lowest", "least expensive"),
            SortClause.nested(PropertyFields.TAX_ASSESSMENT_PATH, PropertyFields.ASSESSED_VALUE, SortOrder.ASC)
        ),
        new Intent(
            List.of("expensive", "luxury", "highest", "most valuable", "premium"),
            SortClause.nested(PropertyFields.TAX_ASSESSMENT_PATH, PropertyFields.ASSESSED_VALUE, SortOrder.DESC)
        ),
        new Intent(
            List.of("largest", "biggest", "spacious"),
            SortClause.of(PropertyFields.LIVING_AREA, SortOrder.DESC)
        ),
        new Intent(
            List.of("smallest", "compact"),
            SortClause.of(PropertyFields.LIVING_AREA, SortOrder.ASC)
        )
    );

    @Override
    public void extract(ParseInput input, FilterPlan.Builder plan) {
        for (Intent intent : INTENTS) {
            if (input.containsAny(intent.keywords())) {
                plan.sort(intent.clause());
                return;
            }
        }
    }

    private record Intent(List<String> keywords, SortClause clause) {
    }
}
