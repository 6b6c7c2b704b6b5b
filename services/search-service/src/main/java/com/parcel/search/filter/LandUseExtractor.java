package com.parcel.search.filter;

import java.util.List;
import java.util.Locale;

public class LandUseExtractor implements FilterExtractor {
    static final List<String> LAND_USES = List.of(
        "residential",
        "commercial",
        "industrial",
        "agricultural",
        "vacant"
    );

    @Override
    public void extract(ParseInput input, FilterPlan.Builder plan) {
        for (String landUse : LAND_USES) {
            if (input.lowered().contains(landUse)) {
                plan.must(new Condition.Term(PropertyFields.LAND_USE, landUse.toUpperCase(Locale.ROOT)));
                return;
            }
        }
    }
}
