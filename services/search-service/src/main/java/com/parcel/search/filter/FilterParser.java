package com.parcel.search.filter;

import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Rule-based translation of free text into a {@link FilterPlan}.
 *
 * <p>Parsing is pure and total: no I/O, no exceptions, and the same text always yields an equal
 * plan. Clause order is fixed by the extractor order below, not by where a pattern appears in the
 * text.
 */
@Component
public class FilterParser {
    private final List<FilterExtractor> extractors;

    public FilterParser() {
        this(defaultExtractors());
    }

    public FilterParser(List<FilterExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    public static List<FilterExtractor> defaultExtractors() {
        return List.of(
            CountExtractor.bedrooms(),
            CountExtractor.bathrooms(),
            ValueBoundExtractor.upper(),
            ValueBoundExtractor.lower(),
            AreaExtractor.livingArea(),
            new CityExtractor(),
            new StateCodeExtractor(),
            new CountyExtractor(),
            new LandUseExtractor(),
            new CorporateOwnerExtractor(),
            AreaExtractor.lotAcres(),
            new SortIntentExtractor()
        );
    }

    public FilterPlan parse(String text) {
        if (text == null || text.isBlank()) {
            return FilterPlan.empty();
        }
        ParseInput input = ParseInput.of(text);
        FilterPlan.Builder plan = FilterPlan.builder();
        for (FilterExtractor extractor : extractors) {
            extractor.extract(input, plan);
        }
        return plan.build();
    }
}
