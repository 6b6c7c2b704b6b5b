package com.parcel.search.filter;

import java.util.List;
import java.util.Locale;

/**
 * Gazetteer lookup. Cities are tried in list order and the first one contained anywhere in the
 * text wins; there is no word-boundary check, so "mesa" also matches "mesas".
 */
public class CityExtractor implements FilterExtractor {
    static final List<String> CITIES = List.of(
        "honolulu", "san francisco", "los angeles", "new york", "chicago",
        "houston", "phoenix", "philadelphia", "san antonio", "san diego",
        "dallas", "austin", "seattle", "denver", "boston", "portland",
        "miami", "atlanta", "las vegas", "detroit", "nashville", "memphis",
        "louisville", "baltimore", "milwaukee", "albuquerque", "tucson",
        "fresno", "sacramento", "kansas city", "mesa", "virginia beach",
        "oakland", "minneapolis", "tulsa", "arlington", "tampa", "orlando"
    );

    private final List<String> cities;

    public CityExtractor() {
        this(CITIES);
    }

    public CityExtractor(List<String> cities) {
        this.cities = List.copyOf(cities);
    }

    @Override
    public void extract(ParseInput input, FilterPlan.Builder plan) {
        for (String city : cities) {
            if (input.lowered().contains(city)) {
                plan.must(new Condition.Term(PropertyFields.CITY, city.toUpperCase(Locale.ROOT)));
                return;
            }
        }
    }
}
