package com.parcel.search.filter;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class CountyExtractor implements FilterExtractor {
    private static final Pattern COUNTY = Pattern.compile("(\\w+)\\s+county");

    @Override
    public void extract(ParseInput input, FilterPlan.Builder plan) {
        Matcher matcher = COUNTY.matcher(input.lowered());
        if (matcher.find()) {
            plan.must(new Condition.Term(PropertyFields.COUNTY, matcher.group(1).toUpperCase(Locale.ROOT)));
        }
    }
}
