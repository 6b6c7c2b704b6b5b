package com.parcel.search.filter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Two-letter state codes. Runs on the original casing so that lowercase words like "in" or "or"
 * are never taken for a state.
 */
public class StateCodeExtractor implements FilterExtractor {
    private static final Pattern STATE_CODE = Pattern.compile("\\b([A-Z]{2})\\b");

    @Override
    public void extract(ParseInput input, FilterPlan.Builder plan) {
        Matcher matcher = STATE_CODE.matcher(input.original());
        if (matcher.find()) {
            plan.must(new Condition.Term(PropertyFields.STATE, matcher.group(1)));
        }
    }
}
