package com.parcel.search.filter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "N unit" and "N+ unit" for room counts. The exact form becomes a scoring {@code must} term, the
 * {@code +} form a lower bound in {@code filter}.
 */
public class CountExtractor implements FilterExtractor {
    private final Pattern pattern;
    private final String field;
    private final boolean fractional;

    public CountExtractor(String unitRegex, String field, boolean fractional) {
        String number = fractional ? "(\\d+(?:\\.\\d+)?)" : "(\\d+)";
        this.pattern = Pattern.compile(number + "\\s*(\\+)?\\s*(?:" + unitRegex + ")");
        this.field = field;
        this.fractional = fractional;
    }

    public static CountExtractor bedrooms() {
        return new CountExtractor("bed(?:room)?s?|br", PropertyFields.BEDROOMS, false);
    }

    public static CountExtractor bathrooms() {
        return new CountExtractor("bath(?:room)?s?", PropertyFields.BATHROOMS, true);
    }

    @Override
    public void extract(ParseInput input, FilterPlan.Builder plan) {
        Matcher matcher = pattern.matcher(input.lowered());
        if (!matcher.find()) {
            return;
        }
        boolean atLeast = matcher.group(2) != null;
        if (fractional) {
            double count = Double.parseDouble(matcher.group(1));
            if (atLeast) {
                plan.filter(new Condition.Range(field, BoundKind.GTE, count));
            } else {
                plan.must(new Condition.Term(field, (long) count));
            }
            return;
        }
        long count;
        try {
            count = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            return;
        }
        if (atLeast) {
            plan.filter(new Condition.Range(field, BoundKind.GTE, count));
        } else {
            plan.must(new Condition.Term(field, count));
        }
    }
}
