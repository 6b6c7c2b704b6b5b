package com.parcel.search.filter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assessed value bounds such as "under $450,000", "below 500k" or "min 200k".
 */
public class ValueBoundExtractor implements FilterExtractor {
    static final long THOUSANDS_SUFFIX_LIMIT = 10_000L;

    private final Pattern pattern;
    private final BoundKind bound;

    public ValueBoundExtractor(String keywordRegex, BoundKind bound) {
        this.pattern = Pattern.compile("(?:" + keywordRegex + ")\\s*\\$?\\s*([\\d,]+)(k?)");
        this.bound = bound;
    }

    public static ValueBoundExtractor upper() {
        return new ValueBoundExtractor("under|below|less than|max", BoundKind.LTE);
    }

    public static ValueBoundExtractor lower() {
        return new ValueBoundExtractor("over|above|more than|min", BoundKind.GTE);
    }

    @Override
    public void extract(ParseInput input, FilterPlan.Builder plan) {
        Matcher matcher = pattern.matcher(input.lowered());
        if (!matcher.find()) {
            return;
        }
        Long value = parseAmount(matcher.group(1), !matcher.group(2).isEmpty());
        if (value == null) {
            return;
        }
        plan.filter(new Condition.NestedRange(
            PropertyFields.TAX_ASSESSMENT_PATH,
            PropertyFields.ASSESSED_VALUE,
            bound,
            value
        ));
    }

    /**
     * Strips thousands separators and applies the {@code k} suffix. The suffix only scales values
     * below 10,000 so that "500000k" is not read as half a billion.
     */
    static Long parseAmount(String digits, boolean thousandsSuffix) {
        String cleaned = digits.replace(",", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        long value;
        try {
            value = Long.parseLong(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
        if (thousandsSuffix && value < THOUSANDS_SUFFIX_LIMIT) {
            value *= 1000L;
        }
        return value;
    }
}
