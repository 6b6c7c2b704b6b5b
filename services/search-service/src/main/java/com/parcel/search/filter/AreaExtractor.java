package com.parcel.search.filter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lower bounds on living area or lot size, e.g. "2000+ sqft" or "5+ acres". Without the {@code +}
 * the number is ignored.
 */
public class AreaExtractor implements FilterExtractor {
    private final Pattern pattern;
    private final String field;
    private final boolean fractional;

    public AreaExtractor(String unitRegex, String field, boolean fractional) {
        String number = fractional ? "(\\d+(?:\\.\\d+)?)" : "(\\d+)";
        this.pattern = Pattern.compile(number + "\\s*(\\+)?\\s*(?:" + unitRegex + ")");
        this.field = field;
        this.fractional = fractional;
    }

    public static AreaExtractor livingArea() {
        return new AreaExtractor("sq\\.?\\s*ft|square\\s*feet|sqft", PropertyFields.LIVING_AREA, false);
    }

    public static AreaExtractor lotAcres() {
        return new AreaExtractor("acres?", PropertyFields.LOT_ACRES, true);
    }

    @Override
    public void extract(ParseInput input, FilterPlan.Builder plan) {
        Matcher matcher = pattern.matcher(input.lowered());
        if (!matcher.find() || matcher.group(2) == null) {
            return;
        }
        Number value;
        try {
            value = fractional
                ? (Number) Double.parseDouble(matcher.group(1))
                : (Number) Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            // digit run too long for a long
            return;
        }
        plan.filter(new Condition.Range(field, BoundKind.GTE, value));
    }
}
