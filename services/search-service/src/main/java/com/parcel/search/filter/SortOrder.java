package com.parcel.search.filter;

import java.util.Locale;

public enum SortOrder {
    ASC,
    DESC;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
