package com.parcel.search.filter;

public enum BoundKind {
    GTE("gte"),
    LTE("lte");

    private final String operator;

    BoundKind(String operator) {
        this.operator = operator;
    }

    public String operator() {
        return operator;
    }
}
