package com.baykanat.insider.insights.domain.model;

/** Leaf property filter operatörleri. */
public enum PropertyOperator {
    EXACT,
    IS_NOT,
    ICONTAINS,
    NOT_ICONTAINS,
    REGEX,
    NOT_REGEX,
    GT,
    GTE,
    LT,
    LTE,
    IS_SET,
    IS_NOT_SET,
    IS_DATE_BEFORE,
    IS_DATE_AFTER,
    /** Yalnızca COHORT scope için. */
    IN,
    NOT_IN;

    /** Property yoksa geçen operatörler. */
    public boolean passesWhenMissing() {
        return this == IS_NOT || this == NOT_ICONTAINS || this == NOT_REGEX || this == IS_NOT_SET;
    }

    public boolean requiresValue() {
        return this != IS_SET && this != IS_NOT_SET;
    }

    public boolean isCohortOperator() {
        return this == IN || this == NOT_IN;
    }
}
