package com.baykanat.insider.insights.domain.model;

/** Property değerinin okunacağı yer. */
public enum PropertyScope {
    EVENT,
    PERSON,
    GROUP,
    SESSION,
    /** Serbest expression; sonuç sıfırdan farklıysa filtre geçer. */
    HOGQL,
    /** Person'ın cohort üyeliği; value cohort id'dir. */
    COHORT
}
