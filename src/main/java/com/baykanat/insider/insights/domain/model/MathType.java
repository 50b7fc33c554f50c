package com.baykanat.insider.insights.domain.model;

/** Trend entity'si için periyot başına hesaplanacak değer. */
public enum MathType {
    TOTAL(Category.COUNT, null),
    DAU(Category.COUNT, null),
    UNIQUE_SESSION(Category.COUNT, null),
    UNIQUE_GROUP(Category.COUNT, null),
    WEEKLY_ACTIVE(Category.COUNT, null),
    MONTHLY_ACTIVE(Category.COUNT, null),

    SUM(Category.PROPERTY, Statistic.SUM),
    AVG(Category.PROPERTY, Statistic.AVG),
    MIN(Category.PROPERTY, Statistic.MIN),
    MAX(Category.PROPERTY, Statistic.MAX),
    MEDIAN(Category.PROPERTY, Statistic.MEDIAN),
    P75(Category.PROPERTY, Statistic.P75),
    P90(Category.PROPERTY, Statistic.P90),
    P95(Category.PROPERTY, Statistic.P95),
    P99(Category.PROPERTY, Statistic.P99),

    AVG_COUNT_PER_ACTOR(Category.COUNT_PER_ACTOR, Statistic.AVG),
    MIN_COUNT_PER_ACTOR(Category.COUNT_PER_ACTOR, Statistic.MIN),
    MAX_COUNT_PER_ACTOR(Category.COUNT_PER_ACTOR, Statistic.MAX),
    MEDIAN_COUNT_PER_ACTOR(Category.COUNT_PER_ACTOR, Statistic.MEDIAN),
    P75_COUNT_PER_ACTOR(Category.COUNT_PER_ACTOR, Statistic.P75),
    P90_COUNT_PER_ACTOR(Category.COUNT_PER_ACTOR, Statistic.P90),
    P95_COUNT_PER_ACTOR(Category.COUNT_PER_ACTOR, Statistic.P95),
    P99_COUNT_PER_ACTOR(Category.COUNT_PER_ACTOR, Statistic.P99),

    /** math_hogql: fn(expr) aggregate ifadesi. */
    HOGQL(Category.EXPRESSION, null);

    public enum Category {
        COUNT,
        PROPERTY,
        COUNT_PER_ACTOR,
        EXPRESSION
    }

    private final Category category;
    private final Statistic statistic;

    MathType(Category category, Statistic statistic) {
        this.category = category;
        this.statistic = statistic;
    }

    public Category getCategory() {
        return category;
    }

    public Statistic getStatistic() {
        return statistic;
    }

    public boolean isPropertyMath() {
        return category == Category.PROPERTY;
    }

    public boolean isCountPerActor() {
        return category == Category.COUNT_PER_ACTOR;
    }

    public boolean isActiveUsers() {
        return this == WEEKLY_ACTIVE || this == MONTHLY_ACTIVE;
    }

    /** Sampling düzeltmesi yalnızca sayım tipindeki math'lere uygulanır. */
    public boolean isSamplingCorrected() {
        return category == Category.COUNT;
    }

    /** Active user math için geriye bakış gün sayısı (period başlangıcından önce). */
    public int lookBackDays() {
        return switch (this) {
            case WEEKLY_ACTIVE -> 6;
            case MONTHLY_ACTIVE -> 29;
            default -> 0;
        };
    }
}
