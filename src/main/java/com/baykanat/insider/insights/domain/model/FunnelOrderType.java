package com.baykanat.insider.insights.domain.model;

/** Funnel step sıralama semantiği. */
public enum FunnelOrderType {
    /** Step'ler sırayla, arada başka event'ler olabilir. */
    ORDERED,
    /** Step'ler arka arkaya; arada başka event olursa run biter. */
    STRICT,
    /** Tüm step'ler window içinde herhangi bir sırada. */
    UNORDERED
}
