package com.baykanat.insider.insights.domain.model;

import lombok.Value;

/** Normalizasyonda bir kez oluşturulan (index, entity) çifti; entity'ler yerinde değiştirilmez. */
@Value
public class IndexedEntity {
    int index;
    InsightEntity entity;
}
