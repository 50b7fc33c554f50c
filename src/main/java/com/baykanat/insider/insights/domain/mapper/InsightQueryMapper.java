package com.baykanat.insider.insights.domain.mapper;

import com.baykanat.insider.insights.api.dto.ExperimentRequest;
import com.baykanat.insider.insights.api.dto.InsightQueryRequest;
import com.baykanat.insider.insights.domain.model.ExperimentQuery;
import com.baykanat.insider.insights.domain.model.InsightQuery;
import com.baykanat.insider.insights.domain.model.VariantCounts;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.NullValueCheckStrategy;

/**
 * Request DTO → immutable domain sorgusu. Null alanlar builder'a hiç verilmez; böylece domain default'ları
 * (interval, order type, aggregation, display) korunur.
 */
@Mapper(componentModel = "spring", nullValueCheckStrategy = NullValueCheckStrategy.ALWAYS)
public interface InsightQueryMapper {

    @Mapping(target = "teamId", source = "teamId")
    InsightQuery toQuery(InsightQueryRequest request, Long teamId);

    ExperimentQuery toExperimentQuery(ExperimentRequest request);

    /** Sayı alanı gönderilmeyen variant 0 kabul edilir. */
    VariantCounts toVariantCounts(ExperimentRequest.Variant variant);
}
