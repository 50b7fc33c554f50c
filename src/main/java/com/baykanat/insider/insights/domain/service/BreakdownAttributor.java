package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.config.AppProperties;
import com.baykanat.insider.insights.domain.model.ActorEventStream;
import com.baykanat.insider.insights.domain.model.Breakdown;
import com.baykanat.insider.insights.domain.model.BreakdownAttribution;
import com.baykanat.insider.insights.domain.model.MatchedEvent;
import com.baykanat.insider.insights.domain.model.PropertyScope;
import com.baykanat.insider.insights.domain.model.RawEvent;
import com.baykanat.insider.insights.domain.model.StepRun;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Breakdown değerlerini event'ten okur, funnel run'ı için attribution kuralını uygular ve "Other" katlamasını yapar. */
@Component
@RequiredArgsConstructor
public class BreakdownAttributor {

    private static final Comparator<List<String>> VALUE_ORDER = (left, right) -> {
        for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
            int compared = left.get(i).compareTo(right.get(i));
            if (compared != 0) {
                return compared;
            }
        }
        return Integer.compare(left.size(), right.size());
    };

    private final PropertyFilterEvaluator filterEvaluator;
    private final AppProperties appProperties;

    /** Event'in breakdown tuple'ı; eksik bileşenler "". Cohort breakdown'ları için kullanılmaz. */
    public List<String> valueOf(RawEvent event, Breakdown breakdown, PropertyLookup lookup) {
        PropertyScope scope = switch (breakdown.getType()) {
            case EVENT -> PropertyScope.EVENT;
            case PERSON -> PropertyScope.PERSON;
            case GROUP -> PropertyScope.GROUP;
            case HOGQL -> PropertyScope.HOGQL;
            case COHORT -> throw new IllegalArgumentException("Cohort breakdown values come from membership");
        };
        List<String> value = new ArrayList<>(breakdown.getKeys().size());
        for (String key : breakdown.getKeys()) {
            Object raw = filterEvaluator.resolveValue(scope, key, breakdown.getGroupTypeIndex(), event, lookup);
            value.add(format(raw));
        }
        return Collections.unmodifiableList(value);
    }

    /** Actor'ün üyesi olduğu cohort bucket'ları; "all" key'i herkesi kapsayan bucket'tır. */
    public List<List<String>> cohortBuckets(String personId, Breakdown breakdown, PropertyLookup lookup) {
        List<List<String>> buckets = new ArrayList<>();
        for (String cohortId : breakdown.getKeys()) {
            if (Breakdown.ALL_USERS_KEY.equals(cohortId)) {
                buckets.add(List.of(appProperties.getBreakdown().getAllUsersLabel()));
            } else if (lookup.isCohortMember(cohortId, personId)) {
                buckets.add(List.of(cohortId));
            }
        }
        return buckets;
    }

    /**
     * FIRST_TOUCH / LAST_TOUCH / STEP kuralına göre actor'ün bucket'ı. STEP(N) tanımlı N. step'i sağlayan event'in
     * değerini alır; run o step'i sağlamadıysa boş. ALL_EVENTS çağıran tarafta stream bölünerek ele alınır.
     */
    public Optional<List<String>> attribute(ActorEventStream stream, StepRun run, Breakdown breakdown) {
        BreakdownAttribution attribution = breakdown.getAttribution() != null
                ? breakdown.getAttribution()
                : BreakdownAttribution.FIRST_TOUCH;
        return switch (attribution) {
            case FIRST_TOUCH -> Optional.of(firstTouch(stream, breakdown));
            case LAST_TOUCH -> Optional.of(lastTouch(stream, run, breakdown));
            case STEP -> run.eventForDeclaredStep(breakdown.getAttributionStep()).map(MatchedEvent::getBreakdownValue);
            case ALL_EVENTS -> throw new IllegalStateException("ALL_EVENTS attribution partitions the stream instead");
        };
    }

    private List<String> firstTouch(ActorEventStream stream, Breakdown breakdown) {
        for (MatchedEvent event : stream.getEvents()) {
            if (event.matchesAnyStep() && isPresent(event.getBreakdownValue())) {
                return event.getBreakdownValue();
            }
        }
        return emptyValue(breakdown);
    }

    private List<String> lastTouch(ActorEventStream stream, StepRun run, Breakdown breakdown) {
        List<MatchedEvent> events = stream.getEvents();
        Instant limit = run.getStepTimestamps().get(run.getMaxStepIndex());
        for (int i = events.size() - 1; i >= 0; i--) {
            MatchedEvent event = events.get(i);
            if (!event.getTimestamp().isAfter(limit) && event.matchesAnyStep() && isPresent(event.getBreakdownValue())) {
                return event.getBreakdownValue();
            }
        }
        return emptyValue(breakdown);
    }

    /**
     * limit yoksa eşleme kimliktir. Varsa actor sayısına göre ilk limit bucket tutulur (eşitlikte küçük değer önce),
     * kalanlar "Other" bucket'ına eşlenir.
     */
    public Map<List<String>, List<String>> foldOther(Map<List<String>, Long> actorCounts, Integer limit, int keyCount) {
        Map<List<String>, List<String>> mapping = new HashMap<>();
        if (limit == null || actorCounts.size() <= limit) {
            actorCounts.keySet().forEach(value -> mapping.put(value, value));
            return mapping;
        }
        List<List<String>> ranked = new ArrayList<>(actorCounts.keySet());
        ranked.sort(Comparator.<List<String>, Long>comparing(actorCounts::get).reversed().thenComparing(VALUE_ORDER));

        List<String> other = Collections.nCopies(Math.max(keyCount, 1), appProperties.getBreakdown().getOtherLabel());
        for (int i = 0; i < ranked.size(); i++) {
            List<String> value = ranked.get(i);
            mapping.put(value, i < limit ? value : other);
        }
        return mapping;
    }

    public static Comparator<List<String>> valueOrder() {
        return VALUE_ORDER;
    }

    private static List<String> emptyValue(Breakdown breakdown) {
        return Collections.nCopies(Math.max(breakdown.getKeys().size(), 1), "");
    }

    private static boolean isPresent(List<String> value) {
        if (value == null) {
            return false;
        }
        for (String component : value) {
            if (!component.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /** Sayılar gereksiz ondalık olmadan yazılır (5.0 → "5"); null → "". */
    static String format(Object raw) {
        if (raw == null) {
            return "";
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return "";
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return raw.toString();
    }
}
