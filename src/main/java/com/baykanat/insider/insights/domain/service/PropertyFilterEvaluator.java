package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.exception.MalformedFilterException;
import com.baykanat.insider.insights.domain.model.FilterLogic;
import com.baykanat.insider.insights.domain.model.PropertyFilter;
import com.baykanat.insider.insights.domain.model.PropertyGroup;
import com.baykanat.insider.insights.domain.model.PropertyOperator;
import com.baykanat.insider.insights.domain.model.PropertyScope;
import com.baykanat.insider.insights.domain.model.RawEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.ConcurrentLruCache;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** AND/OR property filtre ağacını event bağlamında değerlendirir; ağacın yapısal doğrulaması da burada. */
@Component
@RequiredArgsConstructor
public class PropertyFilterEvaluator {

    private static final DateTimeFormatter FLEXIBLE_DATE = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    /** Derlenmiş regex cache'inin üst sınırı; en az kullanılan desen önce düşer. */
    static final int PATTERN_CACHE_CAPACITY = 512;

    private final ExpressionEvaluator expressionEvaluator;
    private final ConcurrentLruCache<String, Pattern> patternCache =
            new ConcurrentLruCache<>(PATTERN_CACHE_CAPACITY, Pattern::compile);

    /** Boş grup geçer; AND tüm çocukları, OR en az bir çocuğu ister. */
    public boolean evaluate(PropertyGroup group, RawEvent event, PropertyLookup lookup) {
        if (PropertyGroup.isEmpty(group)) {
            return true;
        }
        boolean conjunction = group.getOperator() != FilterLogic.OR;

        if (group.getProperties() != null && !group.getProperties().isEmpty()) {
            for (PropertyFilter filter : group.getProperties()) {
                boolean result = evaluate(filter, event, lookup);
                if (conjunction && !result) {
                    return false;
                }
                if (!conjunction && result) {
                    return true;
                }
            }
            return conjunction;
        }

        for (PropertyGroup child : group.getGroups()) {
            boolean result = evaluate(child, event, lookup);
            if (conjunction && !result) {
                return false;
            }
            if (!conjunction && result) {
                return true;
            }
        }
        return conjunction;
    }

    public boolean evaluate(PropertyFilter filter, RawEvent event, PropertyLookup lookup) {
        if (filter.getScope() == PropertyScope.COHORT) {
            boolean member = lookup.isCohortMember(String.valueOf(filter.getValue()), event.getPersonId());
            return filter.getOperator() == PropertyOperator.NOT_IN ? !member : member;
        }
        if (filter.getScope() == PropertyScope.HOGQL) {
            Object result = expressionEvaluator.parse(filter.getKey())
                    .evaluate(ExpressionEvaluator.eventResolver(event));
            return ExpressionEvaluator.isTruthy(result);
        }
        Object actual = resolveValue(filter.getScope(), filter.getKey(), filter.getGroupTypeIndex(), event, lookup);
        return matches(filter.getOperator(), actual, filter.getValue());
    }

    /** Scope'a göre property değerini okur; GROUP için group key'i event'ten alır. */
    public Object resolveValue(PropertyScope scope, String key, Integer groupTypeIndex, RawEvent event, PropertyLookup lookup) {
        return switch (scope) {
            case EVENT -> event.getProperties().get(key);
            case PERSON -> event.getPersonProperties().get(key);
            case SESSION -> event.getSessionProperties().get(key);
            case GROUP -> lookup.groupProperties(groupTypeIndex, event.getGroupKeys().get(groupTypeIndex)).get(key);
            case HOGQL -> expressionEvaluator.parse(key).evaluate(ExpressionEvaluator.eventResolver(event));
            case COHORT -> null;
        };
    }

    boolean matches(PropertyOperator operator, Object actual, Object expected) {
        if (actual == null) {
            return operator.passesWhenMissing();
        }
        return switch (operator) {
            case EXACT -> anyEqual(actual, expected);
            case IS_NOT -> !anyEqual(actual, expected);
            case ICONTAINS -> anyContains(actual, expected);
            case NOT_ICONTAINS -> !anyContains(actual, expected);
            case REGEX -> anyRegex(actual, expected);
            case NOT_REGEX -> !anyRegex(actual, expected);
            case GT -> holds(compareNumbers(actual, expected), c -> c > 0);
            case GTE -> holds(compareNumbers(actual, expected), c -> c >= 0);
            case LT -> holds(compareNumbers(actual, expected), c -> c < 0);
            case LTE -> holds(compareNumbers(actual, expected), c -> c <= 0);
            case IS_SET -> true;
            case IS_NOT_SET -> false;
            case IS_DATE_BEFORE -> holds(compareDates(actual, expected), c -> c < 0);
            case IS_DATE_AFTER -> holds(compareDates(actual, expected), c -> c > 0);
            case IN, NOT_IN -> false;
        };
    }

    /** Yapısal doğrulama; sorgu çalışmadan önce bir kez çağrılır. */
    public void validate(PropertyGroup group) {
        if (PropertyGroup.isEmpty(group)) {
            return;
        }
        boolean hasLeaves = group.getProperties() != null && !group.getProperties().isEmpty();
        boolean hasGroups = group.getGroups() != null && !group.getGroups().isEmpty();
        if (hasLeaves && hasGroups) {
            throw new MalformedFilterException(
                    "A property group must contain either filters or nested groups, not both");
        }
        if (hasLeaves) {
            group.getProperties().forEach(this::validate);
        } else {
            group.getGroups().forEach(this::validate);
        }
    }

    public void validate(PropertyFilter filter) {
        PropertyOperator operator = filter.getOperator();
        PropertyScope scope = filter.getScope();
        if (operator == null || scope == null) {
            throw new MalformedFilterException("Property filter requires an operator and a scope");
        }
        if (scope != PropertyScope.COHORT && (filter.getKey() == null || filter.getKey().isBlank())) {
            throw new MalformedFilterException("Property filter requires a key");
        }
        if (scope == PropertyScope.COHORT) {
            if (!operator.isCohortOperator()) {
                throw new MalformedFilterException("Cohort filters only support the IN and NOT_IN operators");
            }
            if (filter.getValue() == null) {
                throw new MalformedFilterException("Cohort filter requires a cohort id");
            }
            return;
        }
        if (operator.isCohortOperator()) {
            throw new MalformedFilterException("Operator " + operator + " is only valid for cohort filters");
        }
        if (scope == PropertyScope.GROUP && filter.getGroupTypeIndex() == null) {
            throw new MalformedFilterException("Group filter on '" + filter.getKey() + "' requires a group type index");
        }
        if (scope == PropertyScope.HOGQL) {
            try {
                expressionEvaluator.parse(filter.getKey());
            } catch (IllegalArgumentException e) {
                throw new MalformedFilterException("Invalid expression filter: " + e.getMessage(), e);
            }
            return;
        }
        if (operator.requiresValue() && filter.getValue() == null) {
            throw new MalformedFilterException("Operator " + operator + " on '" + filter.getKey() + "' requires a value");
        }
        if (operator == PropertyOperator.REGEX || operator == PropertyOperator.NOT_REGEX) {
            for (Object candidate : values(filter.getValue())) {
                pattern(String.valueOf(candidate));
            }
        }
    }

    private boolean anyEqual(Object actual, Object expected) {
        for (Object candidate : values(expected)) {
            if (equalValues(actual, candidate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean equalValues(Object actual, Object expected) {
        if (expected == null) {
            return false;
        }
        if (actual instanceof Number || expected instanceof Number) {
            double a = ExpressionEvaluator.toDouble(actual);
            double e = ExpressionEvaluator.toDouble(expected);
            if (!Double.isNaN(a) && !Double.isNaN(e)) {
                return a == e;
            }
        }
        return actual.toString().equals(expected.toString());
    }

    private boolean anyContains(Object actual, Object expected) {
        String haystack = actual.toString().toLowerCase(Locale.ROOT);
        for (Object candidate : values(expected)) {
            if (candidate != null && haystack.contains(candidate.toString().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private boolean anyRegex(Object actual, Object expected) {
        String subject = actual.toString();
        for (Object candidate : values(expected)) {
            if (candidate != null && pattern(candidate.toString()).matcher(subject).find()) {
                return true;
            }
        }
        return false;
    }

    private Pattern pattern(String regex) {
        try {
            return patternCache.get(regex);
        } catch (PatternSyntaxException e) {
            throw new MalformedFilterException("Invalid regex '" + regex + "': " + e.getDescription(), e);
        }
    }

    int cachedPatternCount() {
        return patternCache.size();
    }

    private static boolean holds(Integer comparison, IntPredicate predicate) {
        return comparison != null && predicate.test(comparison);
    }

    /** Sayısal karşılaştırma; taraflardan biri sayı değilse null (hiçbir operatörü sağlamaz). */
    private static Integer compareNumbers(Object actual, Object expected) {
        double a = ExpressionEvaluator.toDouble(actual);
        double e = ExpressionEvaluator.toDouble(firstValue(expected));
        if (Double.isNaN(a) || Double.isNaN(e)) {
            return null;
        }
        return Double.compare(a, e);
    }

    private static Integer compareDates(Object actual, Object expected) {
        Instant a = parseInstant(actual);
        Instant e = parseInstant(firstValue(expected));
        if (a == null || e == null) {
            return null;
        }
        return a.compareTo(e);
    }

    /** ISO tarih, yerel datetime (UTC varsayılır), offset'li datetime veya epoch saniye; çözülemezse null. */
    static Instant parseInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return Instant.ofEpochSecond(number.longValue());
        }
        try {
            TemporalAccessor parsed = FLEXIBLE_DATE.parseBest(value.toString().trim(),
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            if (parsed instanceof LocalDateTime localDateTime) {
                return localDateTime.toInstant(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Object firstValue(Object expected) {
        if (expected instanceof Collection<?> collection) {
            return collection.isEmpty() ? null : collection.iterator().next();
        }
        return expected;
    }

    private static Collection<?> values(Object expected) {
        if (expected instanceof Collection<?> collection) {
            return collection;
        }
        return expected == null ? List.of() : List.of(expected);
    }
}
