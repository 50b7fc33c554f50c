package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.config.AppProperties;
import com.baykanat.insider.insights.domain.model.DisplayMode;
import com.baykanat.insider.insights.domain.model.Interval;
import com.baykanat.insider.insights.domain.model.MathType;
import com.baykanat.insider.insights.domain.model.Period;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * [from, to] aralığını interval'e göre yerel takvim periyotlarına böler. Aritmetik ZonedDateTime ile
 * yapılır; DST geçişlerinde gün ve ay sınırları yerel saate göre doğru kalır.
 */
@Component
@RequiredArgsConstructor
public class TimeBucketer {

    private static final DateTimeFormatter DAY_LABEL = DateTimeFormatter.ofPattern("d-MMM-yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter HOUR_LABEL = DateTimeFormatter.ofPattern("d-MMM-yyyy HH:mm", Locale.ENGLISH);
    private static final DateTimeFormatter HOUR_DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH);

    private final AppProperties appProperties;

    /** Sıralı periyot listesi; ilk periyot from'un interval başına kesilmiş halinden başlar. */
    public List<Period> periods(ZonedDateTime from, ZonedDateTime to, Interval interval, ZoneId zone) {
        ZonedDateTime localFrom = from.withZoneSameInstant(zone);
        ZonedDateTime localTo = to.withZoneSameInstant(zone);

        List<Period> periods = new ArrayList<>();
        ZonedDateTime start = truncate(localFrom, interval);
        while (!start.isAfter(localTo)) {
            ZonedDateTime next = advance(start, interval);
            periods.add(new Period(start, next.minus(1, ChronoUnit.MICROS), label(start, interval), day(start, interval)));
            start = next;
        }
        return periods;
    }

    /** Aggregate display için [from, to] tek periyot. */
    public Period aggregatePeriod(ZonedDateTime from, ZonedDateTime to) {
        return new Period(from, to, DAY_LABEL.format(from) + " - " + DAY_LABEL.format(to), from.toLocalDate().toString());
    }

    public ZonedDateTime truncate(ZonedDateTime value, Interval interval) {
        return switch (interval) {
            case HOUR -> value.truncatedTo(ChronoUnit.HOURS);
            case DAY -> value.toLocalDate().atStartOfDay(value.getZone());
            case WEEK -> value.toLocalDate()
                    .with(TemporalAdjusters.previousOrSame(appProperties.getTime().getWeekStartDay()))
                    .atStartOfDay(value.getZone());
            case MONTH -> value.toLocalDate().withDayOfMonth(1).atStartOfDay(value.getZone());
        };
    }

    public ZonedDateTime advance(ZonedDateTime start, Interval interval) {
        return switch (interval) {
            case HOUR -> start.plusHours(1);
            case DAY -> start.toLocalDate().plusDays(1).atStartOfDay(start.getZone());
            case WEEK -> start.toLocalDate().plusWeeks(1).atStartOfDay(start.getZone());
            case MONTH -> start.toLocalDate().plusMonths(1).atStartOfDay(start.getZone());
        };
    }

    /**
     * Active user penceresinin başlangıcı: zaman serisinde period start - 6/29 gün,
     * aggregate display'de to'nun gün başı - 6/29 gün.
     */
    public Instant activeWindowStart(Period period, MathType math, DisplayMode display, ZonedDateTime to) {
        int lookBack = math.lookBackDays();
        if (display.isTimeSeries()) {
            return period.getStart().minusDays(lookBack).toInstant();
        }
        return to.toLocalDate().atStartOfDay(to.getZone()).minusDays(lookBack).toInstant();
    }

    /** Zamanın periyot listesindeki index'i (ikili arama); hiçbirine düşmüyorsa -1. */
    public static int indexOf(List<Period> periods, Instant instant) {
        int low = 0;
        int high = periods.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            Period period = periods.get(mid);
            if (instant.isBefore(period.getStart().toInstant())) {
                high = mid - 1;
            } else if (!instant.isBefore(period.upperBound())) {
                low = mid + 1;
            } else {
                return mid;
            }
        }
        return -1;
    }

    private static String label(ZonedDateTime start, Interval interval) {
        return interval == Interval.HOUR ? HOUR_LABEL.format(start) : DAY_LABEL.format(start);
    }

    private static String day(ZonedDateTime start, Interval interval) {
        return interval == Interval.HOUR ? HOUR_DAY.format(start) : start.toLocalDate().toString();
    }
}
