package com.baykanat.insider.insights.domain.service;

import com.baykanat.insider.insights.domain.exception.InsightValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tarih ifadelerini çözer: ISO tarih ("2024-01-31"), ISO datetime (offset'li veya yerel),
 * göreli ofsetler ("-7d", "-24h", "-30M", "-2w", "-3m", "-1q", "-1y") ve
 * birim başlangıç/bitiş son ekleri ("-1dStart", "mStart", "-1mEnd").
 */
@Component
@RequiredArgsConstructor
public class RelativeDateParser {

    public static final String ALL_TIME = "all";

    private static final Pattern RELATIVE = Pattern.compile("^-?(\\d*)([hdwmqyM])(Start|End)?$");

    private final Clock clock;

    public ZonedDateTime now(ZoneId zone) {
        return ZonedDateTime.now(clock.withZone(zone));
    }

    /**
     * İfadeyi zone içinde çözer. Yalnızca tarih içeren ifadeler ve gün seviyesindeki göreli ofsetler
     * aralık sonu olarak kullanılıyorsa günün son mikrosaniyesine, başı olarak kullanılıyorsa gün başına yerleşir.
     * Saat ve dakika ofsetleri kesilmez.
     */
    public ZonedDateTime parse(String expression, ZoneId zone, boolean endOfRange) {
        String text = expression.trim();
        Matcher matcher = RELATIVE.matcher(text);
        if (matcher.matches()) {
            return relative(matcher, zone, endOfRange);
        }
        try {
            return OffsetDateTime.parse(text).atZoneSameInstant(zone);
        } catch (DateTimeParseException e) {
            return parseLocal(text, zone, endOfRange, e);
        }
    }

    private ZonedDateTime parseLocal(String text, ZoneId zone, boolean endOfRange, DateTimeParseException cause) {
        if (text.length() > 10) {
            try {
                return LocalDateTime.parse(text).atZone(zone);
            } catch (DateTimeParseException e) {
                throw new InsightValidationException("Unparseable date: '" + text + "'", e);
            }
        }
        try {
            LocalDate date = LocalDate.parse(text);
            return endOfRange ? endOfDay(date.atStartOfDay(zone)) : date.atStartOfDay(zone);
        } catch (DateTimeParseException e) {
            throw new InsightValidationException("Unparseable date: '" + text + "'", cause);
        }
    }

    private ZonedDateTime relative(Matcher matcher, ZoneId zone, boolean endOfRange) {
        String amountText = matcher.group(1);
        long amount = amountText.isEmpty() ? 0 : Long.parseLong(amountText);
        String unit = matcher.group(2);
        String anchor = matcher.group(3);

        ZonedDateTime now = now(zone);
        ZonedDateTime shifted = switch (unit) {
            case "M" -> now.minusMinutes(amount);
            case "h" -> now.minusHours(amount);
            case "d" -> now.minusDays(amount);
            case "w" -> now.minusWeeks(amount);
            case "m" -> now.minusMonths(amount);
            case "q" -> now.minusMonths(amount * 3);
            case "y" -> now.minusYears(amount);
            default -> throw new InsightValidationException("Unknown relative date unit: " + unit);
        };
        if (anchor == null) {
            if (unit.equals("M") || unit.equals("h")) {
                return shifted;
            }
            ZonedDateTime dayStart = shifted.truncatedTo(ChronoUnit.DAYS);
            return endOfRange ? endOfDay(dayStart) : dayStart;
        }
        ZonedDateTime start = startOfUnit(shifted, unit);
        if (anchor.equals("Start")) {
            return start;
        }
        ZonedDateTime nextStart = switch (unit) {
            case "M" -> start.plusMinutes(1);
            case "h" -> start.plusHours(1);
            case "d" -> start.plusDays(1);
            case "w" -> start.plusWeeks(1);
            case "m" -> start.plusMonths(1);
            case "q" -> start.plusMonths(3);
            default -> start.plusYears(1);
        };
        return nextStart.minus(1, ChronoUnit.MICROS);
    }

    private static ZonedDateTime startOfUnit(ZonedDateTime value, String unit) {
        return switch (unit) {
            case "M" -> value.truncatedTo(ChronoUnit.MINUTES);
            case "h" -> value.truncatedTo(ChronoUnit.HOURS);
            case "d" -> value.truncatedTo(ChronoUnit.DAYS);
            case "w" -> value.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).truncatedTo(ChronoUnit.DAYS);
            case "m" -> value.with(TemporalAdjusters.firstDayOfMonth()).truncatedTo(ChronoUnit.DAYS);
            case "q" -> value.withMonth(((value.getMonthValue() - 1) / 3) * 3 + 1)
                    .with(TemporalAdjusters.firstDayOfMonth()).truncatedTo(ChronoUnit.DAYS);
            default -> value.with(TemporalAdjusters.firstDayOfYear()).truncatedTo(ChronoUnit.DAYS);
        };
    }

    static ZonedDateTime endOfDay(ZonedDateTime dayStart) {
        return dayStart.toLocalDate().plusDays(1).atStartOfDay(dayStart.getZone()).minus(1, ChronoUnit.MICROS);
    }
}
