package com.salesBoard.biAgent.resilience.normalizer;

import com.salesBoard.biAgent.resilience.model.FieldValue;
import com.salesBoard.biAgent.resilience.model.IssueKind;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Calendar dates in the many shapes boards export them.
 * 
 * Patterns are tried in order and the first successful parse wins. US month-first dates come
 * before European day-first ones, so {@code 05/06/2024} reads as May 6 while
 * {@code 15/01/2024} falls through to the European pattern.
 */
@Slf4j
public class DateNormalizer implements FieldNormalizer<LocalDate> {

    private static final int MIN_YEAR = 1900;
    private static final int MAX_YEAR = 2100;
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;
    private static final Pattern EPOCH_DIGITS = Pattern.compile("\\d{9,13}");

    private static final List<Function<String, LocalDate>> PARSERS = List.of(
            text -> LocalDate.parse(text, strict("uuuu-MM-dd")),
            text -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toLocalDate(),
            text -> LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toLocalDate(),
            text -> LocalDate.parse(text, strict("MM/dd/uuuu")),
            text -> LocalDate.parse(text, strict("dd/MM/uuuu")),
            text -> LocalDate.parse(text, strict("dd-MMM-uuuu")),
            text -> LocalDate.parse(text, strict("MMMM d, uuuu")),
            text -> LocalDate.parse(text, strict("MMM d, uuuu")),
            text -> LocalDate.parse(text, strict("d MMMM uuuu")),
            text -> LocalDate.parse(text, strict("MM-dd-uuuu")),
            text -> LocalDate.parse(text, strict("uuuu/MM/dd")),
            text -> LocalDate.parse(text, strict("dd.MM.uuuu")),
            text -> LocalDate.parse(text, DateTimeFormatter.BASIC_ISO_DATE.withResolverStyle(ResolverStyle.STRICT))
    );

    @Override
    public FieldValue<LocalDate> normalize(Object rawValue) {
        if (rawValue instanceof LocalDate) {
            return checkRange(rawValue, (LocalDate) rawValue);
        }
        if (rawValue instanceof Number) {
            return fromEpoch(rawValue, ((Number) rawValue).longValue());
        }

        String text = RawValues.presentText(rawValue);
        if (text == null) {
            return FieldValue.invalid(rawValue, IssueKind.MISSING_FIELD, "no value");
        }

        for (Function<String, LocalDate> parser : PARSERS) {
            try {
                return checkRange(rawValue, parser.apply(text));
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' does not match pattern: {}", text, e.getMessage());
            }
        }

        if (EPOCH_DIGITS.matcher(text).matches()) {
            return fromEpoch(rawValue, Long.parseLong(text));
        }
        return FieldValue.invalid(rawValue, IssueKind.INVALID_FORMAT, "unrecognized date: '" + text + "'");
    }

    /**
     * Unix epoch in seconds, or in milliseconds for values of 10^11 and above.
     */
    private static FieldValue<LocalDate> fromEpoch(Object rawValue, long epoch) {
        try {
            Instant instant = Math.abs(epoch) >= EPOCH_MILLIS_THRESHOLD
                    ? Instant.ofEpochMilli(epoch)
                    : Instant.ofEpochSecond(epoch);
            return checkRange(rawValue, instant.atOffset(ZoneOffset.UTC).toLocalDate());
        } catch (DateTimeException e) {
            return FieldValue.invalid(rawValue, IssueKind.OUT_OF_RANGE, "epoch value " + epoch + " out of range");
        }
    }

    private static FieldValue<LocalDate> checkRange(Object rawValue, LocalDate date) {
        if (date.getYear() < MIN_YEAR || date.getYear() > MAX_YEAR) {
            return FieldValue.invalid(rawValue, IssueKind.OUT_OF_RANGE,
                    "year " + date.getYear() + " outside " + MIN_YEAR + "-" + MAX_YEAR);
        }
        return FieldValue.valid(rawValue, date);
    }

    private static DateTimeFormatter strict(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
