package org.javai.exprlang.lexer;

import static java.time.temporal.ChronoField.DAY_OF_MONTH;
import static java.time.temporal.ChronoField.HOUR_OF_DAY;
import static java.time.temporal.ChronoField.MINUTE_OF_HOUR;
import static java.time.temporal.ChronoField.MONTH_OF_YEAR;
import static java.time.temporal.ChronoField.NANO_OF_SECOND;
import static java.time.temporal.ChronoField.OFFSET_SECONDS;
import static java.time.temporal.ChronoField.SECOND_OF_MINUTE;
import static java.time.temporal.ChronoField.YEAR;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered timestamp formats tried against quoted literals. The first format that
 * parses the whole literal wins.
 * <p>
 * Formats, in priority order:
 * <ol>
 * <li>ANSIC: {@code EEE MMM ppd HH:mm:ss uuuu} ({@code Mon Jan  2 15:04:05 2006})</li>
 * <li>Unix date: {@code EEE MMM ppd HH:mm:ss zzz uuuu} ({@code Mon Jan  2 15:04:05 MST 2006})</li>
 * <li>Ruby date: {@code EEE MMM dd HH:mm:ss xx uuuu} ({@code Mon Jan 02 15:04:05 -0700 2006})</li>
 * <li>Kitchen: {@code h:mma} ({@code 3:04PM}), dated 0000-01-01</li>
 * <li>RFC 3339, with or without fractional seconds: {@link DateTimeFormatter#ISO_OFFSET_DATE_TIME}
 * ({@code 2006-01-02T15:04:05Z07:00}, {@code 2006-01-02T15:04:05.999999999Z07:00})</li>
 * <li>Date: {@code uuuu-MM-dd}</li>
 * <li>Date with minutes: {@code uuuu-MM-dd HH:mm}</li>
 * <li>Date with seconds: {@code uuuu-MM-dd HH:mm:ss}</li>
 * <li>Date with seconds and offset: {@code uuuu-MM-dd HH:mm:ssxxx}</li>
 * <li>ISO 8601 hour: {@code uuuu-MM-dd'T'HHXX}</li>
 * <li>ISO 8601 minutes: {@code uuuu-MM-dd'T'HH:mmXX}</li>
 * <li>ISO 8601 seconds: {@code uuuu-MM-dd'T'HH:mm:ssXX}</li>
 * <li>ISO 8601 nanoseconds: {@code uuuu-MM-dd'T'HH:mm:ss} plus an optional fraction of up
 * to nine digits, then {@code XX}</li>
 * </ol>
 * Texts that carry no offset or zone are placed in the zone passed to {@link #parse}.
 * The day-of-week name in the first three formats must be spelled correctly but is not
 * checked against the date.
 */
public final class TimestampFormats {

	/**
	 * One entry of the format list.
	 *
	 * @param name short profile name
	 * @param pattern the literal pattern the formatter was built from
	 * @param formatter the formatter used for parsing
	 */
	public record TimestampFormat(String name, String pattern, DateTimeFormatter formatter) {
	}

	private static final List<TimestampFormat> FORMATS = List.of(
		ignoringWeekday("ANSIC", "EEE MMM ppd HH:mm:ss uuuu"),
		ignoringWeekday("UnixDate", "EEE MMM ppd HH:mm:ss zzz uuuu"),
		ignoringWeekday("RubyDate", "EEE MMM dd HH:mm:ss xx uuuu"),
		new TimestampFormat("Kitchen", "h:mma", builder("h:mma")
				.parseDefaulting(YEAR, 0)
				.parseDefaulting(MONTH_OF_YEAR, 1)
				.parseDefaulting(DAY_OF_MONTH, 1)
				.toFormatter(Locale.US)
				.withResolverStyle(ResolverStyle.STRICT)),
		new TimestampFormat("RFC3339", "ISO_OFFSET_DATE_TIME", DateTimeFormatter.ISO_OFFSET_DATE_TIME),
		withDefaultTime("Date", "uuuu-MM-dd"),
		pattern("DateMinutes", "uuuu-MM-dd HH:mm"),
		pattern("DateSeconds", "uuuu-MM-dd HH:mm:ss"),
		pattern("DateSecondsOffset", "uuuu-MM-dd HH:mm:ssxxx"),
		new TimestampFormat("ISO8601Hour", "uuuu-MM-dd'T'HHXX", builder("uuuu-MM-dd'T'HHXX")
				.parseDefaulting(MINUTE_OF_HOUR, 0)
				.toFormatter(Locale.US)
				.withResolverStyle(ResolverStyle.STRICT)),
		pattern("ISO8601Minutes", "uuuu-MM-dd'T'HH:mmXX"),
		pattern("ISO8601Seconds", "uuuu-MM-dd'T'HH:mm:ssXX"),
		new TimestampFormat("ISO8601Nanos", "uuuu-MM-dd'T'HH:mm:ss.fffffffffXX", new DateTimeFormatterBuilder()
				.appendPattern("uuuu-MM-dd'T'HH:mm:ss")
				.appendFraction(NANO_OF_SECOND, 0, 9, true)
				.appendPattern("XX")
				.toFormatter(Locale.US)
				.withResolverStyle(ResolverStyle.STRICT))
	);

	private TimestampFormats() {
		// Utility class - no instantiation
	}

	public static List<TimestampFormat> formats() {
		return FORMATS;
	}

	/**
	 * Attempts each format in order.
	 *
	 * @param candidate the decoded text of a quoted literal
	 * @param zone zone for texts that carry no offset
	 * @return the first successful parse, or empty if no format matches
	 */
	public static Optional<ZonedDateTime> parse(String candidate, ZoneId zone) {
		Objects.requireNonNull(zone, "zone must not be null");
		if (candidate == null || candidate.isBlank()) {
			return Optional.empty();
		}
		for (TimestampFormat format : FORMATS) {
			Optional<ZonedDateTime> parsed = tryParse(candidate, format.formatter(), zone);
			if (parsed.isPresent()) {
				return parsed;
			}
		}
		return Optional.empty();
	}

	private static Optional<ZonedDateTime> tryParse(String candidate, DateTimeFormatter formatter, ZoneId zone) {
		try {
			TemporalAccessor parsed = formatter.parse(candidate);
			if (parsed.query(TemporalQueries.zone()) != null) {
				return Optional.of(ZonedDateTime.from(parsed));
			}
			return Optional.of(LocalDateTime.from(parsed).atZone(zone));
		} catch (DateTimeException e) {
			return Optional.empty();
		}
	}

	private static TimestampFormat pattern(String name, String pattern) {
		return new TimestampFormat(name, pattern, builder(pattern)
				.toFormatter(Locale.US)
				.withResolverStyle(ResolverStyle.STRICT));
	}

	/**
	 * Day-of-week text is parsed but left out of resolution, so a wrong weekday does not reject the date.
	 */
	private static TimestampFormat ignoringWeekday(String name, String pattern) {
		return new TimestampFormat(name, pattern, builder(pattern)
				.toFormatter(Locale.US)
				.withResolverStyle(ResolverStyle.STRICT)
				.withResolverFields(YEAR, MONTH_OF_YEAR, DAY_OF_MONTH, HOUR_OF_DAY, MINUTE_OF_HOUR,
						SECOND_OF_MINUTE, OFFSET_SECONDS));
	}

	private static TimestampFormat withDefaultTime(String name, String pattern) {
		return new TimestampFormat(name, pattern, builder(pattern)
				.parseDefaulting(HOUR_OF_DAY, 0)
				.parseDefaulting(MINUTE_OF_HOUR, 0)
				.parseDefaulting(SECOND_OF_MINUTE, 0)
				.toFormatter(Locale.US)
				.withResolverStyle(ResolverStyle.STRICT));
	}

	private static DateTimeFormatterBuilder builder(String pattern) {
		return new DateTimeFormatterBuilder().appendPattern(pattern);
	}
}
