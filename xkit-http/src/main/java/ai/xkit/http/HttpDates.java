/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.xkit.http;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Parsing and formatting of HTTP dates, as used by the Date, Expires, Last-Modified and
 * Retry-After headers.
 *
 * <p>Three formats are accepted when parsing, all of them in GMT:
 *
 * <ul>
 *   <li>IMF-fixdate: {@code Sun, 06 Nov 1994 08:49:37 GMT}, optionally with fractional seconds
 *   <li>RFC 850: {@code Sunday, 06-Nov-94 08:49:37 GMT}
 *   <li>ANSI C asctime: {@code Sun Nov  6 08:49:37 1994}
 * </ul>
 *
 * See https://datatracker.ietf.org/doc/html/rfc9110#section-5.6.7
 */
public final class HttpDates {

    private static final DateTimeFormatter IMF_FIXDATE =
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern("EEE, dd MMM uuuu HH:mm:ss")
                    .optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
                    .optionalEnd()
                    .appendLiteral(" GMT")
                    .toFormatter(Locale.US);

    private static final DateTimeFormatter RFC_850 =
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern("EEEE, dd-MMM-")
                    .appendValueReduced(ChronoField.YEAR, 2, 2, 1969)
                    .appendPattern(" HH:mm:ss")
                    .appendLiteral(" GMT")
                    .toFormatter(Locale.US);

    private static final DateTimeFormatter ASCTIME =
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern("EEE MMM ppd HH:mm:ss uuuu")
                    .toFormatter(Locale.US);

    // the day name must be a valid one but is not checked against the date
    private static final List<DateTimeFormatter> PARSERS =
            Stream.of(IMF_FIXDATE, RFC_850, ASCTIME)
                    .map(
                            parser ->
                                    parser.withResolverFields(
                                            ChronoField.YEAR,
                                            ChronoField.MONTH_OF_YEAR,
                                            ChronoField.DAY_OF_MONTH,
                                            ChronoField.HOUR_OF_DAY,
                                            ChronoField.MINUTE_OF_HOUR,
                                            ChronoField.SECOND_OF_MINUTE,
                                            ChronoField.NANO_OF_SECOND))
                    .toList();

    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern("EEE, dd MMM uuuu HH:mm:ss 'GMT'", Locale.US)
                    .withZone(ZoneOffset.UTC);

    private HttpDates() {}

    /**
     * Parses an HTTP date.
     *
     * @param value the header value
     * @return the instant it denotes
     * @throws DateTimeParseException if the value matches none of the accepted formats
     */
    public static Instant parse(String value) {
        Objects.requireNonNull(value, "value cannot be null");
        final String trimmed = value.trim();
        DateTimeParseException error = null;
        for (DateTimeFormatter parser : PARSERS) {
            try {
                return LocalDateTime.parse(trimmed, parser).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                if (error == null) {
                    error = e;
                }
            }
        }
        throw new DateTimeParseException("Cannot parse HTTP date '" + value + "'", value, 0, error);
    }

    /** Formats the instant as an IMF-fixdate, dropping any fraction of second. */
    public static String format(Instant instant) {
        return FORMATTER.format(instant);
    }
}
