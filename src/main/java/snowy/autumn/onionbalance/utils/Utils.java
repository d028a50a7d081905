package snowy.autumn.onionbalance.utils;

import org.bouncycastle.util.encoders.Base32;
import org.bouncycastle.util.encoders.DecoderException;
import snowy.autumn.onionbalance.InvalidEncodingException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

public class Utils {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    public static ZonedDateTime getCurrentTime() {
        return Instant.now().atZone(ZoneOffset.UTC);
    }

    /**
     Formats the given instant in UTC, rounded down to the hour.
     **/
    public static String roundedTimestamp(Instant timestamp) {
        return TIMESTAMP_FORMAT.format(timestamp.truncatedTo(ChronoUnit.HOURS));
    }

    public static String roundedTimestamp() {
        return roundedTimestamp(getCurrentTime().toInstant());
    }

    public static long parseDate(String date) {
        try {
            return LocalDateTime.parse(date, TIMESTAMP_FORMAT).toEpochSecond(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidEncodingException("Invalid timestamp '" + date + "'.", e);
        }
    }

    public static String base32(byte[] data) {
        return new String(Base32.encode(data), StandardCharsets.US_ASCII).toLowerCase(Locale.ROOT);
    }

    /**
     Decodes RFC 4648 base32 in either case. Input must be a whole number of 8 character blocks.
     **/
    public static byte[] base32Decode(String encoded) {
        if (encoded.length() % 8 != 0)
            throw new InvalidEncodingException("Base32 input '" + encoded + "' is not a multiple of 8 characters.");
        try {
            return Base32.decode(encoded.toUpperCase(Locale.ROOT));
        } catch (DecoderException e) {
            throw new InvalidEncodingException("Invalid base32 input '" + encoded + "'.", e);
        }
    }

}
