package io.github.smtpstub.utils;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoField;
import java.util.concurrent.ThreadLocalRandom;

public class AppUtils
{
    private AppUtils()
    {
    }

    /**
     * Text before the first space of the trimmed statement.
     */
    public static String leadingToken(final String statement)
    {
        final String trimmed = statement.trim();
        final int p = trimmed.indexOf(' ');

        return p < 0 ? trimmed : trimmed.substring(0, p);
    }

    public static byte[] joinEndLine(final byte[]... sources)
    {
        int size = 0;
        for(byte[] q: sources)
        {
            size += q.length;
        }

        final byte[] raw = new byte[size + 2];
        int c = 0;
        for(byte[] q: sources)
        {
            for(byte b: q)
            {
                raw[c++] = b;
            }
        }

        raw[c++] = '\r';
        raw[c++] = '\n';

        return raw;
    }

    public static byte[] utf8raw(final CharSequence content)
    {
        return content.toString().getBytes(StandardCharsets.UTF_8);
    }

    public static String hash()
    {
        final var currentTime = LocalDateTime.now();

        final long seconds = currentTime.atZone(ZoneOffset.UTC).toInstant().getEpochSecond();
        final long nano = currentTime.get(ChronoField.NANO_OF_SECOND);
        final int random = ThreadLocalRandom.current().nextInt(10000);

        return String.format("%d.N%d.R%04d", seconds, nano, random);
    }

}
