package io.github.smtpstub.server;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

public abstract class BaseTest {
    static final Charset ASCII = StandardCharsets.US_ASCII;

    void request(final OutputStream out, final String request) throws IOException {
        out.write(request.getBytes(ASCII));
        out.flush();
    }

    /**
     * Reads one reply, following continuation lines up to the final one.
     * Returns what was read so far when the server closes the stream.
     */
    String content(final InputStream in) throws IOException {
        final ByteArrayOutputStream line = new ByteArrayOutputStream();
        final ByteArrayOutputStream data = new ByteArrayOutputStream();

        int byte0 = 0;
        int byte1 = 0;
        int reader = -1;
        while((reader = in.read()) != -1) {
            byte0 = byte1;
            byte1 = reader;

            if(byte1 == '\r') continue;

            if(byte0 == '\r' && byte1 == '\n')
            {
                final byte[] raw = line.toByteArray();
                final boolean end = raw.length < 4 || raw[3] == ' ';

                if(!end)
                {
                    line.write('\r');
                    line.write('\n');
                }

                data.write(line.toByteArray());
                line.reset();

                if(!end)
                    continue;
                else
                    break;
            }

            line.write(reader);
        }

        return new String(data.toByteArray(), ASCII);
    }

}
