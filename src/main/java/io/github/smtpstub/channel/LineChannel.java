package io.github.smtpstub.channel;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.jboss.logging.Logger;

import static io.github.smtpstub.utils.AppUtils.joinEndLine;
import static io.github.smtpstub.utils.AppUtils.utf8raw;

/**
 * CRLF framed text lines over a {@link Connection}.
 */
public class LineChannel
{
    private final Logger logger = Logger.getLogger(getClass());

    static final String END_OF_DATA = ".";

    private final Connection connection;
    private final String tag;

    public LineChannel(final Connection connection, final String tag)
    {
        this.connection = connection;
        this.tag = tag;
    }

    public Connection getConnection()
    {
        return connection;
    }

    /**
     * Blocks until a whole line arrives and returns it without its terminator.
     *
     * @throws EOFException if the peer closes before the line is complete
     */
    public String readLine() throws IOException
    {
        final String line = nextLine();
        logger.infof("[%s] C: %s", tag, line);
        return line;
    }

    /**
     * Reads lines up to a lone dot, which is consumed and not returned.
     * A leading dot on any other line is removed.
     */
    public List<String> readMultilineUntilDot() throws IOException
    {
        final List<String> lines = new ArrayList<>();

        while(true)
        {
            final String line = nextLine();
            if(END_OF_DATA.equals(line))
            {
                break;
            }

            lines.add(line.startsWith(END_OF_DATA) ? line.substring(1) : line);
        }

        logger.infof("[%s] C: <%d data lines>", tag, lines.size());
        logger.infof("[%s] C: %s", tag, END_OF_DATA);

        return lines;
    }

    /**
     * Writes each line followed by CRLF, then flushes.
     * A failure may leave part of the batch on the wire.
     */
    public void writeLines(final String... lines) throws IOException
    {
        ensureOpen();

        final OutputStream os = connection.output();
        for(final String line: lines)
        {
            logger.infof("[%s] S: %s", tag, line);
            os.write(joinEndLine(utf8raw(line)));
        }
        os.flush();
    }

    private String nextLine() throws IOException
    {
        ensureOpen();

        final InputStream is = connection.input();
        final ByteArrayOutputStream st = new ByteArrayOutputStream();

        int reader = -1;
        while((reader = is.read()) != -1)
        {
            if(reader == '\n')
            {
                final byte[] raw = st.toByteArray();
                final int length = raw.length > 0 && raw[raw.length - 1] == '\r'
                    ? raw.length - 1
                    : raw.length;

                return new String(raw, 0, length, StandardCharsets.UTF_8);
            }

            st.write(reader);
        }

        throw new EOFException("Connection closed by client");
    }

    private void ensureOpen() throws IOException
    {
        if(connection.isClosed())
        {
            throw new IOException("Connection already closed");
        }
    }

}
