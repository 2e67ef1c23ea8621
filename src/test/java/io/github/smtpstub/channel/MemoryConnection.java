package io.github.smtpstub.channel;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Scripted client: replays the given input and records everything written.
 */
public class MemoryConnection implements Connection
{
    private final InputStream in;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private int closeCount = 0;

    public MemoryConnection(final String input)
    {
        this.in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public InputStream input() throws IOException
    {
        if(isClosed())
        {
            throw new IOException("closed");
        }
        return in;
    }

    @Override
    public OutputStream output() throws IOException
    {
        if(isClosed())
        {
            throw new IOException("closed");
        }
        return out;
    }

    @Override
    public void close()
    {
        closeCount++;
    }

    @Override
    public boolean isClosed()
    {
        return closeCount > 0;
    }

    @Override
    public String remoteAddress()
    {
        return "memory";
    }

    public String written()
    {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    public void clearWritten()
    {
        out.reset();
    }

    public int getCloseCount()
    {
        return closeCount;
    }

}
