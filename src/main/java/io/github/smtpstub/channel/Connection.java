package io.github.smtpstub.channel;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Bidirectional byte stream of one accepted client.
 */
public interface Connection extends Closeable
{
    InputStream input() throws IOException;

    OutputStream output() throws IOException;

    /**
     * Closes the transport. Calls after the first one do nothing.
     */
    @Override
    void close() throws IOException;

    boolean isClosed();

    String remoteAddress();
}
