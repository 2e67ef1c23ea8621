package io.github.smtpstub.channel;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

public class SocketConnection implements Connection
{
    private final Socket socket;

    private InputStream is;
    private OutputStream os;

    private boolean closed = false;

    public SocketConnection(final Socket socket)
    {
        this.socket = socket;
    }

    @Override
    public InputStream input() throws IOException
    {
        if(this.is == null)
        {
            this.is = new BufferedInputStream(socket.getInputStream());
        }
        return this.is;
    }

    @Override
    public OutputStream output() throws IOException
    {
        if(this.os == null)
        {
            this.os = new BufferedOutputStream(socket.getOutputStream());
        }
        return this.os;
    }

    @Override
    public void close() throws IOException
    {
        if(closed)
        {
            return;
        }

        closed = true;
        socket.close();
    }

    @Override
    public boolean isClosed()
    {
        return closed;
    }

    @Override
    public String remoteAddress()
    {
        return socket.getInetAddress() != null
            ? socket.getInetAddress().getHostAddress()
            : "unknown";
    }

}
