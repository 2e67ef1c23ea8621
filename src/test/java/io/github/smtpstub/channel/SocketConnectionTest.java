package io.github.smtpstub.channel;

import java.io.IOException;
import java.net.Socket;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class SocketConnectionTest {

    static class CountingSocket extends Socket {
        int closes = 0;

        @Override
        public synchronized void close() throws IOException
        {
            closes++;
            super.close();
        }
    }

    @Test
    public void closeReachesSocketOnce() throws Exception
    {
        final CountingSocket socket = new CountingSocket();
        final SocketConnection connection = new SocketConnection(socket);

        Assertions.assertFalse(connection.isClosed());

        connection.close();
        connection.close();

        Assertions.assertTrue(connection.isClosed());
        Assertions.assertEquals(1, socket.closes);
    }

    @Test
    public void unconnectedSocketHasUnknownPeer()
    {
        final SocketConnection connection = new SocketConnection(new Socket());

        Assertions.assertEquals("unknown", connection.remoteAddress());
    }

}
