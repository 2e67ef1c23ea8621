package io.github.smtpstub.protocol;

import java.io.IOException;
import java.util.List;

import io.github.smtpstub.channel.LineChannel;
import io.github.smtpstub.mail.SessionState;

/**
 * What a command handler sees of its connection: the line channel,
 * the envelope and the means to end the session.
 */
public class SmtpSession
{
    public enum Phase {
        AWAITING_GREETING,
        ESTABLISHED,
        CLOSED
    }

    private final LineChannel channel;
    private final SessionState state;

    private boolean quit = false;

    public SmtpSession(final LineChannel channel, final SessionState state)
    {
        this.channel = channel;
        this.state = state;
    }

    public SessionState state()
    {
        return state;
    }

    public Phase phase()
    {
        if(channel.getConnection().isClosed())
        {
            return Phase.CLOSED;
        }

        return state.hasStarted() ? Phase.ESTABLISHED : Phase.AWAITING_GREETING;
    }

    public String readLine() throws IOException
    {
        return channel.readLine();
    }

    public List<String> readDotLines() throws IOException
    {
        return channel.readMultilineUntilDot();
    }

    public void send(final Object... lines) throws IOException
    {
        final String[] raw = new String[lines.length];
        for(int i = 0; i < lines.length; i++)
        {
            raw[i] = lines[i].toString();
        }

        channel.writeLines(raw);
    }

    /**
     * Closes the connection. Anything sent afterwards fails.
     */
    public void quit() throws IOException
    {
        this.quit = true;
        channel.getConnection().close();
    }

    public boolean hasQuit()
    {
        return quit;
    }

    public boolean isClosed()
    {
        return phase() == Phase.CLOSED;
    }

}
