package io.github.smtpstub.mail;

import java.nio.charset.StandardCharsets;

/**
 * Rebuilds the captured envelope as the command sequence that would have produced it.
 */
public final class SessionRenderer
{
    static final String CRLF = "\r\n";

    private SessionRenderer()
    {
    }

    public static String render(final SessionState state)
    {
        final StringBuilder rendered = new StringBuilder();

        rendered.append("MAIL FROM: <").append(state.getReturnPath()).append('>').append(CRLF);

        for(final String recipient: state.getRecipients())
        {
            rendered.append("RCPT TO: <").append(recipient).append('>').append(CRLF);
        }

        rendered.append("DATA").append(CRLF);

        for(final String header: state.getHeaders())
        {
            rendered.append(header).append(CRLF);
        }

        rendered.append(CRLF);
        rendered.append(new String(state.getBody(), StandardCharsets.UTF_8));

        return rendered.toString();
    }

}
