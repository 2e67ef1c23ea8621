package io.github.smtpstub.mail;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static io.github.smtpstub.utils.AppUtils.joinEndLine;
import static io.github.smtpstub.utils.AppUtils.utf8raw;

/**
 * Header lines and body of a message received through DATA.
 */
public class MessageContent
{
    private final List<String> headers;
    private final byte[] body;

    public MessageContent(final List<String> headers, final byte[] body)
    {
        this.headers = Collections.unmodifiableList(new ArrayList<>(headers));
        this.body = body.clone();
    }

    /**
     * Splits the lines of a dot-terminated block at the first blank line.
     * <p>
     * Lines before it are headers, taken verbatim. The blank line itself is
     * dropped. Every later line, blank or not, goes to the body followed by CRLF.
     *
     * @param lines block content without the terminating dot
     * @return the split message
     */
    public static MessageContent parse(final List<String> lines)
    {
        final List<String> headers = new ArrayList<>();
        final ByteArrayOutputStream body = new ByteArrayOutputStream();

        boolean inBody = false;
        for(final String line: lines)
        {
            if( ! inBody && line.trim().isEmpty())
            {
                inBody = true;
                continue;
            }

            if(inBody)
            {
                body.writeBytes(joinEndLine(utf8raw(line)));
            } else
            {
                headers.add(line);
            }
        }

        return new MessageContent(headers, body.toByteArray());
    }

    public List<String> getHeaders()
    {
        return headers;
    }

    public byte[] getBody()
    {
        return body.clone();
    }

}
