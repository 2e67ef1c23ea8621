package io.github.smtpstub.mail;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Envelope accumulated by one connection.
 * <p>
 * Owned by a single session and never shared between threads.
 */
public class SessionState
{
    private String greetingVerb = "";
    private String serverName = "";
    private String clientName = "";

    private String returnPath = "";
    private final List<String> recipients = new ArrayList<>();
    private final List<String> headers = new ArrayList<>();
    private final ByteArrayOutputStream body = new ByteArrayOutputStream();

    public SessionState()
    {
    }

    public SessionState(final String serverName)
    {
        this.serverName = serverName;
    }

    public boolean hasStarted()
    {
        return ! greetingVerb.isEmpty();
    }

    /**
     * Drops the envelope, keeping the identities exchanged at greeting.
     */
    public void reset()
    {
        this.returnPath = "";
        this.recipients.clear();
        this.headers.clear();
        this.body.reset();
    }

    public String getGreetingVerb()
    {
        return greetingVerb;
    }

    public void setGreetingVerb(final String greetingVerb)
    {
        this.greetingVerb = greetingVerb;
    }

    public String getServerName()
    {
        return serverName;
    }

    public void setServerName(final String serverName)
    {
        this.serverName = serverName;
    }

    public String getClientName()
    {
        return clientName;
    }

    public void setClientName(final String clientName)
    {
        this.clientName = clientName;
    }

    public String getReturnPath()
    {
        return returnPath;
    }

    public void setReturnPath(final String returnPath)
    {
        this.returnPath = returnPath;
    }

    public List<String> getRecipients()
    {
        return Collections.unmodifiableList(recipients);
    }

    public void addRecipient(final String recipient)
    {
        this.recipients.add(recipient);
    }

    public List<String> getHeaders()
    {
        return Collections.unmodifiableList(headers);
    }

    public byte[] getBody()
    {
        return body.toByteArray();
    }

    /**
     * Replaces headers and body with a freshly received message.
     */
    public void setContent(final MessageContent content)
    {
        this.headers.clear();
        this.headers.addAll(content.getHeaders());

        this.body.reset();
        this.body.writeBytes(content.getBody());
    }

    @Override
    public String toString()
    {
        return SessionRenderer.render(this);
    }

}
