package io.github.smtpstub.protocol;

public enum SmtpReply {
    SERVICE_READY("220", "Simple Mail Transfer service ready"),
    BYE("221", "Bye"),
    OK("250", "OK"),
    SESSION_STARTED("550", "Session has started"),
    SESSION_NOT_STARTED("550", "Session has not started yet."),
    HELLO_SYNTAX("550", "Invalid syntax (EHLO|HELO) domain"),
    MAIL_SYNTAX("550", "Invalid syntax MAIL FROM: <foo@example.net>"),
    RCPT_SYNTAX("550", "Invalid syntax RCPT TO: <foo@example.net>"),
    VRFY_NOT_SUPPORTED("550", "VRFY not supported"),
    EMPTY_COMMAND("550", "Command must not be empty"),
    NOT_RECOGNIZED("550", "Command not recognized")
    ;

    private String code;
    private String message;

    private SmtpReply(final String code, final String message)
    {
        this.code = code;
        this.message = message;
    }

    public String code()
    {
        return this.code;
    }

    public String message()
    {
        return this.message;
    }

    public String toString()
    {
        return String.format("%s %s", code(), message());
    }

    /**
     * Continuation line of a multi-line reply carrying this reply's code.
     */
    public String continued(final String text)
    {
        return String.format("%s-%s", code(), text);
    }

    public String with(final String text)
    {
        return String.format("%s %s", code(), text);
    }
}
