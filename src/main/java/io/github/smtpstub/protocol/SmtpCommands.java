package io.github.smtpstub.protocol;

import java.io.IOException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.github.smtpstub.mail.MessageContent;
import io.github.smtpstub.mail.SessionState;

/**
 * Handlers of the supported verbs.
 * Protocol errors are answered with a 550 reply and leave the state untouched.
 */
public final class SmtpCommands
{
    static final Pattern MAIL_FROM = Pattern.compile("^MAIL FROM: *<([^>]+)> *$");
    static final Pattern RCPT_TO = Pattern.compile("^RCPT TO: *<([^>]+)> *$");

    private SmtpCommands()
    {
    }

    public static void hello(final SmtpSession session, final String statement) throws IOException
    {
        final SessionState state = session.state();
        if(state.hasStarted())
        {
            session.send(SmtpReply.SESSION_STARTED);
            return;
        }

        final String[] args = statement.trim().split(" ", 2);
        if(args.length < 2)
        {
            session.send(SmtpReply.HELLO_SYNTAX);
            return;
        }

        state.setGreetingVerb(args[0]);
        state.setClientName(args[1]);

        session.send(
            SmtpReply.OK.continued(state.getServerName()),
            SmtpReply.OK.continued("AUTH PLAIN"),
            SmtpReply.OK.with("HELP")
        );
    }

    public static void mailFrom(final SmtpSession session, final String statement) throws IOException
    {
        if( ! session.state().hasStarted())
        {
            session.send(SmtpReply.SESSION_NOT_STARTED);
            return;
        }

        final Matcher matcher = MAIL_FROM.matcher(statement);
        if( ! matcher.matches())
        {
            session.send(SmtpReply.MAIL_SYNTAX);
            return;
        }

        session.state().setReturnPath(matcher.group(1));
        session.send(SmtpReply.OK);
    }

    // A missing MAIL FROM is accepted.
    public static void rcptTo(final SmtpSession session, final String statement) throws IOException
    {
        if( ! session.state().hasStarted())
        {
            session.send(SmtpReply.SESSION_NOT_STARTED);
            return;
        }

        final Matcher matcher = RCPT_TO.matcher(statement);
        if( ! matcher.matches())
        {
            session.send(SmtpReply.RCPT_SYNTAX);
            return;
        }

        session.state().addRecipient(matcher.group(1));
        session.send(SmtpReply.OK);
    }

    public static void rset(final SmtpSession session, final String statement) throws IOException
    {
        session.state().reset();
        session.send(SmtpReply.OK);
    }

    public static void verify(final SmtpSession session, final String statement) throws IOException
    {
        session.send(SmtpReply.VRFY_NOT_SUPPORTED);
    }

    public static void noop(final SmtpSession session, final String statement) throws IOException
    {
        session.send(SmtpReply.OK);
    }

    /**
     * Prompts with 250 and reads the message up to the lone dot.
     * No reply follows the block. Headers and body are stored only once
     * the whole block has been read.
     */
    public static void data(final SmtpSession session, final String statement) throws IOException
    {
        session.send(SmtpReply.OK);

        final List<String> lines = session.readDotLines();

        session.state().setContent(MessageContent.parse(lines));
    }

    /**
     * Closes the connection first, then tries to say goodbye.
     * On a real socket the farewell usually fails, ending the session as an I/O error.
     */
    public static void quit(final SmtpSession session, final String statement) throws IOException
    {
        session.quit();
        session.send(SmtpReply.BYE);
    }

}
