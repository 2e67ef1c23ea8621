package io.github.smtpstub.protocol;

import java.util.Map;
import java.util.Optional;

/**
 * Verb to handler mapping. Built once and never modified, so sessions share it freely.
 * Verbs are matched case-sensitively.
 */
public final class CommandTable
{
    private static final Map<String, SmtpCommand> COMMANDS = Map.of(
        "HELO", SmtpCommands::hello,
        "EHLO", SmtpCommands::hello,
        "MAIL", SmtpCommands::mailFrom,
        "RCPT", SmtpCommands::rcptTo,
        "RSET", SmtpCommands::rset,
        "VRFY", SmtpCommands::verify,
        "NOOP", SmtpCommands::noop,
        "QUIT", SmtpCommands::quit,
        "DATA", SmtpCommands::data
    );

    private CommandTable()
    {
    }

    public static Optional<SmtpCommand> lookup(final String verb)
    {
        return Optional.ofNullable(COMMANDS.get(verb));
    }

}
