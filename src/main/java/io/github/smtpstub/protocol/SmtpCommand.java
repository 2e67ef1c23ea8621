package io.github.smtpstub.protocol;

import java.io.IOException;

@FunctionalInterface
public interface SmtpCommand
{
    /**
     * @param session connection the command arrived on
     * @param statement the full line as received
     * @throws IOException when the connection fails, which ends the session
     */
    void execute(SmtpSession session, String statement) throws IOException;
}
