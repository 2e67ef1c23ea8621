package io.github.smtpstub.workers;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

import org.jboss.logging.Logger;

import io.github.smtpstub.channel.Connection;
import io.github.smtpstub.channel.LineChannel;
import io.github.smtpstub.mail.SessionState;
import io.github.smtpstub.protocol.CommandTable;
import io.github.smtpstub.protocol.SmtpCommand;
import io.github.smtpstub.protocol.SmtpReply;
import io.github.smtpstub.protocol.SmtpSession;

import static io.github.smtpstub.utils.AppUtils.leadingToken;

/**
 * Drives one connection from greeting to close, one command at a time.
 */
public class SmtpWorker implements Runnable {
    private final Logger logger = Logger.getLogger(getClass());

    private final UUID sessionId;

    private final Connection connection;
    private final SmtpSession session;

    public SmtpWorker(final Connection connection, final String serverName, final UUID id)
    {
        this.connection = connection;
        this.sessionId = id;

        final LineChannel channel = new LineChannel(connection, id.toString());
        this.session = new SmtpSession(channel, new SessionState(serverName));
    }

    private Consumer<SessionState> sessionConsumer = state -> {};
    public SmtpWorker setSessionConsumer(final Consumer<SessionState> sessionConsumer)
    {
        this.sessionConsumer = sessionConsumer;
        return this;
    }

    public SmtpSession getSession()
    {
        return session;
    }

    public void run()
    {
        processRequest();
    }

    private void processRequest() {
        try {
            process();
        } catch (IOException failure) {
            if(session.hasQuit())
            {
                logger.debugf("[%s] (processRequest) session ended after QUIT: %s",
                    sessionId,
                    failure.getMessage());
            } else
            {
                logger.warnf("[%s] (processRequest) <%s> %s",
                    sessionId,
                    failure.getClass().getName(),
                    failure.getMessage());
            }
        } finally {
            close();
            handOver();
        }
    }

    private void close()
    {
        if(connection.isClosed())
        {
            logger.debugf("[%s] Remote peer: %s --- connection closed by QUIT", sessionId, connection.remoteAddress());
            return;
        }

        try {
            connection.close();
        } catch(IOException failure)
        {
            logger.warn(failure.getMessage());
        }

        logger.debugf("[%s] Remote peer: %s --- connection closed", sessionId, connection.remoteAddress());
    }

    private void handOver()
    {
        if( ! session.hasQuit())
        {
            logger.debugf("[%s] session ended without QUIT, envelope discarded", sessionId);
            return;
        }

        try {
            sessionConsumer.accept(session.state());
        } catch(RuntimeException failure)
        {
            logger.warnf("[%s] (handOver) <%s> %s",
                sessionId,
                failure.getClass().getName(),
                failure.getMessage());
        }
    }

    private void process() throws IOException {
        logger.debugf("[%s] Remote peer: %s", sessionId, connection.remoteAddress());

        session.send(SmtpReply.SERVICE_READY);

        interact();
    }

    private void interact() throws IOException {
        while( ! session.isClosed())
        {
            final String statement = session.readLine();
            checkStatement(statement);
        }
    }

    private void checkStatement(final String statement) throws IOException {
        final String verb = leadingToken(statement);

        if(verb.isEmpty())
        {
            session.send(SmtpReply.EMPTY_COMMAND);
            return;
        }

        final Optional<SmtpCommand> command = CommandTable.lookup(verb);
        if(command.isEmpty())
        {
            session.send(SmtpReply.NOT_RECOGNIZED);
            return;
        }

        command.get().execute(session, statement);
    }

}
