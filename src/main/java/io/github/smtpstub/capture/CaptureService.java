package io.github.smtpstub.capture;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Consumer;

import org.jboss.logging.Logger;

import io.github.smtpstub.configs.Configs;
import io.github.smtpstub.mail.SessionRenderer;
import io.github.smtpstub.mail.SessionState;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import static io.github.smtpstub.utils.AppUtils.hash;
import static io.github.smtpstub.utils.AppUtils.utf8raw;

/**
 * Receives every session that ended with QUIT.
 * The rendered envelope is logged and, when a content folder is configured, stored as an .eml file.
 */
@ApplicationScoped
public class CaptureService implements Consumer<SessionState>
{
    @Inject
    Logger logger;

    @Inject
    Configs configs;

    @Override
    public void accept(final SessionState state)
    {
        final String rendered = SessionRenderer.render(state);

        logger.infof("--- captured session from %s ---%n%s", state.getClientName(), rendered);

        contentFolder().ifPresent(folder -> store(folder, rendered));
    }

    public Optional<Path> contentFolder()
    {
        return configs.contentFolder().map(Path::of);
    }

    private void store(final Path folder, final String rendered)
    {
        final Path file = folder.resolve(hash() + ".eml");

        try {
            Files.createDirectories(folder);

            try (OutputStream outData = Files.newOutputStream(file)) {
                outData.write(utf8raw(rendered));
                outData.flush();
            }
        } catch (IOException failure) {
            logger.warnf("(store) <%s> %s", failure.getClass().getName(), failure.getMessage());
            return;
        }

        logger.debugf("--- stored: %s ---", file);
    }

}
