package io.github.smtpstub.application;

import org.jboss.logging.Logger;

import io.github.smtpstub.server.SmtpAgent;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;

@QuarkusMain
public class Application implements QuarkusApplication
{
    @Inject
    Logger logger;

    @Inject
    SmtpAgent server;

    @PostConstruct
    void startup()
    {
        server.start();
    }

    @PreDestroy
    void finish()
    {
        server.stop();
    }

    public int run(String... args) throws Exception
    {
        logger.info(">>> SMTP stub started <<<");

        Quarkus.waitForExit();

        logger.info(">>> SMTP stub about to finish <<<");

        return 0;
    }

}
