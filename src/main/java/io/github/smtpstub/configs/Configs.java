package io.github.smtpstub.configs;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

@ConfigMapping(prefix = "application")
public interface Configs
{
    Server server();

    Optional<String> contentFolder();

    interface Server
    {
        Optional<String> hostname();

        @WithDefault("1025")
        Integer port();

        /**
         * Identity announced in the HELO/EHLO reply.
         */
        Optional<String> name();
    }

}
