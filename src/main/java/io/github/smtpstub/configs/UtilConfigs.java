package io.github.smtpstub.configs;

import java.util.Optional;

public final class UtilConfigs
{
    public static final Optional<String> OPTIONAL_HOSTNAME = optionalEnv("HOSTNAME");

    private UtilConfigs()
    {
    }

    public static Optional<String> optionalEnv(final String envname)
    {
        return Optional.ofNullable(System.getenv(envname)).filter(v -> ! v.isBlank());
    }

}
