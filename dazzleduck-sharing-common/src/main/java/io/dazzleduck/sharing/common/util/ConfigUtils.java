package io.dazzleduck.sharing.common.util;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.dazzleduck.sharing.common.ConfigConstants;

import java.util.List;

public class ConfigUtils {

    /**
     * Parses every {@code --conf key=value} argument into one config, later arguments winning.
     */
    public static Config loadCommandLineConfig(String[] args) {
        var argv = new Args();
        JCommander.newBuilder()
                .addObject(argv)
                .build()
                .parse(args);
        if (argv.configs == null) {
            return ConfigFactory.empty();
        }
        return ConfigFactory.parseString(String.join("\n", argv.configs));
    }

    /**
     * Command line overrides on top of {@code application.conf}, scoped to the server's root key.
     */
    public static Config loadAppConfig(String[] args) {
        return loadCommandLineConfig(args)
                .withFallback(ConfigFactory.load())
                .resolve()
                .getConfig(ConfigConstants.CONFIG_PATH);
    }

    public static class Args {
        @Parameter(names = {"--conf"}, description = "Configuration override, key=value in HOCON syntax")
        private List<String> configs;
    }
}
