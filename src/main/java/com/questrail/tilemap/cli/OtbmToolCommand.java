package com.questrail.tilemap.cli;

import com.questrail.tilemap.storage.otbm.config.MapIoConfig;
import com.questrail.tilemap.storage.otbm.config.UnknownItemPolicy;
import com.questrail.tilemap.storage.otbm.observability.Slf4jMapIoObservabilitySink;
import com.questrail.tilemap.storage.otbm.runtime.OtbmMapStorage;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(
    name = "otbm-tool",
    mixinStandardHelpOptions = true,
    version = "otbm-tool 0.1",
    description = "Inspect, validate and convert OTBM map files",
    subcommands = {
        InfoCommand.class,
        ValidateCommand.class,
        ConvertCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class OtbmToolCommand implements Callable<Integer> {

    @Option(
        names = {"--unknown-items"},
        description = "What to do with unknown item ids: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "PLACEHOLDER"
    )
    private UnknownItemPolicy unknownItemPolicy;

    @Option(
        names = {"--allow-unsupported"},
        description = "Read maps newer than the newest known version with the newest known semantics"
    )
    private boolean allowUnsupported;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new OtbmToolCommand());
        commandLine.setCommandName("otbm-tool");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    OtbmMapStorage storage() {
        MapIoConfig config = MapIoConfig.builder()
            .withUnknownItemPolicy(unknownItemPolicy)
            .withAllowUnsupportedVersions(allowUnsupported)
            .build();
        return OtbmMapStorage.builder()
            .withConfig(config)
            .withObservabilitySink(new Slf4jMapIoObservabilitySink())
            .build();
    }
}
