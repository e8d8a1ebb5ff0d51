package org.veridrive.cli;

import com.typesafe.config.Config;
import org.veridrive.cli.commands.VerifyCommand;
import org.veridrive.config.ConfigLoader;
import org.veridrive.config.LoggingConfigurator;
import org.veridrive.driver.api.ExitStatus;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "veridrive",
    mixinStandardHelpOptions = true,
    version = "veridrive 1.0",
    description = "veridrive - verification-aware compilation driver",
    subcommands = {
        VerifyCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: veridrive.conf)"
    )
    private File configFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the command line with the driver's error handling: malformed invocations exit with
     * the code of {@link ExitStatus#PREPROCESSING_ERROR}.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("veridrive");
        commandLine.setParameterExceptionHandler((ex, args) -> {
            final CommandLine cmd = ex.getCommandLine();
            final PrintWriter err = cmd.getErr();
            err.println("*** Error: " + ex.getMessage());
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, err);
            cmd.usage(err);
            return ExitStatus.PREPROCESSING_ERROR.toExitCode(true);
        });
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return the resolved configuration.
     * @throws FileNotFoundException if the file given with {@code --config} does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() throws FileNotFoundException {
        if (!initialized) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
            initialized = true;
        }
        return config;
    }
}
