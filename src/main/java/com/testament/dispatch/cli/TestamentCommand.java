package com.testament.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "testament",
        mixinStandardHelpOptions = true,
        version = "testament 0.1.0",
        description = "Discovers test modules on the classpath and runs them with bounded parallelism.",
        subcommands = {
                RunCommand.class,
                DiscoverCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TestamentCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        CommandLine.usage(this, System.out);
    }
}
