package io.controlplane;

import picocli.CommandLine;
import picocli.CommandLine.Command;

import static io.controlplane.config.Constants.VERSION;

/**
 * Command line entry point.
 */
@Command(
        name = "k0s",
        mixinStandardHelpOptions = true,
        version = VERSION,
        description = "Kubernetes control plane node supervisor",
        subcommands = {ServerCommand.class}
)
public final class ControlPlaneCli implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ControlPlaneCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
