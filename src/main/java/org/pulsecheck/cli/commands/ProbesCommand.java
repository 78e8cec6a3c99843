package org.pulsecheck.cli.commands;

import com.typesafe.config.Config;
import org.pulsecheck.cli.HealthCheckCli;
import org.pulsecheck.monitor.config.MonitorSettings;
import org.pulsecheck.monitor.config.ProbeRegistryLoader;
import org.pulsecheck.monitor.policy.PriorityClassifier;
import org.pulsecheck.monitor.runner.RegisteredProbe;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "probes",
    description = "Lists the configured probes with their resolved priority."
)
public class ProbesCommand implements Callable<Integer> {

    @ParentCommand
    private HealthCheckCli parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-e", "--env"}, description = "Environment name (default: pulsecheck.environment)")
    private String environment;

    @Override
    public Integer call() {
        final Config config = parent.getConfig();
        final PrintWriter out = spec.commandLine().getOut();
        final MonitorSettings settings = MonitorSettings.fromConfig(config);
        final String env = environment != null ? environment : settings.environment();
        final PriorityClassifier classifier = new PriorityClassifier(settings.priorityOverrides());

        final List<RegisteredProbe> probes = ProbeRegistryLoader.load(config);
        if (probes.isEmpty()) {
            out.println("No probes configured.");
            out.flush();
            return 0;
        }
        out.printf("%-24s %-10s %s%n", "COMPONENT", "PRIORITY", "PROBE");
        for (RegisteredProbe probe : probes) {
            out.printf("%-24s %-10s %s%n", probe.name(), classifier.priority(probe.name(), env), probe.probe());
        }
        out.flush();
        return 0;
    }
}
