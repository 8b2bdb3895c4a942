package com.gridcast.dispatch.cli;

import com.gridcast.core.capability.CapabilityDescriptor;
import com.gridcast.core.capability.CapabilityRegistry;
import com.gridcast.core.capability.ParameterSpec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Comparator;

/**
 * CLI command: gridcast capabilities
 * <p>
 * Lists every registered capability with its parameters and timeout.
 */
@Command(name = "capabilities", mixinStandardHelpOptions = true, description = "List registered capabilities")
@Component
public class CapabilitiesCommand implements Runnable {

    private final CapabilityRegistry registry;

    public CapabilitiesCommand(CapabilityRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info(registry.size() + " capabilities registered");
        System.out.println();

        registry.all().stream()
                .sorted(Comparator.comparing(CapabilityDescriptor::name))
                .forEach(descriptor -> {
                    String timeout = descriptor.timeout() != null
                            ? descriptor.timeout().toSeconds() + "s"
                            : "default";
                    System.out.printf("  %-26s %s (timeout %s)%n",
                            descriptor.name(), descriptor.description(), timeout);
                    for (ParameterSpec param : descriptor.parameters()) {
                        System.out.printf("      %-22s %-8s %s%n",
                                param.name() + (param.required() ? "*" : ""),
                                param.type().name().toLowerCase(),
                                param.description() != null ? param.description() : "");
                    }
                });
    }
}
