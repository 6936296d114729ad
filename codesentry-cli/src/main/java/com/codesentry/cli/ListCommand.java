package com.codesentry.cli;

import com.codesentry.core.config.ConfigLoader;
import com.codesentry.core.config.EngineConfig;
import com.codesentry.core.technique.Technique;
import com.codesentry.core.technique.TechniqueRegistry;
import com.codesentry.core.technique.impl.BuiltInTechniques;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list the available techniques.
 *
 * <p>Prints every built-in technique in execution order, with its scope and whether
 * the project configuration enables it.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codesentry list
 * codesentry list -c other/codesentry.yaml
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available techniques",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: codesentry.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        EngineConfig config = ConfigLoader.load(configPath);
        TechniqueRegistry registry = BuiltInTechniques.registerAll(new TechniqueRegistry(), config.techniques().settings());
        List<String> enabled = config.techniques().enabled();

        System.out.println("Available Techniques:");
        System.out.println();

        for (Technique technique : registry.list()) {
            boolean active = enabled.isEmpty() || enabled.contains(technique.getId());
            System.out.printf("  • %s (%s)%s%n",
                technique.getId(),
                technique.isGlobal() ? "global" : "per-file",
                active ? "" : " [disabled]");
            System.out.printf("    %s%n", technique.getDescription());
            System.out.println();
        }

        return 0;
    }
}
