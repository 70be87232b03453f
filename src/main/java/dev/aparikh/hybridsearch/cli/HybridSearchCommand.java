package dev.aparikh.hybridsearch.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "hybrid-search", mixinStandardHelpOptions = true,
        description = "Hybrid lexical and vector search over the ticket index, with offline evaluation.")
public class HybridSearchCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return spec.exitCodeOnInvalidInput();
    }
}
