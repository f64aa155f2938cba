package org.initscan.cli.commands;

import org.initscan.cli.CommandLineInterface;
import org.initscan.extractor.api.ExtractionException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "eval",
    description = "Evaluates a C-style integer constant expression"
)
public class EvalCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "EXPR", description = "The expression; several arguments are joined with spaces")
    private List<String> expression;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        try {
            long value = parent.createExtractor().evaluateExpression(String.join(" ", expression));
            spec.commandLine().getOut().println(value);
            spec.commandLine().getOut().flush();
            return 0;
        } catch (ExtractionException e) {
            spec.commandLine().getErr().println(e.getErrorCode() + ": " + e.getMessage());
            spec.commandLine().getErr().flush();
            return 1;
        }
    }
}
