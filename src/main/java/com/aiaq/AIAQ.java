package com.aiaq;

import com.aiaq.io.ProjectLoader;
import com.aiaq.model.ComponentCatalog;
import com.aiaq.model.Node;
import com.aiaq.model.Project;
import com.aiaq.model.TypeCatalog;
import com.aiaq.output.OutputFormatter;
import com.aiaq.query.Expression;
import com.aiaq.query.ExpressionParser;
import com.aiaq.select.Selection;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "aiaq", mixinStandardHelpOptions = true, version = "1.0",
         description = "Query and summarize the blocks and components of App Inventor projects")
public class AIAQ implements Callable<Integer> {
    enum Target { blocks, components, screens }

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Project archive (.aia) or unpacked project directory")
    private Path project;

    @Parameters(index = "1", arity = "0..1", description = "Filter, e.g. \"type == logic_compare & ~disabled\"")
    private String filter;

    @Option(names = "--target", defaultValue = "blocks",
            description = "Collection to query: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Target target = Target.blocks;

    @Option(names = "--descendants", description = "Expand the selection to all descendants")
    private boolean descendants = false;

    @Option(names = "--count", description = "Print the number of selected elements")
    private boolean count = false;

    @Option(names = "--group-by", description = "Group aggregates by this expression (repeatable)")
    private List<String> groupBy = new ArrayList<>();

    @Option(names = "--avg", description = "Average of an expression over the selection")
    private String avg;

    @Option(names = "--min", description = "Minimum of an expression over the selection")
    private String min;

    @Option(names = "--max", description = "Maximum of an expression over the selection")
    private String max;

    @Option(names = "--select", description = "Value of an expression for every selected element")
    private String select;

    @Option(names = {"-c", "--compact-output"}, description = "Compact output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-S", "--sort-keys"}, description = "Sort object keys in output")
    private boolean sortKeys = false;

    @Option(names = "--catalog", description = "Component descriptor file to use instead of the bundled one")
    private Path catalogFile;

    @Option(names = "--strict", description = "Fail when a screen has no blocks file")
    private boolean strict = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new AIAQ()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        try {
            TypeCatalog catalog = catalogFile != null
                    ? TypeCatalog.of(ComponentCatalog.load(catalogFile))
                    : TypeCatalog.standard();
            Project loaded = new ProjectLoader(catalog, strict).load(project);
            ExpressionParser parser = new ExpressionParser(catalog);

            Selection<? extends Node> selection = switch (target) {
                case blocks -> loaded.blocks();
                case components -> loaded.components();
                case screens -> loaded.screens();
            };
            if (filter != null && !filter.isBlank()) {
                selection = selection.filter(parser.parse(filter));
            }
            if (descendants) {
                selection = selection.descendants();
            }

            Object result = evaluate(selection, parser);

            PrintWriter out = spec.commandLine().getOut();
            out.println(new OutputFormatter(!compactOutput, sortKeys).format(result));
            out.flush();
            return 0;
        } catch (Exception e) {
            PrintWriter err = spec.commandLine().getErr();
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private Object evaluate(Selection<? extends Node> selection, ExpressionParser parser) {
        int aggregations = (count ? 1 : 0) + (avg != null ? 1 : 0) + (min != null ? 1 : 0) + (max != null ? 1 : 0)
                + (select != null ? 1 : 0);
        if (aggregations > 1) {
            throw new IllegalArgumentException("Only one of --count, --avg, --min, --max and --select can be given");
        }
        Object[] groups = groupBy.stream().map(parser::parse).toArray();
        if (select != null) {
            if (groups.length > 0) {
                throw new IllegalArgumentException("--group-by cannot be combined with --select");
            }
            return selection.select(parser.parse(select));
        }
        if (avg != null) {
            Expression function = parser.parse(avg);
            return groups.length == 0 ? (Object) selection.avg(function) : selection.avg(function, groups);
        }
        if (min != null) {
            Expression function = parser.parse(min);
            return groups.length == 0 ? selection.min(function) : selection.min(function, groups);
        }
        if (max != null) {
            Expression function = parser.parse(max);
            return groups.length == 0 ? selection.max(function) : selection.max(function, groups);
        }
        if (count || groups.length > 0) {
            return groups.length == 0 ? (Object) selection.count() : selection.count(groups);
        }
        return selection;
    }
}
