package org.metaconv.cli.commands;

import org.metaconv.cli.CommandLineInterface;
import org.metaconv.compiler.ExpressionCompiler;
import org.metaconv.compiler.api.CompilationException;
import org.metaconv.compiler.api.CompilationResult;
import org.metaconv.compiler.api.ExpressionContext;
import org.metaconv.compiler.api.ExpressionRecord;
import org.metaconv.compiler.backend.emit.ArtifactWriter;
import org.metaconv.compiler.backend.emit.ModuleEmitter;
import org.metaconv.compiler.backend.verify.GeneratedSourceCompiler;
import org.metaconv.compiler.frontend.reader.CorpusReader;
import org.metaconv.compiler.registry.CoverageReport;
import org.metaconv.config.CompilerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(name = "compile", description = "Compiles an expression corpus into a Java module, a lookup table and a coverage report.")
public class CompileCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CompileCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "The expression corpus (JSON array of expression records).")
    private Path input;

    @Option(names = {"-o", "--output"}, description = "Output directory (default: metaconv.output.directory).")
    private Path output;

    @Option(names = {"-j", "--parallelism"}, description = "Worker threads (default: metaconv.compiler.parallelism).")
    private Integer parallelism;

    @Option(names = "--verify", description = "Compile the emitted module with the system Java compiler.")
    private boolean verify;

    @Override
    public Integer call() {
        CompilerOptions options = CompilerOptions.fromConfig(parent.getConfig());
        if (output != null) {
            options = options.withOutputDirectory(output);
        }
        if (parallelism != null) {
            options = options.withParallelism(parallelism);
        }
        PrintWriter out = spec.commandLine().getOut();

        try {
            List<ExpressionRecord> records = new CorpusReader().read(input);
            ExpressionCompiler compiler = new ExpressionCompiler(options);
            CompilationResult result = compiler.compile(records);
            if (compiler.getDiagnostics().hasErrors() && LOG.isDebugEnabled()) {
                LOG.debug("Expressions served by fallbacks:\n{}", compiler.getDiagnostics().summary());
            }

            ModuleEmitter emitter = new ModuleEmitter(options.generatedPackage(), options.generatedClass());
            ArtifactWriter.WrittenArtifacts written = new ArtifactWriter().write(result, emitter,
                    options.outputDirectory(), options.lookupFile(), options.reportFile());

            if (verify) {
                Path work = Files.createTempDirectory("metaconv-verify");
                try (GeneratedSourceCompiler verifier = new GeneratedSourceCompiler(work)) {
                    verifier.compileAndLoad(emitter.qualifiedClassName(), emitter.emit(result));
                }
                out.println("Verified: " + emitter.qualifiedClassName() + " compiles.");
            }

            printSummary(out, result.report(), written);
            return 0;
        } catch (CompilationException e) {
            LOG.error("Compilation failed [{}]: {}", e.getErrorCode(), e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.error("Verification failed: {}", e.getMessage());
            return 1;
        }
    }

    private static void printSummary(PrintWriter out, CoverageReport report, ArtifactWriter.WrittenArtifacts written) {
        out.printf("%-16s %8s %10s %7s %9s %9s%n", "Context", "Total", "Generated", "Manual", "Fallback", "Distinct");
        for (ExpressionContext context : ExpressionContext.values()) {
            CoverageReport.ContextStats stats = report.stats(context);
            out.printf("%-16s %8d %10d %7d %9d %9d%n", context.name(), stats.total(), stats.generated(),
                    stats.manual(), stats.fallback(), stats.distinctFunctions());
        }
        out.printf(Locale.ROOT, "Coverage: %.1f%% (%d of %d)%n", report.coverage() * 100.0, report.generated(), report.total());
        out.println("Module:   " + written.module());
        out.println("Lookup:   " + written.lookup());
        out.println("Report:   " + written.report());
    }
}
