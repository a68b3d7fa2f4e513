package org.metaconv.compiler;

import org.metaconv.compiler.api.CompilationException;
import org.metaconv.compiler.api.CompilationResult;
import org.metaconv.compiler.api.CompilerErrorCode;
import org.metaconv.compiler.api.ExpressionContext;
import org.metaconv.compiler.api.ExpressionRecord;
import org.metaconv.compiler.api.FunctionOutcome;
import org.metaconv.compiler.api.FunctionSpec;
import org.metaconv.compiler.api.GeneratedFunction;
import org.metaconv.compiler.api.IExpressionCompiler;
import org.metaconv.compiler.api.UnsupportedConstructException;
import org.metaconv.compiler.backend.codegen.FallbackGenerator;
import org.metaconv.compiler.backend.codegen.JavaSourceGenerator;
import org.metaconv.compiler.diagnostics.DiagnosticsEngine;
import org.metaconv.compiler.frontend.ast.NormalizedNode;
import org.metaconv.compiler.frontend.ast.RawNode;
import org.metaconv.compiler.frontend.normalize.AstNormalizer;
import org.metaconv.compiler.frontend.normalize.PrecedenceInvariantViolation;
import org.metaconv.compiler.frontend.reader.ParseInputException;
import org.metaconv.compiler.frontend.reader.RawAstReader;
import org.metaconv.compiler.registry.DuplicateNameCollisionException;
import org.metaconv.compiler.registry.FunctionRegistry;
import org.metaconv.compiler.registry.Sha256KeyHasher;
import org.metaconv.config.CompilerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Compiles a corpus of expressions. For every expression the pipeline is
 * read tree, normalize, register and generate; per-expression failures become fallback functions
 * while broken compiler invariants abort the run.
 * <p>
 * Reading and normalizing run on the worker pool. The first expression of every distinct tree is
 * then generated on the pool and all remaining expressions are registered in input order, so the
 * emitted functions, lookup table and diagnostics do not depend on the parallelism.
 * <p>
 * A fresh {@link FunctionRegistry} is created for each call of {@link #compile(List)}. The instance
 * itself is not thread-safe.
 */
public class ExpressionCompiler implements IExpressionCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionCompiler.class);

    private final CompilerOptions options;
    private final AstNormalizer normalizer;
    private final RawAstReader reader = new RawAstReader();
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    public ExpressionCompiler(CompilerOptions options) {
        this(options, AstNormalizer.withDefaults());
    }

    public ExpressionCompiler(CompilerOptions options, AstNormalizer normalizer) {
        this.options = options;
        this.normalizer = normalizer;
    }

    @Override
    public CompilationResult compile(List<ExpressionRecord> records) throws CompilationException {
        diagnostics = new DiagnosticsEngine();
        FunctionRegistry registry = new FunctionRegistry(new JavaSourceGenerator(), new FallbackGenerator(),
                new Sha256KeyHasher(options.hashLength()), options.manualImplementations());
        LOG.info("Compiling {} expressions with parallelism {}", records.size(), options.parallelism());
        ForkJoinPool pool = options.parallelism() == 1 ? null : new ForkJoinPool(options.parallelism());
        try {
            List<Prepared> prepared = onPool(pool, () -> stream(records, pool).map(this::prepare).toList());

            GeneratedFunction[] served = new GeneratedFunction[prepared.size()];
            List<Integer> leaders = firstOfEachTree(prepared);
            onPool(pool, () -> {
                stream(leaders, pool).forEach(i -> served[i] = prepared.get(i).serve(registry));
                return null;
            });
            for (int i = 0; i < prepared.size(); i++) {
                if (served[i] == null) {
                    served[i] = prepared.get(i).serve(registry);
                }
                prepared.get(i).report(served[i], diagnostics);
            }
        } catch (ExecutionException e) {
            throw fatal(e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompilationException(CompilerErrorCode.UNKNOWN_ERROR, "Compilation interrupted", e);
        } catch (RuntimeException e) {
            throw fatal(e);
        } finally {
            if (pool != null) {
                pool.shutdown();
            }
        }
        CompilationResult result = registry.finish();
        LOG.info("Compiled {} expressions into {} functions ({} manual, {} fallbacks, coverage {})",
                result.report().total(), result.functions().size(), result.report().manual(),
                result.report().fallback(),
                String.format(Locale.ROOT, "%.1f%%", result.report().coverage() * 100));
        return result;
    }

    /**
     * Runs {@code work} on the pool, or on the calling thread without one.
     */
    private static <T> T onPool(ForkJoinPool pool, Supplier<T> work)
            throws ExecutionException, InterruptedException {
        if (pool == null) {
            return work.get();
        }
        return pool.submit(work::get).get();
    }

    private static <T> Stream<T> stream(List<T> items, ForkJoinPool pool) {
        return pool == null ? items.stream() : items.parallelStream();
    }

    /**
     * @return Indexes of the first expression of every distinct {@code (context, tree)}, in input order.
     */
    private static List<Integer> firstOfEachTree(List<Prepared> prepared) {
        Map<TreeKey, Integer> first = new LinkedHashMap<>();
        for (int i = 0; i < prepared.size(); i++) {
            Prepared p = prepared.get(i);
            if (p.tree() != null) {
                first.putIfAbsent(new TreeKey(p.record().context(), p.tree()), i);
            }
        }
        return List.copyOf(first.values());
    }

    private Prepared prepare(ExpressionRecord record) {
        RawNode raw;
        try {
            raw = reader.read(record.parsedAst());
        } catch (ParseInputException e) {
            return new Prepared(record, null, Failure.UNPARSED, e.getMessage());
        }
        try {
            return new Prepared(record, normalizer.normalize(raw), null, null);
        } catch (UnsupportedConstructException e) {
            return new Prepared(record, null, Failure.UNNORMALIZED, e.getMessage());
        }
    }

    private enum Failure {
        UNPARSED,
        UNNORMALIZED
    }

    /**
     * An expression after reading and normalization: either a tree or the reason there is none.
     */
    private record Prepared(ExpressionRecord record, NormalizedNode tree, Failure failure, String reason) {

        GeneratedFunction serve(FunctionRegistry registry) {
            if (tree != null) {
                return registry.resolveOrFallback(
                        new FunctionSpec(record.originalText(), record.context(), tree), record.usage());
            }
            if (failure == Failure.UNPARSED) {
                return registry.recordParseFailure(record, reason);
            }
            return registry.recordUnsupported(record.context(), record.originalText(), record.usage(), reason);
        }

        void report(GeneratedFunction function, DiagnosticsEngine diagnostics) {
            if (function.outcome() != FunctionOutcome.FALLBACK) {
                return;
            }
            String message = failure == Failure.UNPARSED ? "Malformed input tree: " + reason
                    : failure == Failure.UNNORMALIZED ? reason
                    : function.reason();
            diagnostics.reportError(message, record.context(), record.originalText());
        }
    }

    private record TreeKey(ExpressionContext context, NormalizedNode tree) {
    }

    private static CompilationException fatal(Throwable t) {
        if (t instanceof PrecedenceInvariantViolation) {
            return new CompilationException(CompilerErrorCode.PRECEDENCE_INVARIANT_VIOLATION, t.getMessage(), t);
        }
        if (t instanceof DuplicateNameCollisionException) {
            return new CompilationException(CompilerErrorCode.DUPLICATE_NAME_COLLISION, t.getMessage(), t);
        }
        return new CompilationException(CompilerErrorCode.UNKNOWN_ERROR, "Unexpected failure: " + t, t);
    }

    /**
     * @return The diagnostics of the last run.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
