package org.metaconv.compiler.registry;

import org.metaconv.compiler.api.CompilationResult;
import org.metaconv.compiler.api.ExpressionContext;
import org.metaconv.compiler.api.ExpressionRecord;
import org.metaconv.compiler.api.FunctionOutcome;
import org.metaconv.compiler.api.FunctionSpec;
import org.metaconv.compiler.api.GeneratedFunction;
import org.metaconv.compiler.api.LookupEntry;
import org.metaconv.compiler.api.UnsupportedConstructException;
import org.metaconv.compiler.api.UsageSite;
import org.metaconv.compiler.backend.codegen.FallbackGenerator;
import org.metaconv.compiler.backend.codegen.JavaSourceGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * The intern table of one compilation run.
 * <p>
 * Expressions are keyed by {@code (context, canonical normalized tree)}; equal keys share one
 * function name and one function body. Every registered expression ends up served by a generated
 * function, by a delegate to a manual implementation or by a fallback stub, and is listed in the
 * lookup table. The registry is
 * safe for concurrent use and is drained exactly once by {@link #finish()}.
 */
public class FunctionRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionRegistry.class);

    private final JavaSourceGenerator generator;
    private final FallbackGenerator fallbackGenerator;
    private final KeyHasher hasher;
    private final ManualImplementations manualImplementations;

    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<LookupKey, LookupRow> lookup = new ConcurrentHashMap<>();
    private final Map<ExpressionContext, Counters> counters = new EnumMap<>(ExpressionContext.class);
    private final AtomicBoolean finished = new AtomicBoolean();

    public FunctionRegistry(JavaSourceGenerator generator, FallbackGenerator fallbackGenerator, KeyHasher hasher,
                            ManualImplementations manualImplementations) {
        this.generator = generator;
        this.fallbackGenerator = fallbackGenerator;
        this.hasher = hasher;
        this.manualImplementations = manualImplementations;
        for (ExpressionContext context : ExpressionContext.values()) {
            counters.put(context, new Counters());
        }
    }

    public FunctionRegistry(JavaSourceGenerator generator, FallbackGenerator fallbackGenerator, KeyHasher hasher) {
        this(generator, fallbackGenerator, hasher, ManualImplementations.none());
    }

    public FunctionRegistry() {
        this(new JavaSourceGenerator(), new FallbackGenerator(), new Sha256KeyHasher());
    }

    /**
     * Allocates, or finds, the function name for a normalized expression. No code is generated.
     *
     * @param spec The expression.
     * @return The deterministic name {@code <prefix>_<hash>}.
     * @throws DuplicateNameCollisionException if the name is taken by a different tree.
     */
    public String register(FunctionSpec spec) {
        return slot(spec.context(), CanonicalForm.of(spec.normalizedAst())).name;
    }

    /**
     * Registers an expression, generating its function on first sight, and records it in the lookup table.
     * <p>
     * If the tree cannot be translated, a manual implementation registered for the expression text
     * serves it; otherwise a fallback stub does.
     *
     * @param spec The expression.
     * @param usage Where it is used, or {@code null}.
     * @return The function serving the expression.
     */
    public GeneratedFunction resolveOrFallback(FunctionSpec spec, UsageSite usage) {
        Slot slot = slot(spec.context(), CanonicalForm.of(spec.normalizedAst()));
        GeneratedFunction function = slot.resolve(() -> generateOrFallback(spec, slot.name));
        if (function.outcome() == FunctionOutcome.FALLBACK) {
            // an equal tree registered first under a text without a manual implementation
            Optional<String> method = manualImplementations.lookup(spec.context(), spec.originalText());
            if (method.isPresent()) {
                function = manual(spec.context(), spec.originalText(), method.get(), function.reason());
            }
        }
        record(spec.originalText(), spec.context(), function, usage);
        return function;
    }

    public GeneratedFunction resolveOrFallback(FunctionSpec spec) {
        return resolveOrFallback(spec, null);
    }

    /**
     * Serves an expression whose input tree could not be read by a fallback keyed on its text.
     *
     * @param record The expression as read from the corpus.
     * @param reason The parse error.
     * @return The fallback function, or the delegate to its manual implementation.
     */
    public GeneratedFunction recordParseFailure(ExpressionRecord record, String reason) {
        return recordParseFailure(record.context(), record.originalText(), record.usage(), reason);
    }

    /**
     * Serves an expression whose input tree could not be read by a fallback keyed on its text.
     */
    public GeneratedFunction recordParseFailure(ExpressionContext context, String originalText, UsageSite usage,
                                                String reason) {
        return fallback("unparsed", context, originalText, usage, reason);
    }

    /**
     * Serves an expression that could not be normalized by a fallback keyed on its text.
     */
    public GeneratedFunction recordUnsupported(ExpressionContext context, String originalText, UsageSite usage,
                                               String reason) {
        return fallback("unnormalized", context, originalText, usage, reason);
    }

    private GeneratedFunction fallback(String kind, ExpressionContext context, String originalText, UsageSite usage,
                                       String reason) {
        Optional<String> method = manualImplementations.lookup(context, originalText);
        GeneratedFunction function;
        if (method.isPresent()) {
            function = manual(context, originalText, method.get(), reason);
        } else {
            Slot slot = slot(context, "(" + kind + " " + CanonicalForm.quote(originalText) + ")");
            function = slot.resolve(() -> fallbackFunction(context, slot.name, originalText, reason));
        }
        record(originalText, context, function, usage);
        return function;
    }

    private GeneratedFunction generateOrFallback(FunctionSpec spec, String name) {
        try {
            String source = generator.generate(spec.normalizedAst(), spec.context(), name, spec.originalText());
            LOG.debug("Generated {} for '{}'", name, spec.originalText());
            return new GeneratedFunction(name, spec.context(), source, FunctionOutcome.GENERATED,
                    spec.originalText(), null);
        } catch (UnsupportedConstructException e) {
            Optional<String> method = manualImplementations.lookup(spec.context(), spec.originalText());
            if (method.isPresent()) {
                return manualFunction(spec.context(), name, spec.originalText(), method.get(), e.getMessage());
            }
            return fallbackFunction(spec.context(), name, spec.originalText(), e.getMessage());
        }
    }

    /**
     * The delegate for one expression text, shared by all registrations of that text.
     */
    private GeneratedFunction manual(ExpressionContext context, String originalText, String method, String reason) {
        Slot slot = slot(context, "(manual " + CanonicalForm.quote(originalText) + ")");
        return slot.resolve(() -> manualFunction(context, slot.name, originalText, method, reason));
    }

    private GeneratedFunction manualFunction(ExpressionContext context, String name, String originalText,
                                             String method, String reason) {
        LOG.debug("Manual implementation {} serves {} expression '{}': {}", method, context, originalText, reason);
        String source = fallbackGenerator.delegate(context, name, originalText, method);
        return new GeneratedFunction(name, context, source, FunctionOutcome.MANUAL, originalText, reason);
    }

    private GeneratedFunction fallbackFunction(ExpressionContext context, String name, String originalText,
                                               String reason) {
        LOG.warn("Fallback for {} expression '{}': {}", context, originalText, reason);
        String source = fallbackGenerator.generate(context, name, originalText, reason);
        return new GeneratedFunction(name, context, source, FunctionOutcome.FALLBACK, originalText, reason);
    }

    private Slot slot(ExpressionContext context, String canonicalTree) {
        if (finished.get()) {
            throw new IllegalStateException("Registry has already been drained");
        }
        String key = context.name() + ":" + canonicalTree;
        String name = context.functionPrefix() + "_" + hasher.hash(key);
        Slot slot = slots.computeIfAbsent(name, n -> new Slot(n, key));
        if (!slot.key.equals(key)) {
            throw new DuplicateNameCollisionException(name, slot.key, key);
        }
        return slot;
    }

    private void record(String originalText, ExpressionContext context, GeneratedFunction function, UsageSite usage) {
        lookup.compute(new LookupKey(originalText, context), (k, row) -> {
            LookupRow current = row != null ? row : new LookupRow(function.name(), function.outcome(),
                    function.reason(), List.of());
            return usage != null ? current.withUsage(usage) : current;
        });
        Counters c = counters.get(context);
        c.total.incrementAndGet();
        switch (function.outcome()) {
            case GENERATED -> c.generated.incrementAndGet();
            case MANUAL -> c.manual.incrementAndGet();
            case FALLBACK -> c.fallback.incrementAndGet();
        }
    }

    /**
     * Drains the registry. Further registrations fail.
     *
     * @return All distinct functions sorted by name, the lookup table and the coverage report.
     * @throws IllegalStateException if called twice.
     */
    public CompilationResult finish() {
        if (!finished.compareAndSet(false, true)) {
            throw new IllegalStateException("Registry has already been drained");
        }
        List<GeneratedFunction> functions = slots.values().stream()
                .map(Slot::function)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(GeneratedFunction::name))
                .toList();

        List<LookupEntry> entries = new ArrayList<>();
        List<CoverageReport.FallbackEntry> fallbacks = new ArrayList<>();
        lookup.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(LookupKey.ORDER))
                .forEach(e -> {
                    LookupKey key = e.getKey();
                    LookupRow row = e.getValue();
                    entries.add(new LookupEntry(key.originalText(), key.context(), row.functionName(), row.usages()));
                    if (row.outcome() == FunctionOutcome.FALLBACK) {
                        fallbacks.add(new CoverageReport.FallbackEntry(key.context(), key.originalText(),
                                row.functionName(), row.reason()));
                    }
                });

        Map<ExpressionContext, CoverageReport.ContextStats> stats = new EnumMap<>(ExpressionContext.class);
        for (ExpressionContext context : ExpressionContext.values()) {
            Counters c = counters.get(context);
            int distinct = (int) functions.stream().filter(f -> f.context() == context).count();
            stats.put(context, new CoverageReport.ContextStats(c.total.get(), c.generated.get(), c.manual.get(),
                    c.fallback.get(), distinct));
        }
        CoverageReport report = new CoverageReport(stats, fallbacks);
        LOG.info("Registry drained: {} expressions, {} functions, {} manual, {} fallbacks",
                report.total(), functions.size(), report.manual(), report.fallback());
        return new CompilationResult(functions, entries, report);
    }

    /**
     * A reserved name; the function is produced once by whichever thread resolves it first.
     */
    private static final class Slot {
        private final String name;
        private final String key;
        private GeneratedFunction function;

        Slot(String name, String key) {
            this.name = name;
            this.key = key;
        }

        synchronized GeneratedFunction resolve(Supplier<GeneratedFunction> producer) {
            if (function == null) {
                function = producer.get();
            }
            return function;
        }

        synchronized GeneratedFunction function() {
            return function;
        }
    }

    private static final class Counters {
        private final AtomicInteger total = new AtomicInteger();
        private final AtomicInteger generated = new AtomicInteger();
        private final AtomicInteger manual = new AtomicInteger();
        private final AtomicInteger fallback = new AtomicInteger();
    }

    private record LookupKey(String originalText, ExpressionContext context) {
        static final Comparator<LookupKey> ORDER = Comparator.comparing(LookupKey::context)
                .thenComparing(LookupKey::originalText);
    }

    private record LookupRow(String functionName, FunctionOutcome outcome, String reason, List<UsageSite> usages) {
        LookupRow withUsage(UsageSite usage) {
            List<UsageSite> extended = new ArrayList<>(usages);
            extended.add(usage);
            return new LookupRow(functionName, outcome, reason, List.copyOf(extended));
        }
    }
}
