package org.metaconv.compiler.backend.emit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.metaconv.compiler.api.CompilationException;
import org.metaconv.compiler.api.CompilationResult;
import org.metaconv.compiler.api.CompilerErrorCode;
import org.metaconv.compiler.api.ExpressionContext;
import org.metaconv.compiler.api.LookupEntry;
import org.metaconv.compiler.api.UsageSite;
import org.metaconv.compiler.registry.CoverageReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the artifacts of a run: the module source under its package directory, the lookup table
 * and the coverage report.
 */
public class ArtifactWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactWriter.class);

    private final ObjectMapper mapper;

    public ArtifactWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ArtifactWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Paths of the written files.
     */
    public record WrittenArtifacts(Path module, Path lookup, Path report) {
    }

    /**
     * @param result The drained registry.
     * @param emitter The module layout.
     * @param directory The output root.
     * @param lookupFile File name of the lookup table, relative to {@code directory}.
     * @param reportFile File name of the coverage report, relative to {@code directory}.
     * @return The written files.
     * @throws CompilationException if a file cannot be written.
     */
    public WrittenArtifacts write(CompilationResult result, ModuleEmitter emitter, Path directory,
                                  String lookupFile, String reportFile) throws CompilationException {
        try {
            Path packageDir = emitter.packageName().isEmpty()
                    ? directory
                    : directory.resolve(emitter.packageName().replace('.', '/'));
            Files.createDirectories(packageDir);
            Path module = packageDir.resolve(emitter.className() + ".java");
            Files.writeString(module, emitter.emit(result), StandardCharsets.UTF_8);

            Path lookup = directory.resolve(lookupFile);
            mapper.writeValue(lookup.toFile(), lookupJson(result, emitter));

            Path report = directory.resolve(reportFile);
            mapper.writeValue(report.toFile(), reportJson(result.report()));

            LOG.info("Wrote {} functions to {}", result.functions().size(), module);
            return new WrittenArtifacts(module, lookup, report);
        } catch (IOException e) {
            throw new CompilationException(CompilerErrorCode.IO_ERROR_WRITING_OUTPUT,
                    "Cannot write artifacts to " + directory + ": " + e.getMessage(), e);
        }
    }

    ObjectNode lookupJson(CompilationResult result, ModuleEmitter emitter) {
        ObjectNode root = mapper.createObjectNode();
        root.put("module", emitter.qualifiedClassName());
        ArrayNode entries = root.putArray("entries");
        for (LookupEntry entry : result.lookup()) {
            ObjectNode node = entries.addObject();
            node.put("originalText", entry.originalText());
            node.put("expressionType", entry.context().name());
            node.put("function", entry.functionName());
            if (!entry.usages().isEmpty()) {
                ArrayNode usages = node.putArray("usages");
                for (UsageSite usage : entry.usages()) {
                    usages.addObject()
                            .put("module", usage.module())
                            .put("table", usage.table())
                            .put("tag", usage.tag());
                }
            }
        }
        return root;
    }

    ObjectNode reportJson(CoverageReport report) {
        ObjectNode root = mapper.createObjectNode();
        root.put("total", report.total());
        root.put("generated", report.generated());
        root.put("manual", report.manual());
        root.put("fallback", report.fallback());
        root.put("coverage", report.coverage());
        ObjectNode contexts = root.putObject("contexts");
        for (ExpressionContext context : ExpressionContext.values()) {
            CoverageReport.ContextStats stats = report.stats(context);
            contexts.putObject(context.name())
                    .put("total", stats.total())
                    .put("generated", stats.generated())
                    .put("manual", stats.manual())
                    .put("fallback", stats.fallback())
                    .put("distinctFunctions", stats.distinctFunctions());
        }
        ArrayNode fallbacks = root.putArray("fallbacks");
        for (CoverageReport.FallbackEntry entry : report.fallbacks()) {
            fallbacks.addObject()
                    .put("expressionType", entry.context().name())
                    .put("originalText", entry.originalText())
                    .put("function", entry.functionName())
                    .put("reason", entry.reason());
        }
        return root;
    }
}
