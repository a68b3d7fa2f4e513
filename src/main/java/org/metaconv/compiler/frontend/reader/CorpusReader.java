package org.metaconv.compiler.frontend.reader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.metaconv.compiler.api.CompilationException;
import org.metaconv.compiler.api.CompilerErrorCode;
import org.metaconv.compiler.api.ExpressionContext;
import org.metaconv.compiler.api.ExpressionRecord;
import org.metaconv.compiler.api.UsageSite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the expression corpus: a JSON array of records, or an object holding them under
 * {@code expressions}. Field names are accepted in camelCase and snake_case.
 * <pre>
 * { "expressionType": "ValueConv", "originalText": "$val / 8", "parsedAst": { "class": "PPI::Document", ... },
 *   "usage": { "module": "Canon", "table": "CameraSettings", "tag": "FocalLength" } }
 * </pre>
 * Malformed records abort the run; malformed ASTs do not, since they are only parsed during compilation.
 */
public class CorpusReader {

    private static final Logger LOG = LoggerFactory.getLogger(CorpusReader.class);

    private final ObjectMapper mapper;

    public CorpusReader() {
        this(new ObjectMapper());
    }

    public CorpusReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<ExpressionRecord> read(Path file) throws CompilationException {
        try (InputStream in = Files.newInputStream(file)) {
            List<ExpressionRecord> records = read(in);
            LOG.info("Read {} expressions from {}", records.size(), file);
            return records;
        } catch (IOException e) {
            throw new CompilationException(CompilerErrorCode.INVALID_CORPUS, "Cannot read corpus " + file + ": " + e.getMessage(), e);
        }
    }

    public List<ExpressionRecord> read(InputStream in) throws CompilationException {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (IOException e) {
            throw new CompilationException(CompilerErrorCode.INVALID_CORPUS, "Corpus is not valid JSON: " + e.getMessage(), e);
        }
        JsonNode array = root != null && root.isObject() ? root.get("expressions") : root;
        if (array == null || !array.isArray()) {
            throw new CompilationException(CompilerErrorCode.INVALID_CORPUS,
                    "Corpus must be an array of expression records or an object with an 'expressions' array");
        }
        List<ExpressionRecord> records = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            records.add(toRecord(array.get(i), i));
        }
        return records;
    }

    private ExpressionRecord toRecord(JsonNode json, int index) throws CompilationException {
        if (!json.isObject()) {
            throw invalid(index, "not an object");
        }
        String type = text(json, "expressionType", "expression_type");
        String originalText = text(json, "originalText", "original_text");
        if (type == null) {
            throw invalid(index, "missing expressionType");
        }
        if (originalText == null) {
            throw invalid(index, "missing originalText");
        }
        ExpressionContext context;
        try {
            context = ExpressionContext.fromInput(type);
        } catch (IllegalArgumentException e) {
            throw new CompilationException(CompilerErrorCode.INVALID_CORPUS, "Record " + index + ": " + e.getMessage(), e);
        }
        JsonNode ast = json.has("parsedAst") ? json.get("parsedAst") : json.get("parsed_ast");
        return new ExpressionRecord(context, originalText, ast, usage(json.get("usage")));
    }

    private static UsageSite usage(JsonNode json) {
        if (json == null || !json.isObject()) {
            return null;
        }
        return new UsageSite(json.path("module").asText(""), json.path("table").asText(""), json.path("tag").asText(""));
    }

    private static String text(JsonNode json, String camelCase, String snakeCase) {
        JsonNode value = json.has(camelCase) ? json.get(camelCase) : json.get(snakeCase);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static CompilationException invalid(int index, String reason) {
        return new CompilationException(CompilerErrorCode.INVALID_CORPUS, "Record " + index + ": " + reason);
    }
}
