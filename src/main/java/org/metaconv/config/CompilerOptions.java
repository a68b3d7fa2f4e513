package org.metaconv.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.metaconv.compiler.registry.ManualImplementations;

import java.nio.file.Path;

/**
 * Settings of one compilation run, read from the {@code metaconv} section of the configuration.
 *
 * @param generatedPackage Package of the emitted module.
 * @param generatedClass Simple class name of the emitted module.
 * @param parallelism Worker threads for normalization and generation; 1 runs on the calling thread.
 * @param hashLength Hex digits of the content hash in function names.
 * @param manualImplementations Hand-written methods for expressions the generator cannot translate.
 * @param outputDirectory Where artifacts are written.
 * @param lookupFile File name of the lookup table.
 * @param reportFile File name of the coverage report.
 */
public record CompilerOptions(
        String generatedPackage,
        String generatedClass,
        int parallelism,
        int hashLength,
        ManualImplementations manualImplementations,
        Path outputDirectory,
        String lookupFile,
        String reportFile
) {

    public CompilerOptions {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
    }

    /**
     * @return The options from {@code reference.conf} alone.
     */
    public static CompilerOptions defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * @param config The resolved root configuration.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a setting is missing or has the wrong type.
     * @throws IllegalArgumentException if a manual implementation entry is malformed.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config compiler = config.getConfig("metaconv.compiler");
        Config output = config.getConfig("metaconv.output");
        return new CompilerOptions(
                compiler.getString("generated-package"),
                compiler.getString("generated-class"),
                compiler.getInt("parallelism"),
                compiler.getInt("hash-length"),
                ManualImplementations.fromConfig(compiler.getConfigList("manual-implementations")),
                Path.of(output.getString("directory")),
                output.getString("lookup-file"),
                output.getString("report-file"));
    }

    public CompilerOptions withOutputDirectory(Path directory) {
        return new CompilerOptions(generatedPackage, generatedClass, parallelism, hashLength, manualImplementations,
                directory, lookupFile, reportFile);
    }

    public CompilerOptions withParallelism(int threads) {
        return new CompilerOptions(generatedPackage, generatedClass, threads, hashLength, manualImplementations,
                outputDirectory, lookupFile, reportFile);
    }

    public CompilerOptions withManualImplementations(ManualImplementations implementations) {
        return new CompilerOptions(generatedPackage, generatedClass, parallelism, hashLength, implementations,
                outputDirectory, lookupFile, reportFile);
    }

    public String qualifiedClassName() {
        return generatedPackage + "." + generatedClass;
    }
}
