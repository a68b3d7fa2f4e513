package org.metaconv.compiler.backend.verify;

import org.metaconv.compiler.api.CompilationException;
import org.metaconv.compiler.api.CompilerErrorCode;
import org.metaconv.runtime.TagValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Compiles an emitted module with the system Java compiler and loads it. Used to check that the
 * generated source is valid Java and to call generated functions from tests.
 * <p>
 * Loaded classes stay usable until the compiler is closed, which closes their class loaders.
 */
public class GeneratedSourceCompiler implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(GeneratedSourceCompiler.class);

    private final Path workDirectory;
    private final List<Path> extraClasspath;
    private final List<URLClassLoader> loaders = new ArrayList<>();

    /**
     * @param workDirectory Directory for the source and class files; created if missing.
     */
    public GeneratedSourceCompiler(Path workDirectory) {
        this(workDirectory, List.of());
    }

    /**
     * @param workDirectory Directory for the source and class files; created if missing.
     * @param extraClasspath Locations of classes the module refers to besides the runtime library,
     *                       such as manual implementations.
     */
    public GeneratedSourceCompiler(Path workDirectory, List<Path> extraClasspath) {
        this.workDirectory = workDirectory;
        this.extraClasspath = List.copyOf(extraClasspath);
    }

    /**
     * Compiles one compilation unit and loads the named class.
     *
     * @param qualifiedClassName The fully qualified name of the top-level class in {@code source}.
     * @param source The Java source.
     * @return The loaded class.
     * @throws CompilationException if the source does not compile or cannot be loaded.
     */
    public Class<?> compileAndLoad(String qualifiedClassName, String source) throws CompilationException {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new CompilationException(CompilerErrorCode.GENERATED_SOURCE_INVALID,
                    "No system Java compiler available; a JDK is required to verify generated sources");
        }
        Path sourceDir = workDirectory.resolve("src");
        Path classesDir = workDirectory.resolve("classes");
        try {
            Path sourceFile = sourceDir.resolve(qualifiedClassName.replace('.', '/') + ".java");
            Files.createDirectories(sourceFile.getParent());
            Files.createDirectories(classesDir);
            Files.writeString(sourceFile, source, StandardCharsets.UTF_8);

            DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
            try (StandardJavaFileManager fileManager =
                         compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8)) {
                Iterable<? extends JavaFileObject> units = fileManager.getJavaFileObjects(sourceFile.toFile());
                List<String> options = List.of(
                        "-d", classesDir.toString(),
                        "-classpath", classpath(),
                        "-encoding", "UTF-8",
                        "-proc:none");
                JavaCompiler.CompilationTask task =
                        compiler.getTask(null, fileManager, diagnostics, options, null, units);
                if (!Boolean.TRUE.equals(task.call())) {
                    throw new CompilationException(CompilerErrorCode.GENERATED_SOURCE_INVALID,
                            "Generated source " + qualifiedClassName + " does not compile:\n" + describe(diagnostics));
                }
            }
            LOG.debug("Compiled {} into {}", qualifiedClassName, classesDir);

            List<URL> urls = new ArrayList<>();
            urls.add(classesDir.toUri().toURL());
            for (Path entry : extraClasspath) {
                urls.add(entry.toUri().toURL());
            }
            URLClassLoader loader = new URLClassLoader(urls.toArray(new URL[0]), TagValue.class.getClassLoader());
            loaders.add(loader);
            return loader.loadClass(qualifiedClassName);
        } catch (IOException | ClassNotFoundException e) {
            throw new CompilationException(CompilerErrorCode.GENERATED_SOURCE_INVALID,
                    "Cannot compile or load " + qualifiedClassName + ": " + e.getMessage(), e);
        }
    }

    private static String describe(DiagnosticCollector<JavaFileObject> diagnostics) {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic<? extends JavaFileObject> d : diagnostics.getDiagnostics()) {
            if (d.getKind() == Diagnostic.Kind.ERROR) {
                sb.append("  line ").append(d.getLineNumber()).append(": ")
                        .append(d.getMessage(Locale.ROOT)).append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Closes the class loaders of all modules loaded by this compiler.
     */
    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (URLClassLoader loader : loaders) {
            try {
                loader.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        loaders.clear();
        if (failure != null) {
            throw failure;
        }
    }

    private String classpath() throws MalformedURLException {
        List<String> entries = new ArrayList<>();
        String runtime = runtimeClasspath();
        if (!runtime.isEmpty()) {
            entries.add(runtime);
        }
        extraClasspath.forEach(entry -> entries.add(entry.toString()));
        return String.join(File.pathSeparator, entries);
    }

    /**
     * The location of the runtime library followed by the JVM class path.
     */
    static String runtimeClasspath() throws MalformedURLException {
        List<String> entries = new ArrayList<>();
        CodeSource codeSource = TagValue.class.getProtectionDomain().getCodeSource();
        if (codeSource != null && codeSource.getLocation() != null) {
            try {
                entries.add(Path.of(codeSource.getLocation().toURI()).toString());
            } catch (URISyntaxException e) {
                throw new MalformedURLException("Unusable runtime location " + codeSource.getLocation());
            }
        }
        String jvmClasspath = System.getProperty("java.class.path");
        if (jvmClasspath != null && !jvmClasspath.isEmpty()) {
            entries.add(jvmClasspath);
        }
        return String.join(File.pathSeparator, entries);
    }
}
