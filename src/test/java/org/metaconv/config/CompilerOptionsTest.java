package org.metaconv.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.metaconv.compiler.api.ExpressionContext;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CompilerOptionsTest {

    @Test
    void defaults_comeFromReferenceConf() {
        CompilerOptions options = CompilerOptions.defaults();

        assertThat(options.qualifiedClassName()).isEqualTo("org.metaconv.generated.TagExpressions");
        assertThat(options.hashLength()).isEqualTo(16);
        assertThat(options.outputDirectory()).isEqualTo(Path.of("build/metaconv"));
        assertThat(options.lookupFile()).isEqualTo("lookup.json");
        assertThat(options.reportFile()).isEqualTo("coverage-report.json");
        assertThat(options.manualImplementations().size()).isZero();
    }

    @Test
    void fromConfig_readsManualImplementations() {
        Config config = ConfigFactory.parseString("""
                metaconv.compiler.manual-implementations = [
                  { context = DISPLAY_FORMAT, expression = "GPS::ConvertTimeStamp($val)", method = "com.example.Gps.timeStamp" }
                ]
                """).withFallback(ConfigFactory.defaultReference()).resolve();

        CompilerOptions options = CompilerOptions.fromConfig(config);

        assertThat(options.manualImplementations()
                .lookup(ExpressionContext.DISPLAY_FORMAT, "GPS::ConvertTimeStamp($val)"))
                .contains("com.example.Gps.timeStamp");
    }

    @Test
    void fromConfig_malformedManualMethod_fails() {
        Config config = ConfigFactory.parseString("""
                metaconv.compiler.manual-implementations = [
                  { context = DISPLAY_FORMAT, expression = "$val", method = "timeStamp" }
                ]
                """).withFallback(ConfigFactory.defaultReference()).resolve();

        assertThatThrownBy(() -> CompilerOptions.fromConfig(config))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fromConfig_overridesWinOverReference() {
        Config config = ConfigFactory.parseString("""
                metaconv.compiler {
                  generated-package = "com.example.tags"
                  parallelism = 4
                }
                """).withFallback(ConfigFactory.defaultReference()).resolve();

        CompilerOptions options = CompilerOptions.fromConfig(config);

        assertThat(options.generatedPackage()).isEqualTo("com.example.tags");
        assertThat(options.generatedClass()).isEqualTo("TagExpressions");
        assertThat(options.parallelism()).isEqualTo(4);
    }

    @Test
    void fromConfig_missingSection_fails() {
        assertThatThrownBy(() -> CompilerOptions.fromConfig(ConfigFactory.empty()))
                .isInstanceOf(ConfigException.Missing.class);
    }

    @Test
    void parallelism_mustBePositive() {
        CompilerOptions options = CompilerOptions.defaults();

        assertThatThrownBy(() -> options.withParallelism(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 1");
    }

    @Test
    void withers_keepOtherSettings() {
        CompilerOptions options = CompilerOptions.defaults()
                .withOutputDirectory(Path.of("out"))
                .withParallelism(3);

        assertThat(options.outputDirectory()).isEqualTo(Path.of("out"));
        assertThat(options.parallelism()).isEqualTo(3);
        assertThat(options.generatedClass()).isEqualTo("TagExpressions");
    }
}
