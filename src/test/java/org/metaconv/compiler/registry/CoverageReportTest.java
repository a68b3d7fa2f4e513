package org.metaconv.compiler.registry;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.metaconv.compiler.api.ExpressionContext;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class CoverageReportTest {

    @Test
    void emptyReport_hasFullCoverageAndAllContexts() {
        CoverageReport report = new CoverageReport(Map.of(), List.of());

        assertThat(report.contexts()).containsOnlyKeys(ExpressionContext.values());
        assertThat(report.stats(ExpressionContext.BOOLEAN_GATE)).isEqualTo(CoverageReport.ContextStats.EMPTY);
        assertThat(report.total()).isZero();
        assertThat(report.coverage()).isEqualTo(1.0);
    }

    @Test
    void totals_sumOverContexts() {
        CoverageReport report = new CoverageReport(Map.of(
                ExpressionContext.VALUE_TRANSFORM, new CoverageReport.ContextStats(6, 4, 1, 1, 4),
                ExpressionContext.DISPLAY_FORMAT, new CoverageReport.ContextStats(2, 1, 0, 1, 2)),
                List.of());

        assertThat(report.total()).isEqualTo(8);
        assertThat(report.generated()).isEqualTo(5);
        assertThat(report.manual()).isEqualTo(1);
        assertThat(report.fallback()).isEqualTo(2);
        assertThat(report.coverage()).isCloseTo(0.625, within(1e-9));
    }
}
