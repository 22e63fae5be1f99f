package ai.formfill.metrics;

import static org.junit.jupiter.api.Assertions.*;

import ai.formfill.metrics.AutofillMetrics.QualityMetric;
import ai.formfill.metrics.AutofillMetrics.ServerQueryMetric;
import org.junit.jupiter.api.Test;

public class AutofillMetricsTest {

    @Test
    void testTrackingCountsByExperiment() {
        var metrics = AutofillMetrics.tracking();
        metrics.log(QualityMetric.FIELD_SUBMITTED, "a");
        metrics.log(QualityMetric.FIELD_SUBMITTED, "a");
        metrics.log(QualityMetric.FIELD_SUBMITTED, "");
        metrics.log(ServerQueryMetric.QUERY_SENT);

        assertEquals(3, metrics.count(QualityMetric.FIELD_SUBMITTED));
        assertEquals(2, metrics.count(QualityMetric.FIELD_SUBMITTED, "a"));
        assertEquals(1, metrics.count(QualityMetric.FIELD_SUBMITTED, ""));
        assertEquals(0, metrics.count(QualityMetric.FIELD_SUBMITTED, "b"));
        assertEquals(1, metrics.count(ServerQueryMetric.QUERY_SENT));
        assertEquals(0, metrics.count(ServerQueryMetric.QUERY_RESPONSE_PARSED));
    }

    @Test
    void testLoggingAndNoOpSinksAcceptEvents() {
        assertDoesNotThrow(() -> {
            AutofillMetrics.logging().log(QualityMetric.FIELD_AUTOFILLED, "");
            AutofillMetrics.logging().log(ServerQueryMetric.QUERY_RESPONSE_RECEIVED);
            AutofillMetrics.noOp().log(QualityMetric.FIELD_AUTOFILLED, "exp");
        });
    }
}
