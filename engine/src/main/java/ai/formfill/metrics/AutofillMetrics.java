package ai.formfill.metrics;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Sink for autofill quality telemetry. Every event is keyed by the experiment id the classification service attached to
 * the form, or the empty string when there was none.
 *
 * Implementations are only called from the engine's single execution context.
 */
public interface AutofillMetrics {

    /** Per-field outcomes recorded when a form is submitted. */
    enum QualityMetric {
        FIELD_SUBMITTED,
        FIELD_AUTOFILLED,
        FIELD_AUTOFILL_FAILED,
        FIELD_HEURISTIC_TYPE_UNKNOWN,
        FIELD_HEURISTIC_TYPE_MATCH,
        FIELD_HEURISTIC_TYPE_MISMATCH,
        FIELD_SERVER_TYPE_UNKNOWN,
        FIELD_SERVER_TYPE_MATCH,
        FIELD_SERVER_TYPE_MISMATCH
    }

    /** Lifecycle of classification queries. */
    enum ServerQueryMetric {
        QUERY_SENT,
        QUERY_RESPONSE_RECEIVED,
        QUERY_RESPONSE_PARSED,
        QUERY_RESPONSE_MATCHED_LOCAL_HEURISTICS,
        QUERY_RESPONSE_OVERRODE_LOCAL_HEURISTICS,
        QUERY_RESPONSE_WITH_NO_LOCAL_HEURISTICS
    }

    void log(QualityMetric metric, String experimentId);

    void log(ServerQueryMetric metric);

    static AutofillMetrics noOp() {
        return NoOp.INSTANCE;
    }

    /** Writes each event at INFO to the {@code ai.formfill.metrics} logger. */
    static AutofillMetrics logging() {
        return new Logging();
    }

    /** Counts events in memory; useful for tests and diagnostics. */
    static Tracking tracking() {
        return new Tracking();
    }

    enum NoOp implements AutofillMetrics {
        INSTANCE;

        @Override
        public void log(QualityMetric metric, String experimentId) {}

        @Override
        public void log(ServerQueryMetric metric) {}
    }

    final class Logging implements AutofillMetrics {
        private static final Logger logger = LogManager.getLogger("ai.formfill.metrics");

        @Override
        public void log(QualityMetric metric, String experimentId) {
            logger.info("quality metric={} experiment={}", metric, experimentId.isEmpty() ? "-" : experimentId);
        }

        @Override
        public void log(ServerQueryMetric metric) {
            logger.info("server query metric={}", metric);
        }
    }

    final class Tracking implements AutofillMetrics {
        private final Map<QualityMetric, Integer> quality = new EnumMap<>(QualityMetric.class);
        private final Map<String, Map<QualityMetric, Integer>> qualityByExperiment = new HashMap<>();
        private final Map<ServerQueryMetric, Integer> serverQuery = new EnumMap<>(ServerQueryMetric.class);

        @Override
        public void log(QualityMetric metric, String experimentId) {
            quality.merge(metric, 1, Integer::sum);
            qualityByExperiment
                    .computeIfAbsent(experimentId, k -> new EnumMap<>(QualityMetric.class))
                    .merge(metric, 1, Integer::sum);
        }

        @Override
        public void log(ServerQueryMetric metric) {
            serverQuery.merge(metric, 1, Integer::sum);
        }

        public int count(QualityMetric metric) {
            return quality.getOrDefault(metric, 0);
        }

        public int count(QualityMetric metric, String experimentId) {
            return qualityByExperiment.getOrDefault(experimentId, Map.of()).getOrDefault(metric, 0);
        }

        public int count(ServerQueryMetric metric) {
            return serverQuery.getOrDefault(metric, 0);
        }
    }
}
