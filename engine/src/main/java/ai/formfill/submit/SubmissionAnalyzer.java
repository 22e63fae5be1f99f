package ai.formfill.submit;

import ai.formfill.data.FieldType;
import ai.formfill.data.PersonalDataStore;
import ai.formfill.form.ClassifiedField;
import ai.formfill.form.FormControlType;
import ai.formfill.form.ParsedForm;
import ai.formfill.metrics.AutofillMetrics;
import ai.formfill.metrics.AutofillMetrics.QualityMetric;
import java.util.HashMap;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Looks at what the user actually submitted: records, for every field, which stored types its value could be, and
 * compares that with the types predicted when the form was first seen.
 */
public final class SubmissionAnalyzer {
    private static final Logger logger = LogManager.getLogger(SubmissionAnalyzer.class);

    private final PersonalDataStore dataStore;
    private final AutofillMetrics metrics;

    public SubmissionAnalyzer(PersonalDataStore dataStore, AutofillMetrics metrics) {
        this.dataStore = dataStore;
        this.metrics = metrics;
    }

    public void determinePossibleTypes(ParsedForm submitted) {
        for (int i = 0; i < submitted.fieldCount(); i++) {
            submitted.setPossibleTypes(i, possibleTypes(submitted.field(i)));
        }
    }

    private Set<FieldType> possibleTypes(ClassifiedField field) {
        var types = dataStore.possibleFieldTypes(field.field().value());
        return types.isEmpty() ? Set.of(FieldType.UNKNOWN_TYPE) : types;
    }

    /**
     * Logs per-field quality metrics for a submission, keyed by the cached form's experiment id. Select controls are
     * skipped since they do not report whether they were autofilled.
     *
     * @param cached the version of the form parsed when it was seen; nothing is logged without it
     */
    public void logQualityMetrics(ParsedForm submitted, @Nullable ParsedForm cached) {
        if (cached == null) {
            logger.warn("Submitted form {} was never seen; skipping quality metrics", submitted.signature());
            return;
        }

        var cachedFields = new HashMap<String, ClassifiedField>();
        for (var field : cached.fields()) {
            cachedFields.put(field.fieldSignature(), field);
        }

        var experimentId = cached.experimentId();
        for (var field : submitted.fields()) {
            if (field.field().controlType() == FormControlType.SELECT_ONE) {
                continue;
            }
            var types = possibleTypes(field);

            metrics.log(QualityMetric.FIELD_SUBMITTED, experimentId);
            if (types.contains(FieldType.EMPTY_TYPE) || types.contains(FieldType.UNKNOWN_TYPE)) {
                continue;
            }
            if (field.field().autofilled()) {
                metrics.log(QualityMetric.FIELD_AUTOFILLED, experimentId);
                continue;
            }

            metrics.log(QualityMetric.FIELD_AUTOFILL_FAILED, experimentId);
            var cachedField = cachedFields.get(field.fieldSignature());
            var heuristicType = cachedField == null ? FieldType.UNKNOWN_TYPE : cachedField.heuristicType();
            var serverType = cachedField == null ? FieldType.NO_SERVER_DATA : cachedField.serverType();

            if (heuristicType == FieldType.UNKNOWN_TYPE) {
                metrics.log(QualityMetric.FIELD_HEURISTIC_TYPE_UNKNOWN, experimentId);
            } else if (types.contains(heuristicType)) {
                metrics.log(QualityMetric.FIELD_HEURISTIC_TYPE_MATCH, experimentId);
            } else {
                metrics.log(QualityMetric.FIELD_HEURISTIC_TYPE_MISMATCH, experimentId);
            }

            if (serverType == FieldType.NO_SERVER_DATA) {
                metrics.log(QualityMetric.FIELD_SERVER_TYPE_UNKNOWN, experimentId);
            } else if (types.contains(serverType)) {
                metrics.log(QualityMetric.FIELD_SERVER_TYPE_MATCH, experimentId);
            } else {
                metrics.log(QualityMetric.FIELD_SERVER_TYPE_MISMATCH, experimentId);
            }
        }
    }
}
