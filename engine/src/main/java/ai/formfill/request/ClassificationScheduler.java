package ai.formfill.request;

import ai.formfill.form.ParsedForm;
import ai.formfill.metrics.AutofillMetrics;
import ai.formfill.prefs.AutofillPrefs;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Issues classification queries when forms are seen and uploads when forms are submitted. Both are fire-and-forget:
 * the in-flight flags are cleared when a response or error arrives, and nothing waits on them.
 */
public final class ClassificationScheduler {
    private static final Logger logger = LogManager.getLogger(ClassificationScheduler.class);

    private final ClassificationClient client;
    private final RecentlyAutofilledForms recentlyAutofilled;
    private final AutofillMetrics metrics;
    private final AutofillPrefs prefs;

    private boolean queryInFlight;
    private boolean uploadInFlight;

    public ClassificationScheduler(
            ClassificationClient client,
            RecentlyAutofilledForms recentlyAutofilled,
            AutofillMetrics metrics,
            AutofillPrefs prefs) {
        this.client = client;
        this.recentlyAutofilled = recentlyAutofilled;
        this.metrics = metrics;
        this.prefs = prefs;
    }

    /** Asks the service to classify {@code forms}. Does nothing for an empty list or a disabled client. */
    public boolean query(List<ParsedForm> forms) {
        if (forms.isEmpty() || !client.isEnabled()) {
            return false;
        }
        var request = new ClassificationClient.QueryRequest(
                forms.stream().map(ParsedForm::signature).toList(), ClassificationCodec.encodeQuery(forms));
        if (!client.startQuery(request)) {
            logger.debug("Query for {} forms was not started", forms.size());
            return false;
        }
        queryInFlight = true;
        metrics.log(AutofillMetrics.ServerQueryMetric.QUERY_SENT);
        logger.debug("Query started for {}", request.formSignatures());
        return true;
    }

    /** Reports the possible types of a submitted form, flagged with whether it was one of the last forms filled. */
    public boolean upload(ParsedForm submitted) {
        if (!client.isEnabled()) {
            return false;
        }
        boolean wasAutofilled = recentlyAutofilled.wasRecentlyAutofilled(submitted.signature());
        double rate = wasAutofilled ? prefs.positiveUploadRate() : prefs.negativeUploadRate();
        var request = new ClassificationClient.UploadRequest(
                submitted.signature(), wasAutofilled, ClassificationCodec.encodeUpload(submitted, wasAutofilled, rate));
        if (!client.startUpload(request)) {
            logger.debug("Upload for {} was not started", submitted.signature());
            return false;
        }
        uploadInFlight = true;
        logger.debug("Upload started for {} (autofilled={})", submitted.signature(), wasAutofilled);
        return true;
    }

    /** Marks whichever request the response or error belongs to as finished. */
    public void requestFinished(ClassificationClient.RequestType type) {
        switch (type) {
            case QUERY -> queryInFlight = false;
            case UPLOAD -> uploadInFlight = false;
        }
    }

    public boolean isQueryInFlight() {
        return queryInFlight;
    }

    public boolean isUploadInFlight() {
        return uploadInFlight;
    }
}
