package ai.formfill;

import ai.formfill.data.AutofillRecord;
import ai.formfill.data.PaymentCard;
import ai.formfill.data.PersonalDataStore;
import ai.formfill.data.SaveCardPrompt;
import ai.formfill.exception.MalformedResponseException;
import ai.formfill.fill.FormFiller;
import ai.formfill.fill.OptionSelectFiller;
import ai.formfill.form.FormData;
import ai.formfill.form.FormField;
import ai.formfill.form.FormParser;
import ai.formfill.form.ParsedForm;
import ai.formfill.form.SelectControlFiller;
import ai.formfill.ids.GuidPacker;
import ai.formfill.metrics.AutofillMetrics;
import ai.formfill.metrics.AutofillMetrics.ServerQueryMetric;
import ai.formfill.prefs.AutofillPrefs;
import ai.formfill.request.ClassificationClient;
import ai.formfill.request.ClassificationCodec;
import ai.formfill.request.ClassificationScheduler;
import ai.formfill.request.RecentlyAutofilledForms;
import ai.formfill.section.SectionFinder;
import ai.formfill.submit.SubmissionAnalyzer;
import ai.formfill.suggest.SuggestionGenerator;
import ai.formfill.suggest.SuggestionSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;

/**
 * Entry point for the autofill engine. Handles renderer events one at a time: forms seen, field queries, fill
 * requests, submissions and navigation, plus the classification service's responses.
 *
 * <p>All methods must be called from the same sequential execution context; the class does no locking.
 */
public final class AutofillManager implements ClassificationClient.Observer {
    private static final Logger logger = LogManager.getLogger(AutofillManager.class);

    static final String WARNING_FORM_DISABLED = "This form has disabled automatic filling.";
    static final String WARNING_INSECURE_CONNECTION =
            "Automatic credit card filling is disabled because this form does not use a secure connection.";

    /** Notified after the renderer reports that a fill or a suggestion popup actually happened. */
    public interface Listener {
        default void didFillFormData() {}

        default void didShowSuggestions() {}
    }

    private final AutofillPrefs prefs;
    private final PersonalDataStore dataStore;
    private final FormParser parser;
    private final AutofillMetrics metrics;
    private final SaveCardPrompt saveCardPrompt;
    private final GuidPacker packer;

    private final FormCache cache = new FormCache();
    private final RecentlyAutofilledForms recentlyAutofilled = new RecentlyAutofilledForms();
    private final SuggestionGenerator suggestionGenerator;
    private final FormFiller formFiller;
    private final SubmissionAnalyzer submissionAnalyzer;
    private final ClassificationScheduler scheduler;
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    private AutofillManager(Builder builder) {
        this.prefs = builder.prefs;
        this.dataStore = builder.dataStore;
        this.parser = builder.parser;
        this.metrics = builder.metrics;
        this.saveCardPrompt = builder.saveCardPrompt;
        this.packer = builder.packer;
        this.suggestionGenerator = new SuggestionGenerator(dataStore, packer);
        this.formFiller = new FormFiller(builder.selectFiller, recentlyAutofilled);
        this.submissionAnalyzer = new SubmissionAnalyzer(dataStore, metrics);
        this.scheduler = new ClassificationScheduler(builder.client, recentlyAutofilled, metrics, prefs);
        builder.client.setObserver(this);
    }

    public static Builder builder(PersonalDataStore dataStore, FormParser parser) {
        return new Builder(dataStore, parser);
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }

    /**
     * Parses the forms of a newly loaded page. Forms that can be queried are cached first and sent to the
     * classification service; forms submitted with GET are cached afterwards and never queried.
     */
    public void onFormsSeen(List<FormData> forms) {
        if (!prefs.isAutofillEnabled()) {
            return;
        }
        var queryable = new ArrayList<ParsedForm>();
        var nonQueryable = new ArrayList<ParsedForm>();
        for (var form : forms) {
            var parsed = parser.parse(form);
            if (!parsed.shouldBeParsed(false)) {
                continue;
            }
            if (parsed.shouldBeParsed(true)) {
                queryable.add(parsed);
            } else {
                nonQueryable.add(parsed);
            }
        }
        queryable.forEach(cache::put);
        scheduler.query(queryable);
        nonQueryable.forEach(cache::put);
        logger.debug("Cached {} queryable and {} other forms", queryable.size(), nonQueryable.size());
    }

    /** Suggestions for {@code field}, possibly a single warning row, possibly empty. */
    public SuggestionSet onQueryFormField(FormData form, FormField field) {
        if (dataStore.isEmpty()) {
            return SuggestionSet.empty();
        }
        var cached = cache.find(form).orElse(null);
        if (cached == null || cached.autofillCount() == 0 || !cached.isAutofillable(false)) {
            logger.debug("No autofillable cached form for query on {}", field.name());
            return SuggestionSet.empty();
        }
        var index = cached.indexOf(field);
        if (index.isEmpty()) {
            logger.debug("Field {} not found in cached form {}", field.name(), cached.signature());
            return SuggestionSet.empty();
        }

        var cachedField = cached.field(index.getAsInt());
        var type = cachedField.effectiveType();
        boolean fillingPayment = type.isPayment();
        var suggestions = fillingPayment
                ? suggestionGenerator.creditCardSuggestions(cached, field, type)
                : suggestionGenerator.profileSuggestions(cached, field, type);
        if (suggestions.isEmpty()) {
            return suggestions;
        }

        if (!prefs.isAutofillEnabled() || !cached.isAutofillable(true)) {
            return SuggestionSet.warning(WARNING_FORM_DISABLED);
        }
        if (fillingPayment && !cached.isSecure()) {
            return SuggestionSet.warning(WARNING_INSECURE_CONNECTION);
        }

        var section = SectionFinder.findSectionBounds(cached, index.getAsInt(), fillingPayment);
        if (SectionFinder.isSectionAutofilled(cached, form, section)) {
            suggestions = suggestions.withBlankLabelsAndIcons();
        }
        return suggestions.withoutDuplicates();
    }

    /**
     * Fills the section of {@code form} containing {@code field} with the record identified by {@code uniqueId}.
     *
     * @return the filled form, or empty when the form, field or record can no longer be found
     */
    public Optional<FormData> onFillFormData(FormData form, FormField field, int uniqueId) {
        if (!prefs.isAutofillEnabled() || dataStore.isEmpty() || uniqueId == GuidPacker.INVALID_ID) {
            return Optional.empty();
        }
        var cached = cache.find(form).orElse(null);
        if (cached == null || cached.autofillCount() == 0) {
            return Optional.empty();
        }
        var index = cached.indexOf(field);
        if (index.isEmpty()) {
            return Optional.empty();
        }

        var guids = packer.unpack(uniqueId);
        var record = findRecord(guids.cardGuid(), guids.profileGuid());
        if (record == null) {
            logger.debug("No stored record for id {}", uniqueId);
            return Optional.empty();
        }

        boolean fillingPayment = record instanceof PaymentCard;
        var type = cached.field(index.getAsInt()).effectiveType();
        if (type.isUnknown() || type.isPayment() != fillingPayment) {
            logger.warn("Record kind does not fit field {} of type {}", field.name(), type);
            return Optional.empty();
        }

        var section = SectionFinder.findSectionBounds(cached, index.getAsInt(), fillingPayment);
        return Optional.of(formFiller.fill(cached, section, record, form, field, index.getAsInt()));
    }

    private @Nullable AutofillRecord findRecord(String cardGuid, String profileGuid) {
        if (!profileGuid.isEmpty()) {
            return dataStore.profiles().stream()
                    .filter(p -> p.guid().equals(profileGuid))
                    .findFirst()
                    .orElse(null);
        }
        if (!cardGuid.isEmpty()) {
            return dataStore.paymentCards().stream()
                    .filter(c -> c.guid().equals(cardGuid))
                    .findFirst()
                    .orElse(null);
        }
        return null;
    }

    /**
     * Learns from a submitted form: logs prediction quality, uploads the observed types and offers to keep any new
     * card. Script-submitted forms and off-the-record sessions are ignored.
     */
    public void onFormSubmitted(FormData form) {
        if (!prefs.isAutofillEnabled() || prefs.isOffTheRecord() || !form.userSubmitted()) {
            return;
        }
        var submitted = parser.parse(form);
        if (!submitted.shouldBeParsed(true)) {
            return;
        }

        submissionAnalyzer.determinePossibleTypes(submitted);
        submissionAnalyzer.logQualityMetrics(submitted, cache.find(form).orElse(null));
        scheduler.upload(submitted);

        if (submitted.isAutofillable(true)) {
            importFormData(submitted);
        }
    }

    private void importFormData(ParsedForm submitted) {
        var result = dataStore.importFormData(submitted);
        if (!result.imported() || result.paymentCard() == null) {
            return;
        }
        var card = result.paymentCard();
        saveCardPrompt.offer(card, accepted -> {
            if (accepted) {
                dataStore.saveImportedCard(card);
            }
        });
    }

    public void onNavigationCommitted() {
        logger.debug("Navigation committed; dropping {} cached forms", cache.size());
        cache.clear();
    }

    public void onDidFillFormData() {
        listeners.forEach(Listener::didFillFormData);
    }

    public void onDidShowSuggestions() {
        listeners.forEach(Listener::didShowSuggestions);
    }

    @Override
    public void onQueryResponse(String responsePayload) {
        scheduler.requestFinished(ClassificationClient.RequestType.QUERY);
        metrics.log(ServerQueryMetric.QUERY_RESPONSE_RECEIVED);

        ClassificationCodec.QueryResponse response;
        try {
            response = ClassificationCodec.decodeResponse(responsePayload);
        } catch (MalformedResponseException e) {
            logger.warn("Dropping classification response: {}", e.getMessage());
            return;
        }
        metrics.log(ServerQueryMetric.QUERY_RESPONSE_PARSED);

        var consumed = new HashSet<ParsedForm>();
        for (var prediction : response.forms()) {
            var cached = cache.findBySignature(prediction.signature(), consumed).orElse(null);
            if (cached == null) {
                logger.debug("Ignoring prediction for form {} that is no longer cached", prediction.signature());
                continue;
            }
            consumed.add(cached);
            var heuristicOutcome = compareWithHeuristics(cached, prediction);
            if (!cached.updateFromServer(prediction.fieldTypes(), response.experimentId())) {
                logger.debug("Ignoring prediction for form {} with mismatched field count", prediction.signature());
                continue;
            }
            metrics.log(heuristicOutcome);
        }
    }

    private static ServerQueryMetric compareWithHeuristics(
            ParsedForm cached, ClassificationCodec.FormPrediction prediction) {
        boolean heuristicsDetectedField = false;
        boolean overrode = false;
        int n = Math.min(cached.fieldCount(), prediction.fieldTypes().size());
        for (int i = 0; i < n; i++) {
            var heuristic = cached.field(i).heuristicType();
            if (!heuristic.isUnknown()) {
                heuristicsDetectedField = true;
                if (heuristic != prediction.fieldTypes().get(i)) {
                    overrode = true;
                }
            }
        }
        if (overrode) {
            return ServerQueryMetric.QUERY_RESPONSE_OVERRODE_LOCAL_HEURISTICS;
        }
        return heuristicsDetectedField
                ? ServerQueryMetric.QUERY_RESPONSE_MATCHED_LOCAL_HEURISTICS
                : ServerQueryMetric.QUERY_RESPONSE_WITH_NO_LOCAL_HEURISTICS;
    }

    @Override
    public void onUploadComplete(String formSignature) {
        scheduler.requestFinished(ClassificationClient.RequestType.UPLOAD);
        logger.debug("Upload for {} complete", formSignature);
    }

    @Override
    public void onRequestError(String formSignature, ClassificationClient.RequestType requestType, int httpStatus) {
        scheduler.requestFinished(requestType);
        logger.warn("{} request for {} failed with HTTP {}", requestType, formSignature, httpStatus);
    }

    @VisibleForTesting
    FormCache cache() {
        return cache;
    }

    @VisibleForTesting
    RecentlyAutofilledForms recentlyAutofilled() {
        return recentlyAutofilled;
    }

    @VisibleForTesting
    ClassificationScheduler scheduler() {
        return scheduler;
    }

    public GuidPacker packer() {
        return packer;
    }

    public static final class Builder {
        private final PersonalDataStore dataStore;
        private final FormParser parser;
        private AutofillPrefs prefs = AutofillPrefs.defaults();
        private AutofillMetrics metrics = AutofillMetrics.logging();
        private ClassificationClient client = ClassificationClient.disabled();
        private SaveCardPrompt saveCardPrompt = SaveCardPrompt.declineAll();
        private SelectControlFiller selectFiller = new OptionSelectFiller();
        private GuidPacker packer = new GuidPacker();

        private Builder(PersonalDataStore dataStore, FormParser parser) {
            this.dataStore = Objects.requireNonNull(dataStore, "dataStore");
            this.parser = Objects.requireNonNull(parser, "parser");
        }

        public Builder prefs(AutofillPrefs prefs) {
            this.prefs = Objects.requireNonNull(prefs);
            return this;
        }

        public Builder metrics(AutofillMetrics metrics) {
            this.metrics = Objects.requireNonNull(metrics);
            return this;
        }

        public Builder client(ClassificationClient client) {
            this.client = Objects.requireNonNull(client);
            return this;
        }

        public Builder saveCardPrompt(SaveCardPrompt saveCardPrompt) {
            this.saveCardPrompt = Objects.requireNonNull(saveCardPrompt);
            return this;
        }

        public Builder selectFiller(SelectControlFiller selectFiller) {
            this.selectFiller = Objects.requireNonNull(selectFiller);
            return this;
        }

        /** Shares an id table across managers, e.g. across tabs of one process. */
        public Builder packer(GuidPacker packer) {
            this.packer = Objects.requireNonNull(packer);
            return this;
        }

        public AutofillManager build() {
            return new AutofillManager(this);
        }
    }
}
