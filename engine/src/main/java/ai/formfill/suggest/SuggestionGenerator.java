package ai.formfill.suggest;

import ai.formfill.data.FieldType;
import ai.formfill.data.PersonalDataStore;
import ai.formfill.data.Profile;
import ai.formfill.form.FormField;
import ai.formfill.form.ParsedForm;
import ai.formfill.ids.GuidPacker;
import java.util.ArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Scans stored records for values that extend what the user has typed into a field. */
public final class SuggestionGenerator {
    private static final Logger logger = LogManager.getLogger(SuggestionGenerator.class);

    static final String CARD_LABEL_PREFIX = "*";

    private final PersonalDataStore dataStore;
    private final GuidPacker packer;

    public SuggestionGenerator(PersonalDataStore dataStore, GuidPacker packer) {
        this.dataStore = dataStore;
        this.packer = packer;
    }

    /** Profile rows for {@code field}, labelled so that profiles with the same value can be told apart. No icons. */
    public SuggestionSet profileSuggestions(ParsedForm form, FormField field, FieldType type) {
        var matched = new ArrayList<Profile>();
        var values = new ArrayList<String>();
        var ids = new ArrayList<Integer>();
        for (var profile : dataStore.profiles()) {
            var text = profile.fieldText(type);
            if (!text.isEmpty() && startsWithIgnoreCase(text, field.value())) {
                matched.add(profile);
                values.add(text);
                ids.add(packer.pack("", profile.guid()));
            }
        }

        var labels = ProfileLabeler.inferLabels(matched, form.fieldTypes(), type, 1);
        var builder = new SuggestionSet.Builder();
        for (int i = 0; i < values.size(); i++) {
            builder.add(values.get(i), labels.get(i), "", ids.get(i));
        }
        logger.debug("{} profile suggestions for {} ({})", values.size(), field.name(), type);
        return builder.build();
    }

    /** Card rows for {@code field}. Card numbers are only ever offered in obfuscated form. */
    public SuggestionSet creditCardSuggestions(ParsedForm form, FormField field, FieldType type) {
        var builder = new SuggestionSet.Builder();
        int count = 0;
        for (var card : dataStore.paymentCards()) {
            var text = card.fieldText(type);
            if (text.isEmpty() || !startsWithIgnoreCase(text, field.value())) {
                continue;
            }
            if (type == FieldType.CREDIT_CARD_NUMBER) {
                text = card.obfuscatedNumber();
            }
            builder.add(text, CARD_LABEL_PREFIX + card.lastFourDigits(), card.brandIcon(), packer.pack(card.guid(), ""));
            count++;
        }
        logger.debug("{} card suggestions for {} ({}) in {}", count, field.name(), type, form.signature());
        return builder.build();
    }

    static boolean startsWithIgnoreCase(String text, String prefix) {
        return text.regionMatches(true, 0, prefix, 0, prefix.length());
    }
}
