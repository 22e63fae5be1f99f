package ai.formfill.fill;

import ai.formfill.data.AutofillRecord;
import ai.formfill.data.FieldType;
import ai.formfill.form.FormData;
import ai.formfill.form.FormField;
import ai.formfill.form.ParsedForm;
import ai.formfill.form.SelectControlFiller;
import ai.formfill.request.RecentlyAutofilledForms;
import ai.formfill.section.FieldAlignment;
import ai.formfill.section.SectionFinder;
import ai.formfill.section.SectionRange;
import com.google.common.base.Strings;
import java.util.ArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes a record's values into the live form. The cached form supplies the field types; the live form supplies the
 * controls, which may have been added or removed by the page since parsing.
 */
public final class FormFiller {
    private static final Logger logger = LogManager.getLogger(FormFiller.class);

    private final SelectControlFiller selectFiller;
    private final RecentlyAutofilledForms recentlyAutofilled;

    public FormFiller(SelectControlFiller selectFiller, RecentlyAutofilledForms recentlyAutofilled) {
        this.selectFiller = selectFiller;
        this.recentlyAutofilled = recentlyAutofilled;
    }

    /**
     * Fills the section of {@code live} that corresponds to {@code section} of the cached form. When the section was
     * already autofilled the user is editing a single value, so only {@code target} is refilled.
     *
     * @param targetIndex index in {@code form} of the field that initiated the fill
     * @return the updated live form
     */
    public FormData fill(
            ParsedForm form,
            SectionRange section,
            AutofillRecord record,
            FormData live,
            FormField target,
            int targetIndex) {
        var result = new ArrayList<>(live.fields());

        if (SectionFinder.isSectionAutofilled(form, live, section)) {
            var type = form.field(targetIndex).effectiveType();
            for (int j = 0; j < result.size(); j++) {
                if (result.get(j).sameControlAs(target)) {
                    result.set(j, fillField(result.get(j), type, record));
                    break;
                }
            }
            logger.debug("Section {} of {} already filled; refilled {} only", section, form.signature(), target.name());
            return live.withFields(result);
        }

        int filled = 0;
        for (var match : FieldAlignment.align(form, section, section.end(), live.fields())) {
            var type = form.field(match.cachedIndex()).effectiveType();
            if (type.isUnknown()) {
                continue;
            }
            var before = result.get(match.liveIndex());
            var after = fillField(before, type, record);
            if (after != before) {
                filled++;
            }
            result.set(match.liveIndex(), after);
        }
        recentlyAutofilled.record(form.signature());
        logger.debug("Filled {} fields of section {} in {}", filled, section, form.signature());
        return live.withFields(result);
    }

    /** Returns {@code field} itself when there is nothing to write. */
    FormField fillField(FormField field, FieldType type, AutofillRecord record) {
        return switch (FillStrategy.of(field, type, record)) {
            case SELECT -> selectFiller
                    .selectOption(field, type, record.fieldText(type))
                    .map(field::withFilledValue)
                    .orElse(field);
            case MONTH -> {
                var year = record.fieldText(FieldType.CREDIT_CARD_EXP_4_DIGIT_YEAR);
                var month = record.fieldText(FieldType.CREDIT_CARD_EXP_MONTH);
                yield year.isEmpty() || month.isEmpty()
                        ? field
                        : field.withFilledValue(year + "-" + Strings.padStart(month, 2, '0'));
            }
            case PHONE_SPLIT -> withText(field, PhoneNumberSplitter.partFor(record.fieldText(type), field.maxLength()));
            case PLAIN -> withText(field, record.fieldText(type));
        };
    }

    private static FormField withText(FormField field, String text) {
        return text.isEmpty() ? field : field.withFilledValue(text);
    }
}
