package ai.formfill.section;

import ai.formfill.data.FieldType;
import ai.formfill.form.FormData;
import ai.formfill.form.ParsedForm;
import java.util.EnumSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Splits a parsed form into logical sections. A section holds only card fields or only non-card fields, depending on
 * what is being filled, and never repeats a field type. Phone and fax types are exempt from the repeat rule since forms
 * often ask for several numbers and their detection is imprecise.
 */
public final class SectionFinder {
    private static final Logger logger = LogManager.getLogger(SectionFinder.class);

    private SectionFinder() {}

    /**
     * Finds the section containing the field at {@code targetIndex}. The scan stops at the first boundary after the
     * target, so fields past that point are never assigned to the target's section.
     *
     * @throws AssertionError if the target is not placed in any section
     */
    public static SectionRange findSectionBounds(ParsedForm form, int targetIndex, boolean fillingPayment) {
        int start = 0;
        int end = form.fieldCount();
        var seenTypes = EnumSet.noneOf(FieldType.class);
        boolean targetInCurrentSection = false;

        for (int i = 0; i < form.fieldCount(); i++) {
            var type = form.field(i).effectiveType().equivalentType();
            if (type.isUnknown()) {
                continue;
            }

            boolean repeated = seenTypes.contains(type) && !type.group().isPhoneOrFax();
            boolean appropriate = type.isPayment() == fillingPayment;

            if (repeated || !appropriate) {
                if (targetInCurrentSection) {
                    end = i;
                    break;
                }
                seenTypes.clear();
                if (appropriate) {
                    start = i;
                } else {
                    start = i + 1;
                    continue;
                }
            }

            seenTypes.add(type);
            if (i == targetIndex) {
                targetInCurrentSection = true;
            }
        }

        if (!targetInCurrentSection) {
            throw new AssertionError("Field " + targetIndex + " of " + form + " is outside every section");
        }
        var range = new SectionRange(start, end);
        logger.debug("Section for field {} of {} (payment={}): {}", targetIndex, form.signature(), fillingPayment, range);
        return range;
    }

    /**
     * True when every live field that pairs with a typed field of the section already carries the autofilled flag. A
     * section with no such pairs is not considered filled.
     */
    public static boolean isSectionAutofilled(ParsedForm form, FormData live, SectionRange range) {
        boolean sawTypedField = false;
        for (var match : FieldAlignment.align(form, range, form.fieldCount(), live.fields())) {
            if (form.field(match.cachedIndex()).effectiveType().isUnknown()) {
                continue;
            }
            sawTypedField = true;
            if (!live.fields().get(match.liveIndex()).autofilled()) {
                return false;
            }
        }
        return sawTypedField;
    }
}
