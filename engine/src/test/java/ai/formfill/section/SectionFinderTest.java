package ai.formfill.section;

import static ai.formfill.data.FieldType.*;
import static org.junit.jupiter.api.Assertions.*;

import ai.formfill.data.FieldType;
import ai.formfill.form.FormData;
import ai.formfill.form.FormField;
import ai.formfill.form.ParsedForm;
import ai.formfill.testutil.TestForms;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import org.junit.jupiter.api.Test;

public class SectionFinderTest {

    @Test
    void testIdentityAndPaymentAreSeparated() {
        var form = TestForms.parsed(NAME_FIRST, EMAIL_ADDRESS, CREDIT_CARD_NUMBER, CREDIT_CARD_EXP_MONTH);

        assertEquals(new SectionRange(0, 2), SectionFinder.findSectionBounds(form, 0, false));
        assertEquals(new SectionRange(0, 2), SectionFinder.findSectionBounds(form, 1, false));
        assertEquals(new SectionRange(2, 4), SectionFinder.findSectionBounds(form, 2, true));
        assertEquals(new SectionRange(2, 4), SectionFinder.findSectionBounds(form, 3, true));
    }

    @Test
    void testRepeatedTypeStartsNewSection() {
        var form = TestForms.parsed(
                NAME_FIRST, ADDRESS_HOME_LINE1, ADDRESS_HOME_CITY, NAME_FIRST, ADDRESS_HOME_LINE1, ADDRESS_HOME_CITY);

        assertEquals(new SectionRange(0, 3), SectionFinder.findSectionBounds(form, 1, false));
        assertEquals(new SectionRange(3, 6), SectionFinder.findSectionBounds(form, 4, false));
    }

    @Test
    void testBillingRepeatsHomeAddress() {
        var form = TestForms.parsed(ADDRESS_HOME_LINE1, ADDRESS_HOME_CITY, ADDRESS_BILLING_LINE1, ADDRESS_BILLING_CITY);

        assertEquals(new SectionRange(0, 2), SectionFinder.findSectionBounds(form, 0, false));
        assertEquals(new SectionRange(2, 4), SectionFinder.findSectionBounds(form, 3, false));
    }

    @Test
    void testPhoneAndFaxMayRepeat() {
        var form = TestForms.parsed(
                NAME_FIRST,
                PHONE_HOME_WHOLE_NUMBER,
                PHONE_HOME_WHOLE_NUMBER,
                PHONE_FAX_WHOLE_NUMBER,
                PHONE_FAX_WHOLE_NUMBER,
                EMAIL_ADDRESS);

        assertEquals(new SectionRange(0, 6), SectionFinder.findSectionBounds(form, 5, false));
    }

    @Test
    void testUnknownFieldsDoNotBreakSections() {
        var form = TestForms.parsed(NAME_FIRST, UNKNOWN_TYPE, NAME_LAST, EMPTY_TYPE, EMAIL_ADDRESS);

        assertEquals(new SectionRange(0, 5), SectionFinder.findSectionBounds(form, 4, false));
    }

    @Test
    void testServerTypeDrivesSections() {
        var form = TestForms.parsed(NAME_FIRST, NAME_LAST, EMAIL_ADDRESS);
        assertTrue(form.updateFromServer(List.of(NAME_FIRST, NAME_FIRST, EMAIL_ADDRESS), "exp"));

        assertEquals(new SectionRange(0, 1), SectionFinder.findSectionBounds(form, 0, false));
        assertEquals(new SectionRange(1, 3), SectionFinder.findSectionBounds(form, 2, false));
    }

    @Test
    void testTargetOutsideEverySectionIsADefect() {
        var form = TestForms.parsed(NAME_FIRST, UNKNOWN_TYPE, EMAIL_ADDRESS);
        assertThrows(AssertionError.class, () -> SectionFinder.findSectionBounds(form, 1, false));
        assertThrows(AssertionError.class, () -> SectionFinder.findSectionBounds(form, 0, true));
    }

    @Test
    void testSectionsPartitionTheForm() {
        var form = TestForms.parsed(
                NAME_FIRST,
                EMAIL_ADDRESS,
                CREDIT_CARD_NUMBER,
                CREDIT_CARD_EXP_MONTH,
                UNKNOWN_TYPE,
                NAME_FIRST,
                PHONE_HOME_NUMBER,
                PHONE_HOME_NUMBER,
                ADDRESS_BILLING_CITY,
                CREDIT_CARD_VERIFICATION_CODE);

        var ranges = new HashMap<Integer, SectionRange>();
        for (int i = 0; i < form.fieldCount(); i++) {
            var type = form.field(i).effectiveType();
            if (type.isUnknown()) {
                continue;
            }
            boolean payment = type.isPayment();
            var range = SectionFinder.findSectionBounds(form, i, payment);
            assertTrue(range.contains(i), range + " should contain " + i);

            var seen = EnumSet.noneOf(FieldType.class);
            for (int k = range.start(); k < range.end(); k++) {
                var t = form.field(k).effectiveType().equivalentType();
                if (t.isUnknown()) {
                    continue;
                }
                assertEquals(payment, t.isPayment(), "mixed section " + range);
                assertTrue(seen.add(t) || t.group().isPhoneOrFax(), "repeated " + t + " in " + range);
            }
            ranges.put(i, range);
        }

        // Every typed field of a section reports that same section. Untyped fields are not partitioned:
        // the unknown field at 4 lies in both [2,5) and [4,9) because the scan stops at the first boundary.
        ranges.forEach((i, range) -> {
            for (int k = range.start(); k < range.end(); k++) {
                if (ranges.containsKey(k)) {
                    assertEquals(range, ranges.get(k), "fields " + i + " and " + k);
                }
            }
        });
        assertEquals(new SectionRange(4, 9), ranges.get(5));
        assertEquals(new SectionRange(9, 10), ranges.get(9));
    }

    @Test
    void testSectionAutofilledRequiresEveryTypedField() {
        var form = TestForms.parsed(NAME_FIRST, UNKNOWN_TYPE, EMAIL_ADDRESS);
        var range = new SectionRange(0, 3);

        var allFilled = TestForms.form(
                "typed",
                TestForms.field("f0").withAutofilled(true),
                TestForms.field("f1"),
                TestForms.field("f2").withAutofilled(true));
        assertTrue(SectionFinder.isSectionAutofilled(form, allFilled, range));

        var oneMissing = TestForms.form(
                "typed", TestForms.field("f0").withAutofilled(true), TestForms.field("f1"), TestForms.field("f2"));
        assertFalse(SectionFinder.isSectionAutofilled(form, oneMissing, range));
    }

    @Test
    void testSectionAutofilledIgnoresInsertedFields() {
        var form = TestForms.parsed(NAME_FIRST, NAME_LAST, EMAIL_ADDRESS);
        var live = TestForms.form(
                "typed",
                TestForms.field("f0").withAutofilled(true),
                TestForms.field("inserted"),
                TestForms.field("f1").withAutofilled(true),
                TestForms.field("f2").withAutofilled(true));
        assertTrue(SectionFinder.isSectionAutofilled(form, live, new SectionRange(0, 3)));
    }

    @Test
    void testSectionWithoutTypedPairsIsNotAutofilled() {
        var form = TestForms.parsed(UNKNOWN_TYPE, UNKNOWN_TYPE, UNKNOWN_TYPE);
        FormData live = TestForms.form(
                "typed",
                TestForms.field("f0").withAutofilled(true),
                TestForms.field("f1").withAutofilled(true),
                TestForms.field("f2").withAutofilled(true));
        assertFalse(SectionFinder.isSectionAutofilled(form, live, new SectionRange(0, 3)));

        FormData unrelated = TestForms.form("typed", FormField.text("other", "other", ""));
        ParsedForm typed = TestForms.parsed(NAME_FIRST, NAME_LAST, EMAIL_ADDRESS);
        assertFalse(SectionFinder.isSectionAutofilled(typed, unrelated, new SectionRange(0, 3)));
    }
}
