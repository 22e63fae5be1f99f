package ai.formfill.prefs;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class AutofillPrefsTest {

    @TempDir
    Path tempDir;

    private static AutofillPrefs with(String key, String value) {
        var props = new Properties();
        props.setProperty(key, value);
        return AutofillPrefs.of(props);
    }

    @Test
    void testDefaults() {
        var prefs = AutofillPrefs.defaults();
        assertTrue(prefs.isAutofillEnabled());
        assertFalse(prefs.isOffTheRecord());
        assertEquals(AutofillPrefs.DEFAULT_UPLOAD_RATE, prefs.positiveUploadRate());
        assertEquals(AutofillPrefs.DEFAULT_UPLOAD_RATE, prefs.negativeUploadRate());
    }

    @Test
    void testObsoleteEnabledKeyIsMigrated() {
        var props = new Properties();
        props.setProperty(AutofillPrefs.KEY_OBSOLETE_ENABLED, "false");
        props.setProperty(AutofillPrefs.KEY_ENABLED, "true");
        var prefs = AutofillPrefs.of(props);

        assertFalse(prefs.isAutofillEnabled());
        prefs.setAutofillEnabled(true);
        // the obsolete key is gone and does not override again
        assertTrue(prefs.isAutofillEnabled());
    }

    @Test
    void testUploadRatesAreClamped() {
        assertEquals(1.0, with(AutofillPrefs.KEY_POSITIVE_UPLOAD_RATE, "1.5").positiveUploadRate());
        assertEquals(0.0, with(AutofillPrefs.KEY_NEGATIVE_UPLOAD_RATE, "-2").negativeUploadRate());
        assertEquals(0.25, with(AutofillPrefs.KEY_NEGATIVE_UPLOAD_RATE, " 0.25 ").negativeUploadRate());
        assertEquals(
                AutofillPrefs.DEFAULT_UPLOAD_RATE,
                with(AutofillPrefs.KEY_POSITIVE_UPLOAD_RATE, "often").positiveUploadRate());
    }

    @Test
    void testLoadMissingFileUsesDefaults() {
        var prefs = AutofillPrefs.load(tempDir.resolve("missing.properties"));
        assertTrue(prefs.isAutofillEnabled());
        assertEquals(AutofillPrefs.DEFAULT_UPLOAD_RATE, prefs.positiveUploadRate());
    }

    @Test
    void testLoadUserFile() throws Exception {
        var file = tempDir.resolve("formfill.properties");
        Files.writeString(
                file,
                """
                autofill.enabled=false
                autofill.offTheRecord=true
                autofill.positiveUploadRate=0.75
                """);

        var prefs = AutofillPrefs.load(file);
        assertFalse(prefs.isAutofillEnabled());
        assertTrue(prefs.isOffTheRecord());
        assertEquals(0.75, prefs.positiveUploadRate());
        assertEquals(AutofillPrefs.DEFAULT_UPLOAD_RATE, prefs.negativeUploadRate());
    }

    @Test
    void testOffTheRecordToggle() {
        var prefs = AutofillPrefs.defaults();
        prefs.setOffTheRecord(true);
        assertTrue(prefs.isOffTheRecord());
    }
}
