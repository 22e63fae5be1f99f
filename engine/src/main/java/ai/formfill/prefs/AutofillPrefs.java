package ai.formfill.prefs;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Autofill preferences. Defaults come from the {@code formfill.properties} classpath resource; a user file or explicit
 * properties may override them.
 *
 * <p>Keys: autofill.enabled (boolean) - autofill.positiveUploadRate (0..1) - autofill.negativeUploadRate (0..1) -
 * autofill.offTheRecord (boolean). The obsolete form.autofill.enabled key is migrated to autofill.enabled the first
 * time it is read.
 */
public final class AutofillPrefs {
    private static final Logger logger = LogManager.getLogger(AutofillPrefs.class);

    static final String DEFAULTS_RESOURCE = "/formfill.properties";

    public static final String KEY_ENABLED = "autofill.enabled";
    public static final String KEY_OBSOLETE_ENABLED = "form.autofill.enabled";
    public static final String KEY_POSITIVE_UPLOAD_RATE = "autofill.positiveUploadRate";
    public static final String KEY_NEGATIVE_UPLOAD_RATE = "autofill.negativeUploadRate";
    public static final String KEY_OFF_THE_RECORD = "autofill.offTheRecord";

    static final double DEFAULT_UPLOAD_RATE = 0.01;

    private final Properties props;

    private AutofillPrefs(Properties props) {
        this.props = props;
    }

    public static AutofillPrefs defaults() {
        return new AutofillPrefs(loadDefaults());
    }

    /** Defaults overlaid with {@code overrides}. */
    public static AutofillPrefs of(Properties overrides) {
        var props = loadDefaults();
        props.putAll(overrides);
        return new AutofillPrefs(props);
    }

    /** Defaults overlaid with the contents of {@code userFile}, if it exists and is readable. */
    public static AutofillPrefs load(Path userFile) {
        var props = loadDefaults();
        if (Files.exists(userFile)) {
            try (var reader = Files.newBufferedReader(userFile)) {
                props.load(reader);
            } catch (IOException e) {
                logger.warn("Failed to load autofill preferences from {}: {}", userFile, e.getMessage());
            }
        }
        return new AutofillPrefs(props);
    }

    private static Properties loadDefaults() {
        var props = new Properties();
        try (InputStream in = AutofillPrefs.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.warn("Missing {} on the classpath; using built-in defaults", DEFAULTS_RESOURCE);
            } else {
                props.load(in);
            }
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", DEFAULTS_RESOURCE, e.getMessage());
        }
        return props;
    }

    public boolean isAutofillEnabled() {
        var obsolete = props.getProperty(KEY_OBSOLETE_ENABLED);
        if (obsolete != null) {
            props.remove(KEY_OBSOLETE_ENABLED);
            props.setProperty(KEY_ENABLED, String.valueOf(Boolean.parseBoolean(obsolete.trim())));
            logger.info("Migrated {} to {}", KEY_OBSOLETE_ENABLED, KEY_ENABLED);
        }
        return getBoolean(KEY_ENABLED, true);
    }

    public void setAutofillEnabled(boolean enabled) {
        props.setProperty(KEY_ENABLED, String.valueOf(enabled));
    }

    /** Share of uploads to send for forms the user had autofilled. */
    public double positiveUploadRate() {
        return getRate(KEY_POSITIVE_UPLOAD_RATE);
    }

    /** Share of uploads to send for forms filled by hand. */
    public double negativeUploadRate() {
        return getRate(KEY_NEGATIVE_UPLOAD_RATE);
    }

    /** Off-the-record sessions never learn from submitted forms. */
    public boolean isOffTheRecord() {
        return getBoolean(KEY_OFF_THE_RECORD, false);
    }

    public void setOffTheRecord(boolean offTheRecord) {
        props.setProperty(KEY_OFF_THE_RECORD, String.valueOf(offTheRecord));
    }

    private boolean getBoolean(String key, boolean fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return Boolean.parseBoolean(raw.trim());
    }

    private double getRate(String key) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_UPLOAD_RATE;
        }
        try {
            return Math.max(0.0, Math.min(1.0, Double.parseDouble(raw.trim())));
        } catch (NumberFormatException e) {
            logger.warn("Invalid value '{}' for {}; using {}", raw, key, DEFAULT_UPLOAD_RATE);
            return DEFAULT_UPLOAD_RATE;
        }
    }
}
