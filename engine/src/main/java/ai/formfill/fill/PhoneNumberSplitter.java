package ai.formfill.fill;

/**
 * Some forms split a 7-digit local number into a 3-digit prefix input and a 4-digit suffix input. The target input's
 * maximum length tells which part it wants.
 */
public final class PhoneNumberSplitter {
    public static final int PREFIX_OFFSET = 0;
    public static final int PREFIX_LENGTH = 3;
    public static final int SUFFIX_OFFSET = 3;
    public static final int SUFFIX_LENGTH = 4;

    private PhoneNumberSplitter() {}

    /** The part of {@code number} that fits an input of {@code maxLength}, or the whole number. */
    public static String partFor(String number, int maxLength) {
        if (number.length() != PREFIX_LENGTH + SUFFIX_LENGTH) {
            return number;
        }
        if (maxLength == PREFIX_LENGTH) {
            return number.substring(PREFIX_OFFSET, PREFIX_OFFSET + PREFIX_LENGTH);
        }
        if (maxLength == SUFFIX_LENGTH) {
            return number.substring(SUFFIX_OFFSET, SUFFIX_OFFSET + SUFFIX_LENGTH);
        }
        return number;
    }
}
