package ai.formfill.section;

/** A half-open span {@code [start, end)} of a parsed form's fields that is filled as one unit. */
public record SectionRange(int start, int end) {

    public SectionRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid section [" + start + ", " + end + ")");
        }
    }

    public boolean contains(int index) {
        return index >= start && index < end;
    }

    public int size() {
        return end - start;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
