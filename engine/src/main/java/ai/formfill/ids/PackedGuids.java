package ai.formfill.ids;

/** The two halves of an unpacked id. At most one of them is non-empty. */
public record PackedGuids(String cardGuid, String profileGuid) {

    public boolean hasCard() {
        return !cardGuid.isEmpty();
    }

    public boolean hasProfile() {
        return !profileGuid.isEmpty();
    }
}
