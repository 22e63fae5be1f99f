package ai.formfill.ids;

/**
 * Packs a card GUID and a profile GUID into one int so that suggestion rows can be identified across a process
 * boundary without exposing the GUIDs themselves. The card id occupies the high 16 bits and the profile id the low 16
 * bits.
 */
public final class GuidPacker {
    /** Id carried by rows that do not correspond to any record, such as warnings. */
    public static final int INVALID_ID = -1;

    private static final int HALF_BITS = 16;
    private static final int HALF_MASK = 0xFFFF;

    private final GuidIdTable table;

    public GuidPacker() {
        this(new GuidIdTable());
    }

    public GuidPacker(GuidIdTable table) {
        this.table = table;
    }

    public int pack(String cardGuid, String profileGuid) {
        if (!cardGuid.isEmpty() && !profileGuid.isEmpty()) {
            throw new AssertionError("Cannot pack both a card and a profile: " + cardGuid + ", " + profileGuid);
        }
        int cardId = table.idFor(cardGuid);
        int profileId = table.idFor(profileGuid);
        return cardId << HALF_BITS | profileId;
    }

    /**
     * Reverses {@link #pack}. Every non-zero half must have been produced by this packer.
     *
     * @throws AssertionError if a half is unknown to the id table
     */
    public PackedGuids unpack(int packed) {
        int cardId = packed >>> HALF_BITS & HALF_MASK;
        int profileId = packed & HALF_MASK;
        return new PackedGuids(resolve(cardId, packed), resolve(profileId, packed));
    }

    private String resolve(int id, int packed) {
        return table.guidFor(id).orElseThrow(() -> new AssertionError("Unknown id " + id + " in packed value " + packed));
    }
}
