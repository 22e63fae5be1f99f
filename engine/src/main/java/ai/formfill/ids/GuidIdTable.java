package ai.formfill.ids;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Bidirectional mapping between record GUIDs and small integers, shared by cards and profiles. Ids start at 1, grow
 * monotonically and are never reused or remapped for the lifetime of the table. Not thread-safe.
 */
public final class GuidIdTable {
    private static final Logger logger = LogManager.getLogger(GuidIdTable.class);

    /** Reserved for "no identifier". */
    public static final int NO_ID = 0;

    /** Largest id that fits in one half of a packed value. */
    public static final int MAX_ID = 0xFFFF;

    private final Map<String, Integer> guidToId = new HashMap<>();
    private final Map<Integer, String> idToGuid = new HashMap<>();
    private int nextId = 1;

    /** Returns the id for {@code guid}, assigning the next one on first sight. Empty GUIDs map to {@link #NO_ID}. */
    public int idFor(String guid) {
        if (guid.isEmpty()) {
            return NO_ID;
        }
        var existing = guidToId.get(guid);
        if (existing != null) {
            return existing;
        }
        if (nextId > MAX_ID) {
            throw new AssertionError("GUID id space exhausted after " + MAX_ID + " identifiers");
        }
        int id = nextId++;
        guidToId.put(guid, id);
        idToGuid.put(id, guid);
        logger.trace("Assigned id {} to {}", id, guid);
        return id;
    }

    /** Looks up a previously assigned id. {@link #NO_ID} resolves to the empty string. */
    public Optional<String> guidFor(int id) {
        if (id == NO_ID) {
            return Optional.of("");
        }
        return Optional.ofNullable(idToGuid.get(id));
    }

    public int size() {
        return guidToId.size();
    }
}
