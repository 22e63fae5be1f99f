package ai.formfill.ids;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class GuidPackerTest {

    @Test
    void testCardAndProfileShareOneCounter() {
        var packer = new GuidPacker();
        int card = packer.pack("cardGuidX", "");
        int profile = packer.pack("", "profileGuidY");

        assertEquals(1 << 16, card);
        assertEquals(2, profile);
        assertEquals(new PackedGuids("cardGuidX", ""), packer.unpack(card));
        assertEquals(new PackedGuids("", "profileGuidY"), packer.unpack(profile));
    }

    @Test
    void testIdsAreStable() {
        var packer = new GuidPacker();
        int first = packer.pack("", "p1");
        packer.pack("", "p2");
        assertEquals(first, packer.pack("", "p1"));
    }

    @Test
    void testEmptyPairPacksToZero() {
        var packer = new GuidPacker();
        assertEquals(0, packer.pack("", ""));
        var unpacked = packer.unpack(0);
        assertFalse(unpacked.hasCard());
        assertFalse(unpacked.hasProfile());
    }

    @Test
    void testPackingBothHalvesIsADefect() {
        var packer = new GuidPacker();
        assertThrows(AssertionError.class, () -> packer.pack("card", "profile"));
    }

    @Test
    void testUnpackingUnknownIdIsADefect() {
        var packer = new GuidPacker();
        packer.pack("", "p1");
        assertThrows(AssertionError.class, () -> packer.unpack(7));
        assertThrows(AssertionError.class, () -> packer.unpack(3 << 16));
    }

    @Test
    void testInstancesAreIndependent() {
        var a = new GuidPacker();
        var b = new GuidPacker();
        a.pack("", "p1");
        a.pack("", "p2");
        assertEquals(1, b.pack("", "p2"));
    }

    @Test
    void testSharedTableGivesSameIds() {
        var table = new GuidIdTable();
        var a = new GuidPacker(table);
        var b = new GuidPacker(table);
        int packed = a.pack("c1", "");
        assertEquals(new PackedGuids("c1", ""), b.unpack(packed));
        assertEquals(1, table.size());
    }

    @Test
    void testIdSpaceExhaustion() {
        var table = new GuidIdTable();
        for (int i = 0; i < GuidIdTable.MAX_ID; i++) {
            table.idFor("g" + i);
        }
        assertEquals(GuidIdTable.MAX_ID, table.idFor("g" + (GuidIdTable.MAX_ID - 1)));
        assertThrows(AssertionError.class, () -> table.idFor("one-too-many"));
        // Existing ids keep resolving
        assertEquals(1, table.idFor("g0"));
    }
}
