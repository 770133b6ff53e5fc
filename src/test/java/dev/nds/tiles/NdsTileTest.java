package dev.nds.tiles;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Before;
import org.junit.Test;

public class NdsTileTest {

    private static final int LEVEL0_PACKED_ID      = 65536;
    private static final int LEVEL0_PACKED_ID_WEST = 65537;
    private static final int LEVEL1_PACKED_ID      = 131072;
    private static final int LEVEL2_PACKED_ID      = 262144;

    private NdsCoordinate   eastCoord;
    private NdsCoordinate   westCoord;
    private Wgs84Coordinate wgsEastCoord;
    private Wgs84Coordinate wgsWestCoord;

    @Before
    public void setup() {
        eastCoord = NdsCoordinate.fromDegrees(90.0, 45.0);
        westCoord = NdsCoordinate.fromDegrees(-90.0, 45.0);
        wgsEastCoord = new Wgs84Coordinate(90.0, 45.0);
        wgsWestCoord = new Wgs84Coordinate(-90.0, 45.0);
    }

    @Test
    public void testFromPackedId() {
        assertTile(0, 0, NdsTile.fromPackedId(LEVEL0_PACKED_ID));
        assertTile(0, 1, NdsTile.fromPackedId(LEVEL0_PACKED_ID_WEST));
        assertTile(1, 0, NdsTile.fromPackedId(LEVEL1_PACKED_ID));
        assertTile(2, 0, NdsTile.fromPackedId(LEVEL2_PACKED_ID));
        assertTile(2, 10, NdsTile.fromPackedId(262154));
        assertTile(13, 2765788, NdsTile.fromPackedId(539636700));
    }

    @Test
    public void testOfLevelAndNumber() {
        assertTile(0, 0, NdsTile.of(0, 0));
        assertTile(0, 1, NdsTile.of(0, 1));
        assertTile(1, 7, NdsTile.of(1, 7));
        assertTile(Const.MAX_LEVEL, Integer.MAX_VALUE, NdsTile.of(Const.MAX_LEVEL, Integer.MAX_VALUE));
    }

    @Test
    public void testOfLevelAndCoordinate() {
        assertTile(0, 0, NdsTile.of(0, eastCoord));
        assertTile(0, 1, NdsTile.of(0, westCoord));
        assertTile(0, 0, NdsTile.of(0, wgsEastCoord));
        assertTile(0, 1, NdsTile.of(0, wgsWestCoord));
        assertEquals(NdsTile.of(2, eastCoord), NdsTile.of(2, wgsEastCoord));

        NdsTile barcelona = NdsTile.of(13, new Wgs84Coordinate(2.1734, 41.3851));
        assertTile(13, 2766478, barcelona);
        assertEquals(539637390, barcelona.getPackedId());
    }

    @Test
    public void testInvalidInputs() {
        assertThrows(OutOfRangeException.class, () -> NdsTile.of(-1, 0));
        assertThrows(OutOfRangeException.class, () -> NdsTile.of(Const.MAX_LEVEL + 1, 0));
        assertThrows(OutOfRangeException.class, () -> NdsTile.of(0, -1));
        assertThrows(OutOfRangeException.class, () -> NdsTile.of(0, 2));
        assertThrows(OutOfRangeException.class, () -> NdsTile.of(1, 8));
        assertThrows(OutOfRangeException.class, () -> NdsTile.of(16, eastCoord));
        assertThrows(MalformedTileIdException.class, () -> NdsTile.fromPackedId(1));
        assertThrows(MalformedTileIdException.class, () -> NdsTile.fromPackedId(0));
        // level 0 marker with bits that are no level 0 tile number
        assertThrows(OutOfRangeException.class, () -> NdsTile.fromPackedId(LEVEL0_PACKED_ID | 4));
    }

    @Test
    public void testPackedId() {
        assertEquals(LEVEL0_PACKED_ID, NdsTile.of(0, 0).getPackedId());
        assertEquals(LEVEL0_PACKED_ID_WEST, NdsTile.of(0, 1).getPackedId());
        assertEquals(LEVEL1_PACKED_ID, NdsTile.of(1, 0).getPackedId());
        assertEquals(LEVEL2_PACKED_ID, NdsTile.of(2, 0).getPackedId());
        assertEquals(262154, NdsTile.fromPackedId(262154).getPackedId());
    }

    @Test
    public void testExtractLevel() {
        assertEquals(0, NdsTile.extractLevel(LEVEL0_PACKED_ID));
        assertEquals(1, NdsTile.extractLevel(LEVEL1_PACKED_ID));
        assertEquals(2, NdsTile.extractLevel(LEVEL2_PACKED_ID));
        assertEquals(-1, NdsTile.extractLevel(1));
        assertEquals(Const.MAX_LEVEL, NdsTile.extractLevel(-1));
        assertEquals(Const.MAX_LEVEL, NdsTile.extractLevel(Integer.MIN_VALUE));
        // the highest marker wins
        assertEquals(3, NdsTile.extractLevel((1 << 19) | (1 << 17)));
    }

    @Test
    public void testContains() {
        NdsTile eastTile = NdsTile.of(0, 0);
        assertTrue(eastTile.contains(eastCoord));
        assertFalse(eastTile.contains(westCoord));

        NdsTile westTile = NdsTile.of(0, 1);
        assertTrue(westTile.contains(westCoord));
        assertFalse(westTile.contains(eastCoord));

        NdsTile highLevelTile = NdsTile.of(5, eastCoord);
        assertTrue(highLevelTile.contains(eastCoord));
        assertFalse(highLevelTile.contains(NdsCoordinate.fromDegrees(90.1, 45.1)));
    }

    @Test
    public void testCenter() {
        NdsCoordinate center = NdsTile.of(0, 0).getCenter();
        assertEquals(Const.MAX_LONGITUDE / 2, center.getLongitude());
        assertEquals(0, center.getLatitude());

        center = NdsTile.of(0, 1).getCenter();
        assertEquals(Const.MIN_LONGITUDE / 2, center.getLongitude());
        assertEquals(0, center.getLatitude());

        assertEquals(NdsCoordinate.fromUnits(536870911, 536870911), NdsTile.of(1, 0).getCenter());
        assertEquals(NdsCoordinate.fromUnits(-1610612736, -536870912), NdsTile.of(1, 6).getCenter());
        assertEquals(NdsCoordinate.fromUnits(268435455, -268435456), NdsTile.fromPackedId(262154).getCenter());
        assertEquals(NdsCoordinate.fromUnits(-201326592, -872415232), NdsTile.fromPackedId(1049046).getCenter());
        assertEquals(NdsCoordinate.fromUnits(24772607, 493486079), NdsTile.fromPackedId(539636700).getCenter());

        Wgs84Coordinate wgs = NdsTile.fromPackedId(539636700).getCenter().toWgs84();
        assertEquals(2.076415932772875, wgs.getLongitude(), 1e-9);
        assertEquals(41.36352534532875, wgs.getLatitude(), 1e-9);
    }

    @Test
    public void testCenterIsCached() {
        NdsTile tile = NdsTile.of(7, 1234);
        assertSame(tile.getCenter(), tile.getCenter());
    }

    @Test
    public void testBBox() {
        assertEquals(NdsBBox.EAST_HEMISPHERE, NdsTile.of(0, 0).getBBox());
        assertEquals(new NdsBBox(Const.MAX_LATITUDE, Const.MAX_LONGITUDE, Const.MIN_LATITUDE, 0), NdsTile.of(0, 0).getBBox());
        assertEquals(new NdsBBox(Const.MAX_LATITUDE, 0, Const.MIN_LATITUDE, Const.MIN_LONGITUDE), NdsTile.of(0, 1).getBBox());

        assertEquals(new NdsBBox(1073741823, 1073741823, 0, 0), NdsTile.of(1, 0).getBBox());
        assertEquals(new NdsBBox(0, -1073741824, -1073741824, Const.MIN_LONGITUDE), NdsTile.of(1, 6).getBBox());
        assertEquals(new NdsBBox(0, 536870911, -536870912, 0), NdsTile.fromPackedId(262154).getBBox());
        assertEquals(new NdsBBox(-805306368, -134217728, -939524096, -268435456), NdsTile.fromPackedId(1049046).getBBox());
        assertEquals(new NdsBBox(493617151, 24903679, 493355008, 24641536), NdsTile.fromPackedId(539636700).getBBox());
    }

    @Test
    public void testGridCoordinates() {
        assertEquals(new GridCoordinates(0, 0), NdsTile.of(0, 0).getGridCoordinates());
        assertEquals(new GridCoordinates(-1, 0), NdsTile.of(0, 1).getGridCoordinates());
        assertEquals(new GridCoordinates(0, 0), NdsTile.of(1, 0).getGridCoordinates());
        assertEquals(new GridCoordinates(0, 0), NdsTile.of(2, 0).getGridCoordinates());

        // level 1: 4 5 0 1 / 6 7 2 3
        int[] level1 = { 4, 5, 0, 1, 6, 7, 2, 3 };
        for (int i = 0; i < level1.length; i++) {
            GridCoordinates grid = NdsTile.of(1, level1[i]).getGridCoordinates();
            assertEquals(i % 4 - 2, grid.getCol());
            assertEquals(-(i / 4), grid.getRow());
        }

        int[] level2 = { 18, 19, 22, 23, 2, 3, 6, 7, //
                16, 17, 20, 21, 0, 1, 4, 5, //
                26, 27, 30, 31, 10, 11, 14, 15, //
                24, 25, 28, 29, 8, 9, 12, 13 };
        for (int i = 0; i < level2.length; i++) {
            GridCoordinates grid = NdsTile.of(2, level2[i]).getGridCoordinates();
            assertEquals(i % 8 - 4, grid.getCol());
            assertEquals(1 - i / 8, grid.getRow());
        }

        assertEquals(new GridCoordinates(-2, 0), NdsTile.of(1, 4).getGridCoordinates());
        assertEquals(new GridCoordinates(-2, -1), NdsTile.of(1, 6).getGridCoordinates());
        assertEquals(new GridCoordinates(94, 1882), NdsTile.fromPackedId(539636700).getGridCoordinates());
        assertEquals(new GridCoordinates(-2, -7), NdsTile.fromPackedId(1049046).getGridCoordinates());
    }

    @Test
    public void testSouthWestAsMorton() {
        assertEquals(0L, NdsTile.of(0, 0).southWestAsMorton());
        assertEquals(1L << 62, NdsTile.of(0, 1).southWestAsMorton());
        assertEquals(5L << 60, NdsTile.of(1, 5).southWestAsMorton());
        assertEquals(NdsTile.of(1, 0).southWestAsMorton() >> 2, NdsTile.of(2, 0).southWestAsMorton() >> 4);
        assertEquals(NdsTile.of(1, 5).southWestAsMorton(), NdsTile.of(2, 20).southWestAsMorton());
    }

    @Test
    public void testLevel15() {
        int sampleTileNumber = 1000000;
        NdsTile tile = NdsTile.of(Const.MAX_LEVEL, sampleTileNumber);
        int packedId = sampleTileNumber + (1 << 31);
        assertTrue(packedId < 0);
        assertEquals(packedId, tile.getPackedId());
        assertTile(Const.MAX_LEVEL, sampleTileNumber, NdsTile.fromPackedId(packedId));

        tile = NdsTile.of(Const.MAX_LEVEL, eastCoord);
        assertTrue(tile.contains(eastCoord));
        assertEquals((int) 2281701375L, tile.getPackedId());

        GridCoordinates grid = tile.getGridCoordinates();
        assertTrue(-(1 << Const.MAX_LEVEL) <= grid.getCol() && grid.getCol() < (1 << Const.MAX_LEVEL));
        assertTrue(-(1 << (Const.MAX_LEVEL - 1)) <= grid.getRow() && grid.getRow() < (1 << (Const.MAX_LEVEL - 1)));
    }

    @Test
    public void testToGeoJson() {
        String json = NdsTile.of(0, 0).toGeoJson();
        assertTrue(json.contains("\"type\": \"Feature\""));
        assertTrue(json.contains("\"type\": \"Polygon\""));
        assertTrue(json.contains("\"coordinates\""));
        assertEquals(NdsBBox.EAST_HEMISPHERE.toWgs84().toGeoJson(), json);
    }

    @Test
    public void testEquals() {
        assertEquals(NdsTile.of(3, 17), NdsTile.fromPackedId(NdsTile.of(3, 17).getPackedId()));
        assertEquals(NdsTile.of(3, 17).hashCode(), NdsTile.of(3, 17).hashCode());
        assertFalse(NdsTile.of(3, 17).equals(NdsTile.of(4, 17)));
    }

    private static void assertTile(int level, int tileNumber, NdsTile tile) {
        assertEquals(level, tile.getLevel());
        assertEquals(tileNumber, tile.getTileNumber());
    }
}
