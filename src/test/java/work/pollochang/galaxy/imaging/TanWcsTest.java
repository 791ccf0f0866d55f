package work.pollochang.galaxy.imaging;

import nom.tam.fits.Header;
import org.junit.jupiter.api.Test;
import work.pollochang.galaxy.core.PixelCoordinate;
import work.pollochang.galaxy.core.SkyCoordinate;
import work.pollochang.galaxy.exception.TransportException;

import static org.junit.jupiter.api.Assertions.*;

class TanWcsTest {

    // SDSS frame 的典型像素大小約 0.396 角秒
    private static final double SCALE = 0.396 / 3600;

    private static TanWcs sdssLike() {
        return new TanWcs(1024.5, 744.5, 180.0, 30.0, -SCALE, 0, 0, SCALE);
    }

    @Test
    void testReferencePoint_ShouldMapToReferencePixel() {
        PixelCoordinate p = sdssLike().toPixel(180.0, 30.0);

        assertEquals(1023.5, p.x(), 1e-9);
        assertEquals(743.5, p.y(), 1e-9);
    }

    @Test
    void testRoundTrip() {
        TanWcs wcs = sdssLike();

        for (double[] xy : new double[][]{{0, 0}, {2047, 1488}, {100.25, 1300.75}, {1023.5, 743.5}}) {
            SkyCoordinate sky = wcs.toWorld(xy[0], xy[1]);
            PixelCoordinate back = wcs.toPixel(sky.ra(), sky.dec());
            assertEquals(xy[0], back.x(), 1e-6);
            assertEquals(xy[1], back.y(), 1e-6);
        }
    }

    @Test
    void testOrientation_ShouldFollowCdSigns() {
        TanWcs wcs = sdssLike();
        PixelCoordinate center = wcs.toPixel(180.0, 30.0);

        // 赤緯增加 -> y 增加；CD1_1 為負，赤經增加 -> x 減少
        assertTrue(wcs.toPixel(180.0, 30.01).y() > center.y());
        assertTrue(wcs.toPixel(180.01, 30.0).x() < center.x());
    }

    @Test
    void testSingularMatrix_ShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TanWcs(1, 1, 0, 0, 1, 1, 1, 1));
    }

    private static Header tanHeader() throws Exception {
        return header("RA---TAN");
    }

    private static Header header(String ctype1) throws Exception {
        Header header = new Header();
        header.addValue("CTYPE1", ctype1, "");
        header.addValue("CTYPE2", "DEC--TAN", "");
        header.addValue("CRPIX1", 1024.5, "");
        header.addValue("CRPIX2", 744.5, "");
        header.addValue("CRVAL1", 180.0, "");
        header.addValue("CRVAL2", 30.0, "");
        return header;
    }

    @Test
    void testFromHeader_CdMatrix() throws Exception {
        Header header = tanHeader();
        header.addValue("CD1_1", -SCALE, "");
        header.addValue("CD1_2", 0.0, "");
        header.addValue("CD2_1", 0.0, "");
        header.addValue("CD2_2", SCALE, "");
        header.addValue("EQUINOX", 2000.0, "");
        header.addValue("RADESYS", "ICRS", "");
        WcsFixups fixups = new WcsFixups();

        TanWcs wcs = TanWcs.fromHeader(header, fixups);

        PixelCoordinate p = wcs.toPixel(180.0, 30.0);
        assertEquals(1023.5, p.x(), 1e-9);
        assertEquals(743.5, p.y(), 1e-9);
        assertTrue(fixups.isEmpty(), fixups.messages().toString());
    }

    @Test
    void testFromHeader_LegacyKeywords_ShouldBeRecordedAsFixups() throws Exception {
        Header header = tanHeader();
        header.addValue("CDELT1", -SCALE, "");
        header.addValue("CDELT2", SCALE, "");
        header.addValue("RADECSYS", "FK5", "");
        WcsFixups fixups = new WcsFixups();

        TanWcs wcs = TanWcs.fromHeader(header, fixups);

        assertEquals(1023.5, wcs.toPixel(180.0, 30.0).x(), 1e-9);
        assertEquals(3, fixups.messages().size(), fixups.messages().toString());
    }

    @Test
    void testFromHeader_NotTan_ShouldThrow() throws Exception {
        Header header = header("RA---SIN");
        header.addValue("CD1_1", -SCALE, "");
        header.addValue("CD2_2", SCALE, "");

        assertThrows(TransportException.class, () -> TanWcs.fromHeader(header, new WcsFixups()));
    }

    @Test
    void testFromHeader_MissingScale_ShouldThrow() throws Exception {
        assertThrows(TransportException.class, () -> TanWcs.fromHeader(tanHeader(), new WcsFixups()));
    }
}
