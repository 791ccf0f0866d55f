package work.pollochang.galaxy.imaging;

import nom.tam.fits.Header;
import work.pollochang.galaxy.core.PixelCoordinate;
import work.pollochang.galaxy.core.SkyCoordinate;
import work.pollochang.galaxy.core.WorldToPixel;
import work.pollochang.galaxy.exception.TransportException;

import java.util.Locale;

/**
 * FITS 切面投影 (TAN / gnomonic) 的座標轉換，SDSS frame 使用的就是這種投影。
 * <p>
 * 像素座標為 0 起算，即 FITS 的 1 起算像素減 1。
 */
public class TanWcs implements WorldToPixel {

    private final double crpix1;
    private final double crpix2;
    private final double crval1;
    private final double crval2;
    // CD 矩陣與其反矩陣，單位：度/像素
    private final double cd11, cd12, cd21, cd22;
    private final double inv11, inv12, inv21, inv22;

    public TanWcs(double crpix1, double crpix2, double crval1, double crval2,
                  double cd11, double cd12, double cd21, double cd22) {
        this.crpix1 = crpix1;
        this.crpix2 = crpix2;
        this.crval1 = crval1;
        this.crval2 = crval2;
        this.cd11 = cd11;
        this.cd12 = cd12;
        this.cd21 = cd21;
        this.cd22 = cd22;

        double det = cd11 * cd22 - cd12 * cd21;
        if (det == 0 || Double.isNaN(det)) {
            throw new IllegalArgumentException("CD 矩陣不可逆");
        }
        this.inv11 = cd22 / det;
        this.inv12 = -cd12 / det;
        this.inv21 = -cd21 / det;
        this.inv22 = cd11 / det;
    }

    /**
     * 由 frame header 建立轉換，遇到非標準寫法時修正並記錄在 fixups。
     *
     * @throws TransportException header 缺少必要欄位或不是 TAN 投影
     */
    public static TanWcs fromHeader(Header header, WcsFixups fixups) {
        String ctype1 = header.getStringValue("CTYPE1");
        String ctype2 = header.getStringValue("CTYPE2");
        if (ctype1 == null || !ctype1.toUpperCase(Locale.ROOT).endsWith("-TAN")
                || ctype2 == null || !ctype2.toUpperCase(Locale.ROOT).endsWith("-TAN")) {
            throw new TransportException("不支援的投影: CTYPE1=" + ctype1 + ", CTYPE2=" + ctype2);
        }

        if (header.containsKey("RADECSYS") && !header.containsKey("RADESYS")) {
            fixups.record("RADECSYS 已不建議使用，視為 RADESYS='" + header.getStringValue("RADECSYS") + "'");
        }
        if (!header.containsKey("EQUINOX")) {
            fixups.record("缺少 EQUINOX，使用 2000.0");
        }

        double crpix1 = required(header, "CRPIX1");
        double crpix2 = required(header, "CRPIX2");
        double crval1 = required(header, "CRVAL1");
        double crval2 = required(header, "CRVAL2");

        double cd11, cd12, cd21, cd22;
        if (header.containsKey("CD1_1")) {
            cd11 = header.getDoubleValue("CD1_1", 0.0);
            cd12 = header.getDoubleValue("CD1_2", 0.0);
            cd21 = header.getDoubleValue("CD2_1", 0.0);
            cd22 = header.getDoubleValue("CD2_2", 0.0);
        } else if (header.containsKey("CDELT1") && header.containsKey("CDELT2")) {
            fixups.record("沒有 CD 矩陣，改用 CDELT/PC");
            double cdelt1 = header.getDoubleValue("CDELT1", 1.0);
            double cdelt2 = header.getDoubleValue("CDELT2", 1.0);
            cd11 = cdelt1 * header.getDoubleValue("PC1_1", 1.0);
            cd12 = cdelt1 * header.getDoubleValue("PC1_2", 0.0);
            cd21 = cdelt2 * header.getDoubleValue("PC2_1", 0.0);
            cd22 = cdelt2 * header.getDoubleValue("PC2_2", 1.0);
        } else {
            throw new TransportException("header 缺少 CD 矩陣與 CDELT");
        }

        try {
            return new TanWcs(crpix1, crpix2, crval1, crval2, cd11, cd12, cd21, cd22);
        } catch (IllegalArgumentException e) {
            throw new TransportException("無效的 WCS: " + e.getMessage(), e);
        }
    }

    private static double required(Header header, String key) {
        if (!header.containsKey(key)) {
            throw new TransportException("header 缺少 " + key);
        }
        return header.getDoubleValue(key, Double.NaN);
    }

    @Override
    public PixelCoordinate toPixel(double ra, double dec) {
        double a = Math.toRadians(ra);
        double d = Math.toRadians(dec);
        double a0 = Math.toRadians(crval1);
        double d0 = Math.toRadians(crval2);

        double cosC = Math.sin(d) * Math.sin(d0) + Math.cos(d) * Math.cos(d0) * Math.cos(a - a0);
        double xi = Math.toDegrees(Math.cos(d) * Math.sin(a - a0) / cosC);
        double eta = Math.toDegrees((Math.sin(d) * Math.cos(d0) - Math.cos(d) * Math.sin(d0) * Math.cos(a - a0)) / cosC);

        double dx = inv11 * xi + inv12 * eta;
        double dy = inv21 * xi + inv22 * eta;
        return new PixelCoordinate(crpix1 - 1 + dx, crpix2 - 1 + dy);
    }

    /**
     * 反向轉換，像素 (0 起算) 轉天球座標。
     */
    public SkyCoordinate toWorld(double x, double y) {
        double dx = x + 1 - crpix1;
        double dy = y + 1 - crpix2;
        double xi = Math.toRadians(cd11 * dx + cd12 * dy);
        double eta = Math.toRadians(cd21 * dx + cd22 * dy);

        double a0 = Math.toRadians(crval1);
        double d0 = Math.toRadians(crval2);
        double denominator = Math.cos(d0) - eta * Math.sin(d0);
        double a = a0 + Math.atan2(xi, denominator);
        double d = Math.atan2(Math.sin(d0) + eta * Math.cos(d0), Math.hypot(xi, denominator));

        double raDeg = Math.toDegrees(a) % 360.0;
        if (raDeg < 0) {
            raDeg += 360.0;
        }
        return new SkyCoordinate(raDeg, Math.toDegrees(d));
    }
}
