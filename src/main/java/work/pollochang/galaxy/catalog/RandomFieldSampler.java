package work.pollochang.galaxy.catalog;

import java.util.Random;

/**
 * 隨機挑選 10 x 10 度的天區，避開巡天範圍以外的區域：
 * <ol>
 *     <li>Dec 在 [-90, -30] (不論 RA)</li>
 *     <li>Dec 在 [50, 90] 且 RA 在 [0, 20]</li>
 *     <li>Dec 在 [-30, -10] 且 RA 在 [140, 160]</li>
 *     <li>Dec 在 [70, 90] 且 RA 在 [200, 220]</li>
 * </ol>
 */
public class RandomFieldSampler {

    static final int FIELD_SIZE_DEG = 10;

    private final Random random;

    public RandomFieldSampler() {
        this(new Random());
    }

    public RandomFieldSampler(Random random) {
        this.random = random;
    }

    public SkyWindow next() {
        // 下界已排除第 1 區，迴圈內只需檢查 2~4
        while (true) {
            int ra = random.nextInt(350);
            int dec = random.nextInt(110) - 30;

            if (!isExcluded(ra, dec)) {
                return new SkyWindow(ra, ra + FIELD_SIZE_DEG, dec, dec + FIELD_SIZE_DEG);
            }
        }
    }

    static boolean isExcluded(int ra, int dec) {
        return (50 < dec && dec < 90 && 0 < ra && ra < 20)
                || (-30 < dec && dec < -10 && 140 < ra && ra < 160)
                || (70 < dec && dec < 90 && 200 < ra && ra < 220);
    }
}
