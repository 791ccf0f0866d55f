package work.pollochang.galaxy.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BandImageTest {

    private static final CutoutSpec SPEC = new CutoutSpec(0, 3, 0, 2);

    @Test
    void testSourceArrayMutation_ShouldNotAffectImage() {
        float[][] source = {{1f, 2f, 3f}, {4f, 5f, 6f}};
        BandImage image = new BandImage(Band.R, SPEC, source);

        source[0][0] = -1f;
        source[1] = new float[]{0f, 0f, 0f};

        assertArrayEquals(new float[][]{{1f, 2f, 3f}, {4f, 5f, 6f}}, image.pixels());
    }

    @Test
    void testReturnedArrayMutation_ShouldNotAffectImage() {
        BandImage image = new BandImage(Band.G, SPEC, new float[][]{{1f, 2f, 3f}, {4f, 5f, 6f}});

        image.pixels()[1][2] = 99f;

        assertEquals(6f, image.pixels()[1][2]);
        assertEquals(3, image.width());
        assertEquals(2, image.height());
    }

    @Test
    void testEmptyCrop_ShouldHaveZeroSize() {
        BandImage image = new BandImage(Band.U, SPEC, new float[0][0]);

        assertEquals(0, image.width());
        assertEquals(0, image.height());
    }
}
