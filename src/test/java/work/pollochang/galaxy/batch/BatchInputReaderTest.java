package work.pollochang.galaxy.batch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.galaxy.core.SkyCoordinate;
import work.pollochang.galaxy.exception.InvalidInputException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchInputReaderTest {

    private static Path csv(Path dir, String content) throws IOException {
        Path file = dir.resolve("input.csv");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testRead_ShouldKeepRowOrder(@TempDir Path tempDir) throws IOException {
        Path file = csv(tempDir, "name,ra,dec\nm1,83.63,22.01\nm2,322.49,-0.82\n");

        List<SkyCoordinate> coordinates = new BatchInputReader().read(file);

        assertEquals(List.of(new SkyCoordinate(83.63, 22.01), new SkyCoordinate(322.49, -0.82)), coordinates);
    }

    @Test
    void testCustomColumns_CaseInsensitive(@TempDir Path tempDir) throws IOException {
        Path file = csv(tempDir, "RA_DEG,Dec_Deg\n10, 20\n");

        List<SkyCoordinate> coordinates = new BatchInputReader("ra_deg", "dec_deg").read(file);

        assertEquals(List.of(new SkyCoordinate(10, 20)), coordinates);
    }

    @Test
    void testMissingColumn_ShouldThrow(@TempDir Path tempDir) throws IOException {
        Path file = csv(tempDir, "ra,declination\n10,20\n");

        InvalidInputException e = assertThrows(InvalidInputException.class, () -> new BatchInputReader().read(file));
        assertTrue(e.getMessage().contains("dec"));
    }

    @Test
    void testNonNumeric_ShouldNameValue(@TempDir Path tempDir) throws IOException {
        Path file = csv(tempDir, "ra,dec\n10,20\nabc,5\n");

        InvalidInputException e = assertThrows(InvalidInputException.class, () -> new BatchInputReader().read(file));
        assertTrue(e.getMessage().contains("abc"));
        assertTrue(e.getMessage().contains("2"));
    }

    @Test
    void testOutOfRange_ShouldThrow(@TempDir Path tempDir) throws IOException {
        Path file = csv(tempDir, "ra,dec\n10,95\n");

        assertThrows(InvalidInputException.class, () -> new BatchInputReader().read(file));
    }

    @Test
    void testNaN_ShouldThrow(@TempDir Path tempDir) throws IOException {
        Path ra = csv(tempDir, "ra,dec\nNaN,10\n");
        assertThrows(InvalidInputException.class, () -> new BatchInputReader().read(ra));

        Path dec = csv(tempDir, "ra,dec\n10,NaN\n");
        assertThrows(InvalidInputException.class, () -> new BatchInputReader().read(dec));
    }

    @Test
    void testMissingFile_ShouldThrow(@TempDir Path tempDir) {
        assertThrows(InvalidInputException.class, () -> new BatchInputReader().read(tempDir.resolve("none.csv")));
    }

    @Test
    void testHeaderOnly_ShouldBeEmpty(@TempDir Path tempDir) throws IOException {
        assertTrue(new BatchInputReader().read(csv(tempDir, "ra,dec\n")).isEmpty());
    }
}
