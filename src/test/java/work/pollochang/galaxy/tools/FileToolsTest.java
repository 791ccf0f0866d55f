package work.pollochang.galaxy.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileToolsTest {

    @Test
    void testEnsureDirectoryExists_ShouldCreateNestedDirectories(@TempDir Path tempDir) {
        Path nested = tempDir.resolve("out").resolve("1237648720693755918");

        FileTools.ensureDirectoryExists(nested);
        FileTools.ensureDirectoryExists(nested);

        assertTrue(Files.isDirectory(nested));
    }

    @Test
    void testFormatFileSize() {
        assertEquals("0 B", FileTools.formatFileSize(0));
        assertEquals("512 B", FileTools.formatFileSize(512));
        assertEquals("2 KB", FileTools.formatFileSize(2048));
        assertEquals("3 MB", FileTools.formatFileSize(3L * 1024 * 1024));
    }
}
