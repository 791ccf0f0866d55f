package work.pollochang.galaxy.batch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.galaxy.core.SkyCoordinate;
import work.pollochang.galaxy.report.BatchResult;
import work.pollochang.galaxy.report.ResolutionStatus;
import work.pollochang.galaxy.report.RowReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchResultWriterTest {

    @Test
    void testWrite_ShouldFollowInputOrder(@TempDir Path tempDir) throws IOException {
        BatchResult result = new BatchResult(List.of(
                RowReport.found(0, new SkyCoordinate(10.0, 20.0), 1237648720693755918L),
                RowReport.notFound(1, new SkyCoordinate(11.0, 21.0)),
                RowReport.failed(2, new SkyCoordinate(12.0, 22.0), ResolutionStatus.FAILED_TRANSPORT, "HTTP 503")));
        Path output = tempDir.resolve("batch-result.csv");

        new BatchResultWriter().write(result, output);

        List<String> lines = Files.readAllLines(output);
        assertEquals(4, lines.size());
        assertEquals("row,ra,dec,objid,status,message", lines.get(0));
        assertTrue(lines.get(1).startsWith("0,10.0,20.0,1237648720693755918,FOUND"), lines.get(1));
        assertTrue(lines.get(2).startsWith("1,11.0,21.0,,NOT_FOUND"), lines.get(2));
        assertTrue(lines.get(3).startsWith("2,12.0,22.0,,FAILED_TRANSPORT,"), lines.get(3));
        assertTrue(lines.get(3).contains("HTTP 503"));
    }
}
