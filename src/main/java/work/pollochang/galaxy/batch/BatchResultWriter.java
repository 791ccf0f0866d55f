package work.pollochang.galaxy.batch;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.galaxy.report.BatchResult;
import work.pollochang.galaxy.report.RowReport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 將座標批次結果寫成 CSV，列順序與輸入相同。
 */
@Slf4j
public class BatchResultWriter {

    @JsonPropertyOrder({"row", "ra", "dec", "objid", "status", "message"})
    public record Line(int row, double ra, double dec, String objid, String status, String message) {

        static Line of(RowReport report) {
            return new Line(
                    report.index(),
                    report.coordinate().ra(),
                    report.coordinate().dec(),
                    report.objectId().isPresent() ? Long.toString(report.objectId().getAsLong()) : "",
                    report.status().name(),
                    report.message() == null ? "" : report.message()
            );
        }
    }

    public void write(BatchResult result, Path output) {
        CsvMapper mapper = new CsvMapper();
        CsvSchema schema = mapper.schemaFor(Line.class).withHeader();
        List<Line> lines = result.rows().stream().map(Line::of).collect(Collectors.toList());
        try {
            mapper.writer(schema).writeValue(output.toFile(), lines);
            log.info("批次結果已寫入: {} ({} 列)", output, lines.size());
        } catch (IOException e) {
            throw new UncheckedIOException("無法寫入批次結果: " + output, e);
        }
    }
}
