package work.pollochang.galaxy.batch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.galaxy.core.SkyCoordinate;
import work.pollochang.galaxy.exception.InvalidInputException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 讀取批次輸入 CSV (第一列為欄位名稱)，取出赤經、赤緯兩欄。
 * 所有檢查都在回傳前完成，任何錯誤都不會進到網路階段。
 */
@Slf4j
public class BatchInputReader {

    private static final TypeReference<Map<String, String>> ROW_TYPE = new TypeReference<>() {};

    private final String raColumn;
    private final String decColumn;

    public BatchInputReader() {
        this("ra", "dec");
    }

    public BatchInputReader(String raColumn, String decColumn) {
        this.raColumn = raColumn;
        this.decColumn = decColumn;
    }

    /**
     * @throws InvalidInputException 檔案無法讀取、缺少欄位或含非數值
     */
    public List<SkyCoordinate> read(Path csvFile) {
        if (!Files.isReadable(csvFile)) {
            throw new InvalidInputException("批次輸入檔不存在或不可讀: " + csvFile);
        }

        List<Map<String, String>> rows = new ArrayList<>();
        CsvMapper mapper = new CsvMapper();
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it = mapper.readerFor(ROW_TYPE).with(schema).readValues(csvFile.toFile())) {
            while (it.hasNextValue()) {
                rows.add(it.nextValue());
            }
        } catch (IOException | RuntimeException e) {
            throw new InvalidInputException("無法讀取批次輸入檔: " + csvFile + " (" + e.getMessage() + ")", e);
        }

        List<SkyCoordinate> coordinates = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Map<String, String> row = rows.get(i);
            double ra = parse(row, raColumn, i);
            double dec = parse(row, decColumn, i);
            if (!SkyCoordinate.isValid(ra, dec)) {
                throw new InvalidInputException(String.format("第 %d 列座標超出範圍: ra=%s, dec=%s", i + 1, ra, dec));
            }
            coordinates.add(new SkyCoordinate(ra, dec));
        }
        log.info("{} - 讀取 {} 列座標", csvFile, coordinates.size());
        return coordinates;
    }

    private static double parse(Map<String, String> row, String column, int index) {
        String value = lookup(row, column);
        if (value == null) {
            throw new InvalidInputException("批次輸入檔缺少欄位 '" + column + "' (現有欄位: " + row.keySet() + ")");
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidInputException(String.format("第 %d 列欄位 '%s' 不是數值: '%s'", index + 1, column, value), e);
        }
    }

    private static String lookup(Map<String, String> row, String column) {
        for (Map.Entry<String, String> entry : row.entrySet()) {
            if (entry.getKey() != null && entry.getKey().trim().equalsIgnoreCase(column)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
