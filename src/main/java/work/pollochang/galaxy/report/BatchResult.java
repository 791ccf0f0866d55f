package work.pollochang.galaxy.report;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 座標批次的結果，第 i 筆對應輸入第 i 列。
 */
public class BatchResult {

    private final List<RowReport> rows;

    public BatchResult(List<RowReport> rows) {
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i) == null || rows.get(i).index() != i) {
                throw new IllegalArgumentException("第 " + i + " 列結果缺漏或序號不符");
            }
        }
        this.rows = Collections.unmodifiableList(rows);
    }

    public RowReport get(int index) {
        return rows.get(index);
    }

    public List<RowReport> rows() {
        return rows;
    }

    public int total() {
        return rows.size();
    }

    public long foundCount() {
        return rows.stream().filter(RowReport::isFound).count();
    }

    public Map<ResolutionStatus, Long> countsByStatus() {
        Map<ResolutionStatus, Long> counts = new EnumMap<>(ResolutionStatus.class);
        for (ResolutionStatus status : ResolutionStatus.values()) {
            counts.put(status, 0L);
        }
        rows.forEach(r -> counts.merge(r.status(), 1L, Long::sum));
        return counts;
    }
}
