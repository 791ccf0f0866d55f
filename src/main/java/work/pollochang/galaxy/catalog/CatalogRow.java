package work.pollochang.galaxy.catalog;

import work.pollochang.galaxy.exception.TransportException;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 查詢結果的一列，欄位名稱不分大小寫。
 */
public class CatalogRow {

    private final Map<String, Object> values = new HashMap<>();

    public CatalogRow(Map<String, ?> columns) {
        columns.forEach((k, v) -> values.put(k.toLowerCase(Locale.ROOT), v));
    }

    public long getLong(String column) {
        return number(column).longValue();
    }

    public int getInt(String column) {
        return number(column).intValue();
    }

    public double getDouble(String column) {
        return number(column).doubleValue();
    }

    private Number number(String column) {
        Object value = values.get(column.toLowerCase(Locale.ROOT));
        if (value instanceof Number) {
            return (Number) value;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            try {
                return Long.valueOf(text);
            } catch (NumberFormatException notLong) {
                try {
                    return Double.valueOf(text);
                } catch (NumberFormatException e) {
                    throw new TransportException("欄位 " + column + " 不是數值: " + value, e);
                }
            }
        }
        throw new TransportException("查詢結果缺少欄位: " + column + " (現有欄位: " + values.keySet() + ")");
    }

    @Override
    public String toString() {
        return "CatalogRow" + values;
    }
}
