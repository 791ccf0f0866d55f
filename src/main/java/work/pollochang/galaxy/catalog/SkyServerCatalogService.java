package work.pollochang.galaxy.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.galaxy.exception.TransportException;
import work.pollochang.galaxy.tools.HttpFetcher;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 透過 SkyServer SqlSearch Web Service 執行目錄查詢。
 * <p>
 * 回應格式為 {@code [{"TableName":"Table1","Rows":[{...}, ...]}]}。
 */
@Slf4j
public class SkyServerCatalogService implements CatalogService {

    public static final String DEFAULT_BASE_URL = "https://skyserver.sdss.org/dr17/SkyServerWS";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final String baseUrl;
    private final HttpFetcher http;

    public SkyServerCatalogService(String baseUrl, HttpFetcher http) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.http = http;
    }

    @Override
    public List<CatalogRow> run(CatalogQuery query) {
        String sql = SkyServerSql.render(query);
        String url = baseUrl + "/SearchTools/SqlSearch?cmd="
                + URLEncoder.encode(sql, StandardCharsets.UTF_8) + "&format=json";
        log.debug("SkyServer 查詢: {}", sql);

        List<CatalogRow> rows = parseRows(http.get(url));
        log.debug("SkyServer 回傳 {} 筆 ({})", rows.size(), query.kind());
        return rows;
    }

    static List<CatalogRow> parseRows(byte[] body) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (IOException e) {
            throw new TransportException("無法解析 SkyServer 回應: " + preview(body), e);
        }

        if (root == null || !root.isArray() || root.isEmpty()) {
            throw new TransportException("SkyServer 回應格式不符: " + preview(body));
        }
        JsonNode rowsNode = root.get(0).get("Rows");
        if (rowsNode == null || !rowsNode.isArray()) {
            throw new TransportException("SkyServer 回應缺少 Rows: " + preview(body));
        }

        List<CatalogRow> rows = new ArrayList<>(rowsNode.size());
        for (JsonNode rowNode : rowsNode) {
            rows.add(new CatalogRow(MAPPER.convertValue(rowNode, ROW_TYPE)));
        }
        return Collections.unmodifiableList(rows);
    }

    private static String preview(byte[] body) {
        String text = new String(body, StandardCharsets.UTF_8);
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
