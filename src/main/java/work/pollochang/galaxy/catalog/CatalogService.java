package work.pollochang.galaxy.catalog;

import java.util.List;

/**
 * 目錄查詢服務：執行查詢、回傳資料列。
 */
public interface CatalogService {

    /**
     * @param query 查詢
     * @return 資料列，沒有結果時為空 list
     * @throws work.pollochang.galaxy.exception.TransportException 網路或回應格式錯誤
     */
    List<CatalogRow> run(CatalogQuery query);
}
