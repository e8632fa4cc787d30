package com.team.testcaseimport.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Test Case 大量匯入流程的設定。
 */
@Configuration
@ConfigurationProperties(prefix = "workflow.bulk-import")
@Getter
@Setter
public class BulkImportConfig {

    /** 未指定 batchSize 時的預設批次大小 */
    private int defaultBatchSize = 10;

    /** batchSize 上限（同時進行中的遠端呼叫數上限） */
    private int maxBatchSize = 50;

    /** 分類階段查詢既有 Work Item 的並行數，1 代表逐筆查詢 */
    private int lookupConcurrency = 1;

    /** 欄位清單快取存活時間 */
    private Duration fieldCatalogTtl = Duration.ofMinutes(30);

    /** 匯入目標的 Work Item 類型 */
    private String workItemType = "Test Case";

    /** 欄位對應建議的最低信心分數 */
    private int suggestionThreshold = 70;

    /** 預覽中顯示的範例筆數 */
    private int previewRows = 5;

    /** 單一檔案可處理的最大資料列數 */
    private int maxRows = 1000;
}
