package com.aiinpocket.adwatch.model.enums;

/** 單次執行週期的結果狀態 */
public enum RunStatus {

    /** 查詢成功並已寫回執行紀錄（即使沒有新廣告） */
    COMPLETED,

    /** 查詢失敗或參數不合法，執行紀錄不變 */
    FAILED,

    /** 上一次執行尚未結束或監控器已停止，本次觸發直接略過 */
    SKIPPED
}
