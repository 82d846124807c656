package com.aiinpocket.rewards.exception;

/**
 * 參加者驗證超過時限，放棄本次處理（尚未寫入任何資料），下一批次重試。
 */
public class ValidationTimeoutException extends RuntimeException {

    public ValidationTimeoutException(String message) {
        super(message);
    }
}
