package com.aiinpocket.rewards.exception;

/**
 * 挑戰設定不合法（缺少必要欄位、數值超出範圍、JSON 無法解析）。
 */
public class ChallengeConfigException extends RuntimeException {

    public ChallengeConfigException(String message) {
        super(message);
    }

    public ChallengeConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
