package com.aiinpocket.rewards.exception;

/**
 * 挑戰或參加者的狀態不允許此操作。
 */
public class InvalidStateTransitionException extends RuntimeException {

    public InvalidStateTransitionException(String entity, Long id, Object from, Object to) {
        super(entity + " " + id + " 無法從 " + from + " 轉換為 " + to);
    }

    public InvalidStateTransitionException(String message) {
        super(message);
    }
}
