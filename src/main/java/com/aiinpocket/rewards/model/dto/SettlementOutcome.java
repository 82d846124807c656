package com.aiinpocket.rewards.model.dto;

/**
 * 結算結果。同一位參加者被同時結算時，只有一個呼叫會得到 SETTLED，其餘為 RACE_LOST。
 */
public record SettlementOutcome(Status status, Long participantId, long awarded) {

    public enum Status {
        SETTLED,
        RACE_LOST
    }

    public static SettlementOutcome settled(Long participantId, long awarded) {
        return new SettlementOutcome(Status.SETTLED, participantId, awarded);
    }

    public static SettlementOutcome raceLost(Long participantId) {
        return new SettlementOutcome(Status.RACE_LOST, participantId, 0);
    }

    public boolean isSettled() {
        return status == Status.SETTLED;
    }
}
