package com.aiinpocket.rewards.service.validation;

import com.aiinpocket.rewards.exception.ChallengeConfigException;
import com.aiinpocket.rewards.model.config.ChallengeConfig;
import com.aiinpocket.rewards.model.enums.ChallengeType;
import com.aiinpocket.rewards.model.progress.ChallengeProgress;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.json.JsonMapper;

import java.util.Map;

/**
 * 挑戰設定、進度快照與指標快照的 JSON 轉換。
 * 儲存層只保存字串，型別在這裡依挑戰類型還原。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChallengeJsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final JsonMapper jsonMapper;

    /**
     * 依挑戰類型解析設定。JSON 無法解析或結構與類型不符時拋出 ChallengeConfigException。
     */
    public ChallengeConfig readConfig(ChallengeType type, String json) {
        if (json == null || json.isBlank()) {
            throw new ChallengeConfigException(type + " 挑戰缺少設定");
        }
        try {
            return jsonMapper.readValue(json, type.configClass());
        } catch (Exception e) {
            throw new ChallengeConfigException(type + " 挑戰設定格式錯誤: " + e.getMessage(), e);
        }
    }

    /** 解析並檢查設定欄位 */
    public ChallengeConfig readValidConfig(ChallengeType type, String json) {
        ChallengeConfig config = readConfig(type, json);
        config.validate();
        return config;
    }

    public String writeConfig(ChallengeConfig config) {
        return jsonMapper.writeValueAsString(config);
    }

    public String writeProgress(ChallengeProgress progress) {
        return jsonMapper.writeValueAsString(progress);
    }

    /** 讀取進度快照，沒有快照時回傳 null */
    public ChallengeProgress readProgress(ChallengeType type, String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        return jsonMapper.readValue(json, type.progressClass());
    }

    public String writeMap(Map<String, ?> values) {
        return jsonMapper.writeValueAsString(values);
    }

    /** 解析指標快照。格式錯誤時記錄警告並回傳空 Map */
    public Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return jsonMapper.readValue(json, MAP_TYPE);
        } catch (Exception e) {
            log.warn("[JSON] 無法解析指標快照: {}", e.getMessage());
            return Map.of();
        }
    }
}
