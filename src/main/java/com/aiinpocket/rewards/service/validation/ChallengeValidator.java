package com.aiinpocket.rewards.service.validation;

import com.aiinpocket.rewards.model.config.ChallengeConfig;
import com.aiinpocket.rewards.model.dto.ValidationContext;
import com.aiinpocket.rewards.model.dto.ValidationResult;
import com.aiinpocket.rewards.model.progress.ChallengeProgress;

/**
 * 單一挑戰類型的驗證器。只讀取活動資料，不修改任何狀態；
 * 沒有新活動時重複呼叫會得到相同的結果。
 */
public interface ChallengeValidator<C extends ChallengeConfig, P extends ChallengeProgress> {

    ValidationResult<P> validate(ValidationContext context, C config);
}
