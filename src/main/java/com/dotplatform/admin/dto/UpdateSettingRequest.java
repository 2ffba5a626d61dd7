package com.dotplatform.admin.dto;

import com.dotplatform.setting.entity.SettingKey;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record UpdateSettingRequest(@NotNull SettingKey key, @NotNull BigDecimal value) {
}
