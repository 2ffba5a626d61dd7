package com.dotplatform.setting.service;

import com.dotplatform.setting.entity.SettingKey;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Effective value of a setting; {@code updatedAt} is null while the configured default applies.
 */
public record SettingView(SettingKey key, BigDecimal value, String description, LocalDateTime updatedAt) {
}
