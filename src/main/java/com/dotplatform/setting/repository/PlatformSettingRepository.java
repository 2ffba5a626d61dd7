package com.dotplatform.setting.repository;

import com.dotplatform.setting.entity.PlatformSetting;
import com.dotplatform.setting.entity.SettingKey;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PlatformSettingRepository extends JpaRepository<PlatformSetting, Long> {

    Optional<PlatformSetting> findBySettingKey(SettingKey settingKey);
}
