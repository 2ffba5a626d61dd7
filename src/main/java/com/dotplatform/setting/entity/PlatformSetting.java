package com.dotplatform.setting.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

@Entity
@Table(name = "platform_settings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class PlatformSetting {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "setting_key", nullable = false, unique = true, length = 64)
    private SettingKey settingKey;

    @Column(name = "setting_value", nullable = false)
    private String value;

    private String description;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @Builder
    public PlatformSetting(SettingKey settingKey, String value) {
        this.settingKey = settingKey;
        this.value = value;
        this.description = settingKey.getDescription();
    }

    public void changeValue(String value) {
        this.value = value;
    }
}
