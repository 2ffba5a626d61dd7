package com.dotplatform.setting.service;

import com.dotplatform.common.exception.BusinessException;
import com.dotplatform.common.exception.ErrorCode;
import com.dotplatform.setting.entity.PlatformSetting;
import com.dotplatform.setting.entity.SettingKey;
import com.dotplatform.setting.repository.PlatformSettingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PlatformSettingServiceTest {

    @Mock
    private PlatformSettingRepository settingRepository;

    private PlatformSettingService settingService;

    @BeforeEach
    void setUp() {
        settingService = new PlatformSettingService(settingRepository,
                new BigDecimal("5000"), new BigDecimal("5000"), new BigDecimal("5000"),
                new BigDecimal("3000"), new BigDecimal("2500"));
    }

    @Test
    @DisplayName("Stored value wins over the configured default")
    void getDecimal_Stored() {
        given(settingRepository.findBySettingKey(SettingKey.DEFAULT_COMMISSION)).willReturn(Optional.of(
                PlatformSetting.builder().settingKey(SettingKey.DEFAULT_COMMISSION).value("7500.50").build()));

        assertThat(settingService.getDecimal(SettingKey.DEFAULT_COMMISSION)).isEqualByComparingTo("7500.50");
    }

    @Test
    @DisplayName("Missing key falls back to the configured default")
    void getDecimal_Default() {
        given(settingRepository.findBySettingKey(SettingKey.DELIVERY_BASE_PRICE)).willReturn(Optional.empty());

        assertThat(settingService.getDecimal(SettingKey.DELIVERY_BASE_PRICE)).isEqualByComparingTo("3000");
    }

    @Test
    @DisplayName("Update of an existing key changes its value in place")
    void update_Existing() {
        PlatformSetting stored = PlatformSetting.builder().settingKey(SettingKey.TAXI_PRICE_PER_KM).value("5000").build();
        given(settingRepository.findBySettingKey(SettingKey.TAXI_PRICE_PER_KM)).willReturn(Optional.of(stored));

        SettingView view = settingService.update(SettingKey.TAXI_PRICE_PER_KM, new BigDecimal("4500.25"));

        assertThat(stored.getValue()).isEqualTo("4500.25");
        assertThat(view.value()).isEqualByComparingTo("4500.25");
        verify(settingRepository, never()).save(any());
    }

    @Test
    @DisplayName("Update of a key never stored creates it")
    void update_New() {
        given(settingRepository.findBySettingKey(SettingKey.DEFAULT_COMMISSION)).willReturn(Optional.empty());
        given(settingRepository.save(any(PlatformSetting.class))).willAnswer(inv -> inv.getArgument(0));

        settingService.update(SettingKey.DEFAULT_COMMISSION, new BigDecimal("6000"));

        verify(settingRepository).save(any(PlatformSetting.class));
    }

    @Test
    @DisplayName("Negative values and values with more than 2 decimals are rejected")
    void update_Invalid() {
        assertThatThrownBy(() -> settingService.update(SettingKey.DEFAULT_COMMISSION, new BigDecimal("-1")))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_INPUT);
        assertThatThrownBy(() -> settingService.update(SettingKey.DEFAULT_COMMISSION, new BigDecimal("1.234")))
                .isInstanceOf(BusinessException.class);
    }

    @Test
    @DisplayName("Listing covers every key")
    void getAll() {
        given(settingRepository.findBySettingKey(any(SettingKey.class))).willReturn(Optional.empty());

        List<SettingView> all = settingService.getAll();

        assertThat(all).extracting(SettingView::key).containsExactly(SettingKey.values());
    }
}
