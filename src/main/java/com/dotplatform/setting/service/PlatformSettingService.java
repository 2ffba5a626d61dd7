package com.dotplatform.setting.service;

import com.dotplatform.common.exception.BusinessException;
import com.dotplatform.common.exception.ErrorCode;
import com.dotplatform.setting.entity.PlatformSetting;
import com.dotplatform.setting.entity.SettingKey;
import com.dotplatform.setting.repository.PlatformSettingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Admin-editable platform settings backed by the {@code platform_settings} table.
 *
 * <h3>Caching</h3>
 * Reads go through the Caffeine cache {@value #CACHE_NAME}; an update evicts its key so the
 * next read sees the new value. A key that was never stored resolves to the configured default.
 *
 * Changing DEFAULT_COMMISSION affects only orders created afterwards, because each order keeps
 * the commission captured at creation.
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class PlatformSettingService {

    public static final String CACHE_NAME = "platformSettings";

    private final PlatformSettingRepository settingRepository;
    private final Map<SettingKey, BigDecimal> defaults = new EnumMap<>(SettingKey.class);

    public PlatformSettingService(
            PlatformSettingRepository settingRepository,
            @Value("${dot.wallet.default-commission:5000}") BigDecimal defaultCommission,
            @Value("${dot.pricing.taxi.base-price:5000}") BigDecimal taxiBasePrice,
            @Value("${dot.pricing.taxi.price-per-km:5000}") BigDecimal taxiPricePerKm,
            @Value("${dot.pricing.delivery.base-price:3000}") BigDecimal deliveryBasePrice,
            @Value("${dot.pricing.delivery.price-per-km:2500}") BigDecimal deliveryPricePerKm) {
        this.settingRepository = settingRepository;
        defaults.put(SettingKey.DEFAULT_COMMISSION, defaultCommission);
        defaults.put(SettingKey.TAXI_BASE_PRICE, taxiBasePrice);
        defaults.put(SettingKey.TAXI_PRICE_PER_KM, taxiPricePerKm);
        defaults.put(SettingKey.DELIVERY_BASE_PRICE, deliveryBasePrice);
        defaults.put(SettingKey.DELIVERY_PRICE_PER_KM, deliveryPricePerKm);
    }

    @Cacheable(cacheNames = CACHE_NAME, key = "#key.name()")
    public BigDecimal getDecimal(SettingKey key) {
        return settingRepository.findBySettingKey(key)
                .map(setting -> new BigDecimal(setting.getValue()))
                .orElseGet(() -> defaults.get(key));
    }

    public List<SettingView> getAll() {
        return Arrays.stream(SettingKey.values())
                .map(key -> {
                    Optional<PlatformSetting> stored = settingRepository.findBySettingKey(key);
                    return new SettingView(key,
                            stored.map(s -> new BigDecimal(s.getValue())).orElseGet(() -> defaults.get(key)),
                            key.getDescription(),
                            stored.map(PlatformSetting::getUpdatedAt).orElse(null));
                })
                .toList();
    }

    @Transactional
    @CacheEvict(cacheNames = CACHE_NAME, key = "#key.name()")
    public SettingView update(SettingKey key, BigDecimal value) {
        if (value == null || value.signum() < 0 || value.scale() > 2) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    key + " must be a non-negative amount with at most 2 decimals");
        }
        String stored = value.toPlainString();
        PlatformSetting setting = settingRepository.findBySettingKey(key)
                .map(existing -> {
                    existing.changeValue(stored);
                    return existing;
                })
                .orElseGet(() -> settingRepository.save(PlatformSetting.builder()
                        .settingKey(key)
                        .value(stored)
                        .build()));

        log.info("Platform setting updated: key={}, value={}", key, stored);
        return new SettingView(key, value, key.getDescription(), setting.getUpdatedAt());
    }
}
