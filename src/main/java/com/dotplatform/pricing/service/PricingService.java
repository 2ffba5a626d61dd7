package com.dotplatform.pricing.service;

import com.dotplatform.common.exception.BusinessException;
import com.dotplatform.common.exception.ErrorCode;
import com.dotplatform.order.entity.OrderType;
import com.dotplatform.setting.entity.SettingKey;
import com.dotplatform.setting.service.PlatformSettingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * price = basePrice + distanceKm * pricePerKm, rounded HALF_UP to 2 decimals.
 * Tariffs per order type come from the platform settings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PricingService {

    private final MapsService mapsService;
    private final PlatformSettingService settingService;

    public BigDecimal estimatePrice(OrderType orderType, Coordinates pickup, Coordinates dropoff) {
        BigDecimal distanceKm = mapsService.getDistanceKm(pickup, dropoff)
                .orElseThrow(() -> new BusinessException(ErrorCode.PRICING_UNAVAILABLE));

        BigDecimal basePrice = settingService.getDecimal(
                orderType == OrderType.TAXI ? SettingKey.TAXI_BASE_PRICE : SettingKey.DELIVERY_BASE_PRICE);
        BigDecimal pricePerKm = settingService.getDecimal(
                orderType == OrderType.TAXI ? SettingKey.TAXI_PRICE_PER_KM : SettingKey.DELIVERY_PRICE_PER_KM);

        BigDecimal price = basePrice.add(distanceKm.multiply(pricePerKm)).setScale(2, RoundingMode.HALF_UP);
        log.debug("Price estimated: type={}, distanceKm={}, price={}", orderType, distanceKm, price);
        return price;
    }
}
