package com.dotplatform.pricing.service;

import com.dotplatform.common.exception.BusinessException;
import com.dotplatform.common.exception.ErrorCode;
import com.dotplatform.order.entity.OrderType;
import com.dotplatform.setting.entity.SettingKey;
import com.dotplatform.setting.service.PlatformSettingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class PricingServiceTest {

    private static final Coordinates PICKUP = new Coordinates(37.5665, 126.9780);
    private static final Coordinates DROPOFF = new Coordinates(37.4979, 127.0276);

    @Mock
    private MapsService mapsService;
    @Mock
    private PlatformSettingService settingService;

    @InjectMocks
    private PricingService pricingService;

    @Test
    @DisplayName("Taxi price is base plus distance times per-km tariff")
    void estimatePrice_Taxi() {
        // Given
        given(mapsService.getDistanceKm(PICKUP, DROPOFF)).willReturn(Optional.of(new BigDecimal("10.000")));
        given(settingService.getDecimal(SettingKey.TAXI_BASE_PRICE)).willReturn(new BigDecimal("5000"));
        given(settingService.getDecimal(SettingKey.TAXI_PRICE_PER_KM)).willReturn(new BigDecimal("5000"));

        // When
        BigDecimal price = pricingService.estimatePrice(OrderType.TAXI, PICKUP, DROPOFF);

        // Then
        assertThat(price).isEqualTo(new BigDecimal("55000.00"));
    }

    @Test
    @DisplayName("Delivery price uses the delivery tariff and rounds half up to 2 decimals")
    void estimatePrice_DeliveryRounded() {
        // Given
        given(mapsService.getDistanceKm(PICKUP, DROPOFF)).willReturn(Optional.of(new BigDecimal("3.456")));
        given(settingService.getDecimal(SettingKey.DELIVERY_BASE_PRICE)).willReturn(new BigDecimal("3000"));
        given(settingService.getDecimal(SettingKey.DELIVERY_PRICE_PER_KM)).willReturn(new BigDecimal("2500.15"));

        // When
        BigDecimal price = pricingService.estimatePrice(OrderType.DELIVERY, PICKUP, DROPOFF);

        // Then: 3000 + 3.456 * 2500.15 = 11640.5184
        assertThat(price).isEqualTo(new BigDecimal("11640.52"));
    }

    @Test
    @DisplayName("Missing distance makes the price unavailable")
    void estimatePrice_Unavailable() {
        given(mapsService.getDistanceKm(PICKUP, DROPOFF)).willReturn(Optional.empty());

        assertThatThrownBy(() -> pricingService.estimatePrice(OrderType.TAXI, PICKUP, DROPOFF))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.PRICING_UNAVAILABLE);
        verifyNoInteractions(settingService);
    }
}
