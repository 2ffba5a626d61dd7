package com.dotplatform.setting.entity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SettingKey {

    DEFAULT_COMMISSION("Commission deducted from the driver wallet per completed order"),
    TAXI_BASE_PRICE("Base fare for taxi orders"),
    TAXI_PRICE_PER_KM("Price per kilometer for taxi orders"),
    DELIVERY_BASE_PRICE("Base fare for delivery orders"),
    DELIVERY_PRICE_PER_KM("Price per kilometer for delivery orders");

    private final String description;
}
