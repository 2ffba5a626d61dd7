package com.dotplatform.order.entity;

public enum OrderType {
    TAXI,
    DELIVERY
}
