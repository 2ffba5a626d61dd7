package com.dotplatform.realtime.message;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum MessageType {

    DRIVER_LOCATION("driver_location"),
    ORDER_UPDATE("order_update"),
    NEW_ORDER("new_order"),
    GET_DRIVER_LOCATIONS("get_driver_locations"),
    DRIVER_LOCATIONS("driver_locations"),
    ERROR("error");

    @JsonValue
    private final String wireName;

    public static Optional<MessageType> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }
}
