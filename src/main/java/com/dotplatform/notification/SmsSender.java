package com.dotplatform.notification;

/**
 * Outbound SMS gateway. Delivery is best-effort: {@code false} or an exception never affects
 * the order the message is about.
 */
public interface SmsSender {

    boolean sendLocationLink(String phoneNumber, String locationToken, Long orderId);
}
