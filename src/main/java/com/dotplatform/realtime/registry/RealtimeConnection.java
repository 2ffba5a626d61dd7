package com.dotplatform.realtime.registry;

import com.dotplatform.common.security.UserRole;

import java.io.IOException;

/**
 * One live client connection. Identity and role are fixed at registration from the verified
 * token and never change for the lifetime of the connection.
 */
public interface RealtimeConnection {

    String id();

    Long userId();

    UserRole role();

    boolean isOpen();

    void send(String payload) throws IOException;

    void ping() throws IOException;

    void close();
}
