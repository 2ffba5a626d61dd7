package com.dotplatform.common.security;

public enum UserRole {
    CUSTOMER,
    DRIVER,
    ADMIN
}
