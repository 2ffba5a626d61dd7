package com.dotplatform.common.security;

import com.dotplatform.common.exception.BusinessException;
import com.dotplatform.common.exception.ErrorCode;

/**
 * Verified caller identity. The core never sees credentials, only this pair.
 */
public record AuthenticatedUser(Long userId, UserRole role) {

    public boolean hasRole(UserRole expected) {
        return role == expected;
    }

    public void requireRole(UserRole expected) {
        if (role != expected) {
            throw new BusinessException(ErrorCode.NOT_AUTHORIZED,
                    "Only " + expected.name().toLowerCase() + "s can perform this operation");
        }
    }
}
