package com.dotplatform.common.exception;

import lombok.Getter;

/**
 * Unchecked exception for domain rule violations.
 *
 * <pre>
 *   throw new BusinessException(ErrorCode.ORDER_NOT_FOUND);
 *   throw new BusinessException(ErrorCode.INSUFFICIENT_BALANCE, "Balance 1200.00 is below commission 5000.00");
 * </pre>
 *
 * Thrown inside a {@code @Transactional} method it rolls the whole transaction back, which is
 * how a declined commission deduction undoes the COMPLETED status write.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
