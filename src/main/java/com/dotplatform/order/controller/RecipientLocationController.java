package com.dotplatform.order.controller;

import com.dotplatform.common.dto.ApiResponse;
import com.dotplatform.order.dto.RecipientLocationRequest;
import com.dotplatform.order.service.RecipientLocationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * Target of the SMS link. No bearer token: possession of the link token is the credential.
 */
@RestController
@RequestMapping("/api/recipient-location")
@RequiredArgsConstructor
public class RecipientLocationController {

    private final RecipientLocationService recipientLocationService;

    @PostMapping("/{token}")
    public ApiResponse<Long> submitLocation(@PathVariable String token,
                                            @Valid @RequestBody RecipientLocationRequest request) {
        return ApiResponse.ok(recipientLocationService.submitLocation(token, request).getId());
    }
}
