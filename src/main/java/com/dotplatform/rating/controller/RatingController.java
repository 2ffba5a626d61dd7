package com.dotplatform.rating.controller;

import com.dotplatform.common.dto.ApiResponse;
import com.dotplatform.common.security.AuthenticatedUser;
import com.dotplatform.common.security.CurrentUser;
import com.dotplatform.rating.dto.CreateRatingRequest;
import com.dotplatform.rating.entity.Rating;
import com.dotplatform.rating.service.RatingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/ratings")
@RequiredArgsConstructor
public class RatingController {

    private final RatingService ratingService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<Rating> rate(@CurrentUser AuthenticatedUser user,
                                    @Valid @RequestBody CreateRatingRequest request) {
        return ApiResponse.ok(ratingService.rate(user, request));
    }

    @GetMapping("/driver/{driverId}")
    public ApiResponse<List<Rating>> getDriverRatings(@CurrentUser AuthenticatedUser user,
                                                      @PathVariable Long driverId) {
        return ApiResponse.ok(ratingService.getDriverRatings(driverId));
    }

    @GetMapping("/my")
    public ApiResponse<List<Rating>> getMyRatings(@CurrentUser AuthenticatedUser user) {
        return ApiResponse.ok(ratingService.getMyRatings(user));
    }
}
