package com.vpnbot.api.subscription;

import com.vpnbot.api.subscription.exceptions.SubscriptionNotFoundException;
import com.vpnbot.api.subscription.payload.PlanResponse;
import com.vpnbot.api.subscription.payload.SubscriptionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Validated
@RestController
@RequestMapping("/v1/subscriptions")
@Slf4j
@Tag(name = "subscription")
class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @Autowired
    SubscriptionController(@NonNull SubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    /**
     * Lists plans that are currently on sale, cheapest first.
     */
    @Operation(summary = "List plans")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/plans")
    ResponseEntity<List<PlanResponse>> listPlans() {
        return ResponseEntity.ok(subscriptionService.listPlans());
    }

    /**
     * Returns the user's current subscription, i.e. their active subscription with the latest
     * {@code endAt}. The subscription may have ended already if the expiry sweep hasn't processed it
     * yet; {@code isValid} tells whether it grants access right now.
     */
    @Operation(summary = "Get current subscription")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "user doesn't have an active subscription", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/users/{userId}/current")
    ResponseEntity<SubscriptionResponse> getCurrentSubscription(@NotNull @Min(1) @PathVariable Long userId) {
        try {
            return ResponseEntity.ok(subscriptionService.getCurrentSubscription(userId));
        } catch (SubscriptionNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }
}
