package com.vpnbot.api.referral;

import com.vpnbot.api.referral.exceptions.ReferralLinkNotFoundException;
import com.vpnbot.api.referral.exceptions.ReferrerNotFoundException;
import com.vpnbot.api.referral.payload.ReferralLinkResponse;
import com.vpnbot.api.referral.payload.ReferralStatsResponse;
import com.vpnbot.api.referral.payload.SetLinkActiveParams;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/v1/referrals")
@Slf4j
@Tag(name = "referral")
class ReferralController {

    private final ReferralService referralService;

    @Autowired
    ReferralController(@NonNull ReferralService referralService) {
        this.referralService = referralService;
    }

    /**
     * Returns the user's referral link. The link is created on the first request.
     */
    @Operation(summary = "Get or create the referral link of a user")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "user doesn't exist", content = @Content),
        @ApiResponse(responseCode = "409", description = "link was created concurrently", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/users/{userId}/link")
    ResponseEntity<ReferralLinkResponse> getOrCreateLink(@NotNull @Min(1) @PathVariable Long userId) {
        try {
            return ResponseEntity.ok(referralService.getOrCreateLink(userId));
        } catch (ReferrerNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "Activate or deactivate the referral link of a user")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "user doesn't have a referral link", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PatchMapping("/users/{userId}/link")
    ResponseEntity<ReferralLinkResponse> setLinkActive(
        @NotNull @Min(1) @PathVariable Long userId,
        @Valid @NotNull @RequestBody SetLinkActiveParams params
    ) {
        try {
            return ResponseEntity.ok(referralService.setLinkActive(userId, params.getIsActive()));
        } catch (ReferralLinkNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "Get referral statistics of a user")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "user doesn't exist", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/users/{userId}/stats")
    ResponseEntity<ReferralStatsResponse> getStats(@NotNull @Min(1) @PathVariable Long userId) {
        try {
            return ResponseEntity.ok(referralService.getStats(userId));
        } catch (ReferrerNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }
}
