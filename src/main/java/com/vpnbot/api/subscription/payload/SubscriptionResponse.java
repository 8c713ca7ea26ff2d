package com.vpnbot.api.subscription.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "Subscription")
public class SubscriptionResponse {

    @Schema(required = true, description = "id of the subscription")
    @NonNull
    private Long id;

    @Schema(description = "plan that opened the subscription; absent for trials and referral bonuses")
    private PlanResponse plan;

    @Schema(required = true, type = "integer", format = "int64", description = "epoch seconds when the access window opened")
    @NonNull
    private OffsetDateTime startAt;

    @Schema(required = true, type = "integer", format = "int64", description = "epoch seconds when the access window closes")
    @NonNull
    private OffsetDateTime endAt;

    @Schema(required = true, description = "whether the subscription grants access right now")
    @NonNull
    private Boolean isValid;

    @Schema(required = true, description = "whole days of access left, zero once the window has closed")
    @NonNull
    private Long daysRemaining;
}
