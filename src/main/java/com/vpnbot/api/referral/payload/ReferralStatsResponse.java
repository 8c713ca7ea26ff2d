package com.vpnbot.api.referral.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "ReferralStats")
public class ReferralStatsResponse {

    @Schema(required = true, description = "number of users that signed up with the user's link")
    @NonNull
    private Long referrals;

    @Schema(required = true, description = "number of referred users that completed a payment")
    @NonNull
    private Long creditedReferrals;

    @Schema(required = true, description = "total bonus days the user has received")
    @NonNull
    private Long bonusDays;
}
