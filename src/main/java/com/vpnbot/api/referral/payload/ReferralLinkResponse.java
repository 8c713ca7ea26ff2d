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
@Schema(name = "ReferralLink")
public class ReferralLinkResponse {

    @Schema(required = true, description = "code that identifies the link owner")
    @NonNull
    private String code;

    @Schema(required = true, description = "shareable link that opens the bot with the code")
    @NonNull
    private String link;

    @Schema(required = true, description = "whether new users can still sign up with this link")
    @NonNull
    private Boolean isActive;
}
