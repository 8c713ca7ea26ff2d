package com.vpnbot.api.referral.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SetLinkActiveParams {

    @Schema(required = true, description = "whether new users can sign up with the link")
    @NotNull
    private Boolean isActive;
}
