package com.vpnbot.api.promocode.payload;

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
@Schema(name = "Promocode")
public class PromocodeResponse {

    @Schema(required = true, description = "upper-case code of the promo code")
    @NonNull
    private String code;

    @Schema(required = true, description = "number of access days granted by each redemption")
    @NonNull
    private Integer days;

    @Schema(required = true, description = "maximum number of redemptions; 0 for an unlimited code")
    @NonNull
    private Integer usageLimit;

    @Schema(required = true, description = "number of times the code has been redeemed")
    @NonNull
    private Integer usedCount;

    @Schema(required = true, description = "whether the code has been deactivated by an operator")
    @NonNull
    private Boolean isActive;

    @Schema(type = "integer", format = "int64", description = "epoch seconds after which the code can't be redeemed")
    private OffsetDateTime expiresAt;

    @Schema(required = true, description = "whether a user who hasn't used the code yet can redeem it now")
    @NonNull
    private Boolean isRedeemable;
}
