package com.vpnbot.api.promocode.payload;

import com.vpnbot.api.contracts.ProvisioningStatus;
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
@Schema(name = "PromocodeRedemption")
public class PromocodeRedemptionResponse {

    @Schema(required = true, description = "upper-case code of the redeemed promo code")
    @NonNull
    private String code;

    @Schema(required = true, description = "number of access days granted")
    @NonNull
    private Integer days;

    @Schema(required = true, type = "integer", format = "int64", description = "epoch seconds when the user's access ends")
    @NonNull
    private OffsetDateTime accessEndsAt;

    @Schema(required = true, description = "state of the user's VPN account after the redemption")
    @NonNull
    private ProvisioningStatus provisioning;
}
