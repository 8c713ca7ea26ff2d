package com.vpnbot.api.users.payload;

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
@Schema(name = "Trial")
public class TrialResponse {

    @Schema(required = true, type = "integer", format = "int64", description = "epoch seconds when the user's access ends")
    @NonNull
    private OffsetDateTime accessEndsAt;

    @Schema(required = true, description = "state of the user's VPN account after the activation")
    @NonNull
    private ProvisioningStatus provisioning;
}
