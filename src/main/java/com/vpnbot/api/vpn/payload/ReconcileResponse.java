package com.vpnbot.api.vpn.payload;

import com.vpnbot.api.contracts.ProvisioningStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReconcileResponse {

    @Schema(required = true, description = "outcome of the reconciliation")
    @NonNull
    private ProvisioningStatus provisioning;
}
