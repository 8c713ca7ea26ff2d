package com.vpnbot.api.vpn.payload;

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
@Schema(name = "VpnConnection")
public class ConnectionResponse {

    @Schema(required = true, description = "id of the connection")
    @NonNull
    private Long id;

    @Schema(required = true, description = "username of the account on the vpn panel")
    @NonNull
    private String panelUsername;

    @Schema(description = "display name of the connection")
    private String name;

    @Schema(required = true, description = "whether the account is enabled on the vpn panel")
    @NonNull
    private Boolean isActive;

    @Schema(required = true, description = "whether a failed provisioning is waiting for a retry")
    @NonNull
    private Boolean isProvisioningPending;

    @Schema(required = true, description = "whether provisioning failed and needs an operator")
    @NonNull
    private Boolean isProvisioningFailed;

    @Schema(required = true, type = "integer", format = "int64", description = "epoch seconds when the connection was created")
    @NonNull
    private OffsetDateTime createdAt;
}
