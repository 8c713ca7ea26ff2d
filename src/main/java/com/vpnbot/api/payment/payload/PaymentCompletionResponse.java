package com.vpnbot.api.payment.payload;

import com.vpnbot.api.contracts.ProvisioningStatus;
import com.vpnbot.api.payment.entities.Payment;
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
@Schema(name = "PaymentCompletion")
public class PaymentCompletionResponse {

    @Schema(required = true, description = "id of the payment")
    @NonNull
    private String paymentId;

    @Schema(required = true)
    @NonNull
    private Payment.Status status;

    @Schema(required = true, description = "whether the payment had already been completed by an earlier request")
    @NonNull
    private Boolean isDuplicate;

    @Schema(description = "outcome of the vpn provisioning; absent for duplicates")
    private ProvisioningStatus provisioning;

    @Schema(type = "integer", format = "int64", description = "epoch seconds when the payer's access ends; absent for duplicates")
    private OffsetDateTime accessEndsAt;
}
