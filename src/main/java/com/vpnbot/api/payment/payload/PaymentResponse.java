package com.vpnbot.api.payment.payload;

import com.vpnbot.api.payment.entities.Payment;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "Payment")
public class PaymentResponse {

    @Schema(required = true, description = "id of the payment")
    @NonNull
    private String id;

    @Schema(required = true, description = "Telegram id of the payer")
    @NonNull
    private Long userId;

    @Schema(required = true, description = "id of the purchased plan")
    @NonNull
    private String planId;

    @Schema(required = true)
    @NonNull
    private BigDecimal amount;

    @Schema(required = true, description = "ISO 4217 currency code")
    @NonNull
    private String currency;

    @Schema(required = true)
    @NonNull
    private String method;

    private String description;

    @Schema(required = true)
    @NonNull
    private Payment.Status status;

    @Schema(required = true, type = "integer", format = "int64", description = "epoch seconds when the payment was created")
    @NonNull
    private OffsetDateTime createdAt;

    @Schema(type = "integer", format = "int64", description = "epoch seconds when the payment was completed")
    private OffsetDateTime completedAt;
}
