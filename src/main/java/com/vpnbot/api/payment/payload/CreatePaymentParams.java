package com.vpnbot.api.payment.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePaymentParams {

    @Schema(required = true, description = "Telegram id of the payer")
    @NotNull
    @Min(1)
    private Long userId;

    @Schema(required = true, description = "id of the plan being purchased")
    @NotBlank
    @Size(max = 64)
    private String planId;

    @Schema(required = true, description = "payment method chosen by the payer, e.g. card")
    @NotBlank
    @Size(max = 32)
    private String method;
}
