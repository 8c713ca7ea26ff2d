package com.vpnbot.api.subscription.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;

/**
 * A data transfer object to send plan details back to the controller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "Plan")
public class PlanResponse {

    @Schema(required = true, description = "id of the plan")
    @NonNull
    private String id;

    @Schema(required = true, description = "display name of the plan")
    @NonNull
    private String name;

    @Schema(description = "an optional description of the plan")
    private String description;

    @Schema(required = true, description = "price of the plan in its currency")
    @NonNull
    private BigDecimal price;

    @Schema(required = true, description = "ISO 4217 currency code of the price")
    @NonNull
    private String currency;

    @Schema(required = true, description = "number of days of access included with the plan")
    @NonNull
    private Integer durationDays;
}
