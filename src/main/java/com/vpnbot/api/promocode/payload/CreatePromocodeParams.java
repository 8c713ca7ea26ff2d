package com.vpnbot.api.promocode.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePromocodeParams {

    @Schema(required = true, description = "case-insensitive code that users enter to redeem the promo code")
    @NotNull
    @Pattern(regexp = "^\\s*[A-Za-z0-9_-]{3,32}\\s*$")
    private String code;

    @Schema(required = true, description = "number of access days granted by each redemption")
    @NotNull
    @Min(1)
    @Max(3650)
    private Integer days;

    @Schema(description = "maximum number of redemptions; 0 or absent for an unlimited code")
    @Min(0)
    private Integer usageLimit;

    @Schema(description = "instant after which the code can no longer be redeemed")
    private OffsetDateTime expiresAt;
}
