package com.vpnbot.api.promocode.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RedeemPromocodeParams {

    @Schema(required = true, description = "Telegram id of the redeeming user")
    @NotNull
    @Min(1)
    private Long userId;
}
