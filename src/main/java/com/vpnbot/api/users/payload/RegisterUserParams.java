package com.vpnbot.api.users.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
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
public class RegisterUserParams {

    @Schema(required = true, description = "Telegram id of the user")
    @NotNull
    @Min(1)
    private Long id;

    @Schema(description = "Telegram username of the user")
    @Size(max = 64)
    private String username;

    @Size(max = 64)
    private String firstName;

    @Size(max = 64)
    private String lastName;

    @Size(max = 16)
    private String languageCode;

    @Schema(description = "code of the referral link that brought the user; only honoured on first registration")
    @Size(max = 32)
    private String referralCode;
}
