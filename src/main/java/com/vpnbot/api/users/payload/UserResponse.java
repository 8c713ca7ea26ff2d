package com.vpnbot.api.users.payload;

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
@Schema(name = "User")
public class UserResponse {

    @Schema(required = true, description = "Telegram id of the user")
    @NonNull
    private Long id;

    private String username;

    private String firstName;

    private String lastName;

    private String languageCode;

    @Schema(required = true, description = "whether the user has used their one-time trial")
    @NonNull
    private Boolean hasTrial;

    @Schema(required = true, type = "integer", format = "int64", description = "epoch seconds of the first interaction")
    @NonNull
    private OffsetDateTime createdAt;
}
