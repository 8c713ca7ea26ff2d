package com.vpnbot.api.notification.payload;

import com.vpnbot.api.contracts.NotificationKind;
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
@Schema(name = "Notification")
public class NotificationResponse {

    @Schema(required = true, description = "id of the notification")
    @NonNull
    private Long id;

    @Schema(required = true, description = "kind of the notification")
    @NonNull
    private NotificationKind kind;

    @Schema(required = true, description = "severity of the notification")
    @NonNull
    private NotificationKind.Level level;

    @Schema(required = true)
    @NonNull
    private String title;

    @Schema(required = true)
    @NonNull
    private String message;

    @Schema(required = true, description = "whether the user has marked the notification as read")
    @NonNull
    private Boolean isRead;

    @Schema(required = true, type = "integer", format = "int64", description = "epoch seconds when the notification was created")
    @NonNull
    private OffsetDateTime createdAt;
}
