package com.vpnbot.api.notification;

import com.vpnbot.api.notification.exceptions.NotificationNotFoundException;
import com.vpnbot.api.notification.payload.NotificationResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Validated
@RestController
@RequestMapping("/v1/notifications")
@Slf4j
@Tag(name = "notification")
class NotificationController {

    private final NotificationService notificationService;

    @Autowired
    NotificationController(@NonNull NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    /**
     * Lists a {@code page} of the user's notifications, newest first. Each {@code page} contains
     * at most 20 entries.
     *
     * @param onlyUnread list only the notifications that the user hasn't read yet.
     * @param page       0-indexed page number.
     * @return a list of notifications; empty list if the page number is higher than available data.
     */
    @Operation(summary = "List notifications")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping
    ResponseEntity<List<NotificationResponse>> listNotifications(
        @NotNull @Min(1) @RequestParam Long userId,
        @NotNull @RequestParam(required = false, defaultValue = "false") Boolean onlyUnread,
        @NotNull @Min(0) @RequestParam(required = false, defaultValue = "0") Integer page
    ) {
        return ResponseEntity.ok(notificationService.listNotifications(userId, onlyUnread, page));
    }

    @Operation(summary = "Mark a notification as read")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "notification marked as read"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "notification doesn't exist", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/{notificationId}/read")
    ResponseEntity<Void> markRead(
        @NotNull @Min(1) @RequestParam Long userId,
        @NotNull @Min(1) @PathVariable Long notificationId
    ) {
        try {
            notificationService.markRead(userId, notificationId);
            return ResponseEntity.noContent().build();
        } catch (NotificationNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "Mark all notifications as read")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "all notifications marked as read"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/read")
    ResponseEntity<Void> markAllRead(@NotNull @Min(1) @RequestParam Long userId) {
        notificationService.markAllRead(userId);
        return ResponseEntity.noContent().build();
    }
}
