package com.vpnbot.api.vpn;

import com.vpnbot.api.vpn.exceptions.ConnectionNotFoundException;
import com.vpnbot.api.vpn.exceptions.UnknownUserException;
import com.vpnbot.api.vpn.payload.ConnectionResponse;
import com.vpnbot.api.vpn.payload.ReconcileResponse;
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
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/v1/vpn")
@Slf4j
@Tag(name = "vpn")
class VpnController {

    private final VpnService vpnService;

    @Autowired
    VpnController(@NonNull VpnService vpnService) {
        this.vpnService = vpnService;
    }

    /**
     * Returns the user's VPN connection along with the state of its provisioning.
     */
    @Operation(summary = "Get the vpn connection of a user")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "user doesn't have a vpn connection", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/{userId}")
    ResponseEntity<ConnectionResponse> getConnection(@NotNull @Min(1) @PathVariable Long userId) {
        try {
            return ResponseEntity.ok(vpnService.getConnection(userId));
        } catch (ConnectionNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * Reconciles the user's panel account with their subscription right away, instead of waiting
     * for the next sweep. Failures are recorded the same way the sweep records them.
     */
    @Operation(summary = "Reconcile the vpn connection of a user")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "user doesn't exist", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/{userId}/reconcile")
    ResponseEntity<ReconcileResponse> reconcile(@NotNull @Min(1) @PathVariable Long userId) {
        try {
            return ResponseEntity.ok(new ReconcileResponse(vpnService.reconcileNow(userId)));
        } catch (UnknownUserException e) {
            return ResponseEntity.notFound().build();
        }
    }
}
