package com.vpnbot.api.promocode;

import com.vpnbot.api.promocode.exceptions.DuplicatePromocodeException;
import com.vpnbot.api.promocode.exceptions.PromocodeNotFoundException;
import com.vpnbot.api.promocode.exceptions.PromocodeRedemptionException;
import com.vpnbot.api.promocode.exceptions.RedeemerNotFoundException;
import com.vpnbot.api.promocode.payload.CreatePromocodeParams;
import com.vpnbot.api.promocode.payload.PromocodeRedemptionResponse;
import com.vpnbot.api.promocode.payload.PromocodeResponse;
import com.vpnbot.api.promocode.payload.RedeemPromocodeParams;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Validated
@RestController
@RequestMapping("/v1/promocodes")
@Slf4j
@Tag(name = "promocode")
class PromocodeController {

    private final PromocodeService promocodeService;

    @Autowired
    PromocodeController(@NonNull PromocodeService promocodeService) {
        this.promocodeService = promocodeService;
    }

    @Operation(summary = "Create a promo code")
    @ApiResponses({
        @ApiResponse(responseCode = "201"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "409", description = "a promo code with the same code already exists", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping
    ResponseEntity<PromocodeResponse> createPromocode(@Valid @NotNull @RequestBody CreatePromocodeParams params) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(promocodeService.createPromocode(params));
        } catch (DuplicatePromocodeException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    /**
     * Lists the promo codes that haven't been deactivated, newest first.
     */
    @Operation(summary = "List active promo codes")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping
    ResponseEntity<List<PromocodeResponse>> listPromocodes() {
        return ResponseEntity.ok(promocodeService.listPromocodes());
    }

    @Operation(summary = "Get a promo code and whether it can be redeemed")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "promo code doesn't exist", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/{code}")
    ResponseEntity<PromocodeResponse> getPromocode(@NotBlank @Size(max = 32) @PathVariable String code) {
        try {
            return ResponseEntity.ok(promocodeService.getPromocode(code));
        } catch (PromocodeNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "Deactivate a promo code")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "promo code doesn't exist", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @DeleteMapping("/{code}")
    ResponseEntity<PromocodeResponse> deactivatePromocode(@NotBlank @Size(max = 32) @PathVariable String code) {
        try {
            return ResponseEntity.ok(promocodeService.deactivatePromocode(code));
        } catch (PromocodeNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * Redeems a promo code for a user. A user redeems each code at most once.
     */
    @Operation(summary = "Redeem a promo code")
    @ApiResponses({
        @ApiResponse(responseCode = "201"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "user or promo code doesn't exist", content = @Content),
        @ApiResponse(responseCode = "409", description = "promo code has expired, reached its usage limit or was already redeemed by the user", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/{code}/redemptions")
    ResponseEntity<PromocodeRedemptionResponse> redeemPromocode(
        @NotBlank @Size(max = 32) @PathVariable String code,
        @Valid @NotNull @RequestBody RedeemPromocodeParams params
    ) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(promocodeService.redeemPromocode(params.getUserId(), code));
        } catch (RedeemerNotFoundException | PromocodeNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (PromocodeRedemptionException e) {
            log.info("user {} couldn't redeem promo code {}: {}", params.getUserId(), code, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }
}
