package com.vpnbot.api.payment;

import com.vpnbot.api.payment.exceptions.PayerNotFoundException;
import com.vpnbot.api.payment.exceptions.PaymentNotFoundException;
import com.vpnbot.api.payment.exceptions.PaymentStateException;
import com.vpnbot.api.payment.payload.CreatePaymentParams;
import com.vpnbot.api.payment.payload.PaymentCompletionResponse;
import com.vpnbot.api.payment.payload.PaymentResponse;
import com.vpnbot.api.subscription.exceptions.PlanNotFoundException;
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
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

@Validated
@RestController
@RequestMapping("/v1/payments")
@Slf4j
@Tag(name = "payment")
class PaymentController {

    static final String WEBHOOK_SECRET_HEADER = "X-Webhook-Secret";

    private final PaymentConfiguration paymentConfig;
    private final PaymentService paymentService;

    @Autowired
    PaymentController(@NonNull PaymentConfiguration paymentConfig, @NonNull PaymentService paymentService) {
        this.paymentConfig = paymentConfig;
        this.paymentService = paymentService;
    }

    /**
     * Creates a pending payment for a plan. The payment provider completes or fails it later.
     */
    @Operation(summary = "Create a payment")
    @ApiResponses({
        @ApiResponse(responseCode = "201"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "user or plan doesn't exist", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping
    ResponseEntity<PaymentResponse> createPayment(@Valid @NotNull @RequestBody CreatePaymentParams params) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(paymentService.createPayment(params));
        } catch (PayerNotFoundException | PlanNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "Get a payment")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "payment doesn't exist", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/{paymentId}")
    ResponseEntity<PaymentResponse> getPayment(@NotBlank @Size(max = 64) @PathVariable String paymentId) {
        try {
            return ResponseEntity.ok(paymentService.getPayment(paymentId));
        } catch (PaymentNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * Confirms a payment on behalf of the payment provider. Repeated confirmations of a completed
     * payment succeed and are flagged as duplicates.
     */
    @Operation(summary = "Complete a payment")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "401", description = "webhook secret is missing or wrong", content = @Content),
        @ApiResponse(responseCode = "404", description = "payment doesn't exist", content = @Content),
        @ApiResponse(responseCode = "409", description = "payment has failed or has been refunded", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/{paymentId}/complete")
    ResponseEntity<PaymentCompletionResponse> completePayment(
        @RequestHeader(value = WEBHOOK_SECRET_HEADER, required = false) String secret,
        @NotBlank @Size(max = 64) @PathVariable String paymentId
    ) {
        if (!isWebhookSecretValid(secret)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        try {
            return ResponseEntity.ok(paymentService.completePayment(paymentId));
        } catch (PaymentNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (PaymentStateException e) {
            log.info("refused to complete payment {}: {}", paymentId, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    @Operation(summary = "Fail a payment")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "401", description = "webhook secret is missing or wrong", content = @Content),
        @ApiResponse(responseCode = "404", description = "payment doesn't exist", content = @Content),
        @ApiResponse(responseCode = "409", description = "payment isn't pending", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/{paymentId}/fail")
    ResponseEntity<PaymentResponse> failPayment(
        @RequestHeader(value = WEBHOOK_SECRET_HEADER, required = false) String secret,
        @NotBlank @Size(max = 64) @PathVariable String paymentId
    ) {
        if (!isWebhookSecretValid(secret)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        try {
            return ResponseEntity.ok(paymentService.failPayment(paymentId));
        } catch (PaymentNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (PaymentStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    @Operation(summary = "Refund a payment")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "401", description = "webhook secret is missing or wrong", content = @Content),
        @ApiResponse(responseCode = "404", description = "payment doesn't exist", content = @Content),
        @ApiResponse(responseCode = "409", description = "payment isn't completed", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/{paymentId}/refund")
    ResponseEntity<PaymentResponse> refundPayment(
        @RequestHeader(value = WEBHOOK_SECRET_HEADER, required = false) String secret,
        @NotBlank @Size(max = 64) @PathVariable String paymentId
    ) {
        if (!isWebhookSecretValid(secret)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        try {
            return ResponseEntity.ok(paymentService.refundPayment(paymentId));
        } catch (PaymentNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (PaymentStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    private boolean isWebhookSecretValid(String secret) {
        if (secret == null) {
            return false;
        }

        return MessageDigest.isEqual(
            secret.getBytes(StandardCharsets.UTF_8),
            paymentConfig.getWebhookSecret().getBytes(StandardCharsets.UTF_8));
    }
}
