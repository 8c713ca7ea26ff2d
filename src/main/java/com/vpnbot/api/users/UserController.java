package com.vpnbot.api.users;

import com.vpnbot.api.users.exceptions.TrialAlreadyUsedException;
import com.vpnbot.api.users.exceptions.UserNotFoundException;
import com.vpnbot.api.users.payload.RegisterUserParams;
import com.vpnbot.api.users.payload.TrialResponse;
import com.vpnbot.api.users.payload.UserResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/v1/users")
@Slf4j
@Tag(name = "user")
class UserController {

    private final UserService userService;

    @Autowired
    UserController(@NonNull UserService userService) {
        this.userService = userService;
    }

    /**
     * Registers a user on their first interaction with the bot, or refreshes the display fields of
     * an already registered user. The bot calls it on every {@code /start}.
     */
    @Operation(summary = "Register or refresh a user")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "409", description = "user was registered concurrently", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PutMapping
    ResponseEntity<UserResponse> registerUser(@Valid @NotNull @RequestBody RegisterUserParams params) {
        return ResponseEntity.ok(userService.register(params));
    }

    @Operation(summary = "Get a user")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "user doesn't exist", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/{userId}")
    ResponseEntity<UserResponse> getUser(@NotNull @Min(1) @PathVariable Long userId) {
        try {
            return ResponseEntity.ok(userService.getUser(userId));
        } catch (UserNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * Activates the user's one-time trial. The response tells whether the VPN account is ready or
     * its provisioning has been deferred.
     */
    @Operation(summary = "Activate the trial")
    @ApiResponses({
        @ApiResponse(responseCode = "201"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "user doesn't exist", content = @Content),
        @ApiResponse(responseCode = "409", description = "user has already used their trial", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/{userId}/trial")
    ResponseEntity<TrialResponse> activateTrial(@NotNull @Min(1) @PathVariable Long userId) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(userService.activateTrial(userId));
        } catch (UserNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (TrialAlreadyUsedException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }
}
