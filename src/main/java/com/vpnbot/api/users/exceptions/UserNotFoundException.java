package com.vpnbot.api.users.exceptions;

/**
 * Thrown by getUser and activateTrial operations in UserService.
 */
public class UserNotFoundException extends Exception {

    public UserNotFoundException(String message) {
        super(message);
    }
}
