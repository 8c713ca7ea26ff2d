package com.vpnbot.api.users.exceptions;

/**
 * Thrown by activateTrial operation in UserService.
 */
public class TrialAlreadyUsedException extends Exception {

    public TrialAlreadyUsedException(String message) {
        super(message);
    }
}
