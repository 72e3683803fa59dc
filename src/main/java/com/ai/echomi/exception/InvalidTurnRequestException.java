package com.ai.echomi.exception;

/**
 * Request could not be turned into a valid session: unknown stage, stage that does
 * not belong to the caller role, or a missing utterance.
 */
public class InvalidTurnRequestException extends RuntimeException {

    public InvalidTurnRequestException(String message) {
        super(message);
    }
}
