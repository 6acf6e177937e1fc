package com.acks.exception;

/**
 * A map, room, fight, combatant, character or party does not exist.
 */
public class NotFoundException extends CampaignException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException of(String what, String id) {
        return new NotFoundException(what + " not found: " + id);
    }
}
