package com.acks.exception;

/**
 * The action is not legal right now: wrong turn, wrong fight state, or the combatant's
 * status does not allow it.
 */
public class IllegalActionException extends CampaignException {

    public IllegalActionException(String message) {
        super(ErrorKind.ILLEGAL_ACTION, message);
    }
}
