package com.acks.websocket;

import com.acks.model.Combatant;
import com.acks.model.Fight;
import com.acks.model.PendingAction;
import com.acks.model.Room;
import com.acks.model.ViewerRole;

/**
 * The DM's view: everything.
 */
public class DmMapView extends AbstractMapView {

    public DmMapView(ViewerRole role) {
        super(role);
    }

    @Override
    public boolean canSee(Room room) {
        return true;
    }

    @Override
    protected boolean showsDmDetail() {
        return true;
    }

    @Override
    protected boolean showsStats(Combatant combatant) {
        return true;
    }

    @Override
    protected boolean showsPending(Fight fight, PendingAction pending) {
        return true;
    }
}
