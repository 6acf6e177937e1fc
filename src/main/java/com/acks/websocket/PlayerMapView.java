package com.acks.websocket;

import com.acks.model.Combatant;
import com.acks.model.Fight;
import com.acks.model.PendingAction;
import com.acks.model.Room;
import com.acks.model.ViewerRole;

/**
 * A player's view: only rooms one of their characters has discovered, no DM notes, and no
 * statistics for anything not fighting on the party's side.
 */
public class PlayerMapView extends AbstractMapView {

    private final ViewerRole.Player player;

    public PlayerMapView(ViewerRole.Player player) {
        super(player);
        this.player = player;
    }

    @Override
    public boolean canSee(Room room) {
        return room.isDiscoveredByAny(player.characterIds());
    }

    @Override
    protected boolean showsDmDetail() {
        return false;
    }

    @Override
    protected boolean showsStats(Combatant combatant) {
        return combatant.isPartyMember();
    }

    @Override
    protected boolean showsPending(Fight fight, PendingAction pending) {
        return player.username().equals(pending.getSubmittedBy());
    }
}
