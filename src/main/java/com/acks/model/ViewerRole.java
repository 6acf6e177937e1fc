package com.acks.model;

import java.util.Set;

/**
 * Who is looking at, or acting on, campaign state. A player controls and sees only what their
 * own characters do; the DM controls and sees everything.
 */
public sealed interface ViewerRole permits ViewerRole.Player, ViewerRole.DungeonMaster {

    String username();

    boolean isDm();

    /** Whether this viewer may submit actions for {@code combatant}. */
    boolean controls(Combatant combatant);

    record Player(String username, Set<String> characterIds) implements ViewerRole {

        public Player {
            characterIds = Set.copyOf(characterIds);
        }

        @Override
        public boolean isDm() {
            return false;
        }

        @Override
        public boolean controls(Combatant combatant) {
            return combatant.isCharacter() && characterIds.contains(combatant.getCharacterId());
        }
    }

    record DungeonMaster(String username) implements ViewerRole {

        @Override
        public boolean isDm() {
            return true;
        }

        @Override
        public boolean controls(Combatant combatant) {
            return true;
        }
    }
}
