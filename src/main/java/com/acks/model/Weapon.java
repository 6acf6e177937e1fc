package com.acks.model;

/**
 * What an attack is made with.
 */
public record Weapon(String name, DamageDice dice, AttackType attackType) {

    public static Weapon defaultFor(Combatant combatant) {
        return new Weapon("default", combatant.damageDice(), combatant.getAttackType());
    }

    /** The weapon named by an action, or the actor's default when the action names none. */
    public static Weapon forAction(Combatant actor, CombatAction action) {
        if (action.getWeaponDamage() == null || action.getWeaponDamage().isBlank()) {
            return defaultFor(actor);
        }
        return new Weapon(
                action.getWeaponName() != null ? action.getWeaponName() : action.getWeaponDamage(),
                DamageDice.parse(action.getWeaponDamage()),
                action.getWeaponAttackType() != null ? action.getWeaponAttackType() : actor.getAttackType());
    }
}
