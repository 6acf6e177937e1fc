package com.acks.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A player character as kept by the character sheet store. The combat engine only ever touches
 * hit points, condition and banked XP, and only through {@code CharacterMutation}s.
 */
@Entity
@Table(name = "characters")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CharacterSheet {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    /** Username of the player who owns this character. */
    @Column(nullable = false)
    private String ownerUsername;

    private String className;

    @Builder.Default
    private int level = 1;

    private int strength;
    private int dexterity;
    private int constitution;
    private int intelligence;
    private int wisdom;
    private int charisma;

    private int maxHitPoints;

    private int currentHitPoints;

    private int armorClass;

    private int attackThrow;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private HitDie hitDie = HitDie.D8;

    @Embedded
    @Builder.Default
    private SavingThrows savingThrows = new SavingThrows();

    @Column(nullable = false)
    private long bankedXp;

    /** Prime-requisite XP bonus, in percent. */
    private int xpBonusPercent;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private CharacterCondition condition = CharacterCondition.HEALTHY;

    /** Party whose pending pool this character draws XP from. */
    private String partyId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "character_inventory", joinColumns = @JoinColumn(name = "character_id"))
    @OrderColumn(name = "slot")
    @Column(name = "item_name")
    @Builder.Default
    private List<String> inventory = new ArrayList<>();

    @Version
    private Long version;

    /** ACKS attribute modifier for a 3-18 score. */
    public static int attributeModifier(int score) {
        if (score <= 3) return -3;
        if (score <= 5) return -2;
        if (score <= 8) return -1;
        if (score <= 12) return 0;
        if (score <= 15) return 1;
        if (score <= 17) return 2;
        return 3;
    }

    public int getConstitutionModifier() {
        return attributeModifier(constitution);
    }
}
