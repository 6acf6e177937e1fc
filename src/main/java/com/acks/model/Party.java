package com.acks.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * A group of adventurers sharing a pool of XP that has been earned but not yet handed out.
 */
@Entity
@Table(name = "parties")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Party {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private long pendingXp;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "party_members", joinColumns = @JoinColumn(name = "party_id"))
    @Builder.Default
    private Set<PartyMember> members = new LinkedHashSet<>();

    @Version
    private Long version;

    public Optional<PartyMember> findMember(String characterId) {
        return members.stream()
                .filter(m -> m.getCharacterId().equals(characterId))
                .findFirst();
    }

    public boolean hasMember(String characterId) {
        return findMember(characterId).isPresent();
    }
}
