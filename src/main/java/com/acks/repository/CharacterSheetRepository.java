package com.acks.repository;

import com.acks.model.CharacterSheet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for character sheets.
 */
@Repository
public interface CharacterSheetRepository extends JpaRepository<CharacterSheet, String> {

    List<CharacterSheet> findByOwnerUsername(String ownerUsername);

    List<CharacterSheet> findByPartyId(String partyId);
}
