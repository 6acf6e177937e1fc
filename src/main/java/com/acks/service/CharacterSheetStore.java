package com.acks.service;

import com.acks.model.CharacterSheet;

import java.util.List;

/**
 * Narrow boundary to the character records. The campaign engine reads whole sheets but writes
 * only through {@link CharacterMutation}s.
 */
public interface CharacterSheetStore {

    /**
     * @throws com.acks.exception.NotFoundException if no such character exists
     */
    CharacterSheet getCharacter(String characterId);

    /**
     * Apply one mutation and persist it.
     *
     * @return the record as it was before the mutation
     * @throws com.acks.exception.NotFoundException if no such character exists
     * @throws com.acks.exception.PersistenceFailureException if the write failed
     */
    CharacterSheet updateCharacter(String characterId, CharacterMutation mutation);

    List<CharacterSheet> findByOwner(String username);

    CharacterSheet saveCharacter(CharacterSheet sheet);
}
