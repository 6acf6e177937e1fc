package com.acks.service;

import com.acks.exception.ConcurrencyConflictException;
import com.acks.exception.NotFoundException;
import com.acks.exception.PersistenceFailureException;
import com.acks.exception.ValidationException;
import com.acks.model.CharacterSheet;
import com.acks.model.FightRef;
import com.acks.repository.CharacterSheetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class JpaCharacterSheetStore implements CharacterSheetStore {

    private final CharacterSheetRepository characterSheetRepository;

    @Override
    @Transactional(readOnly = true)
    public CharacterSheet getCharacter(String characterId) {
        return characterSheetRepository.findById(characterId)
                .orElseThrow(() -> NotFoundException.of("Character", characterId));
    }

    @Override
    public CharacterSheet updateCharacter(String characterId, CharacterMutation mutation) {
        CharacterSheet sheet = getCharacter(characterId);
        CharacterSheet before = sheet.toBuilder().build();
        mutation.applyTo(sheet);
        try {
            characterSheetRepository.saveAndFlush(sheet);
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("Character " + characterId + " was modified concurrently", e);
        } catch (DataAccessException e) {
            log.error("Could not update character {}", characterId, e);
            throw new PersistenceFailureException("Could not update character " + characterId, e);
        }
        log.debug("Character {} updated: {}", characterId, mutation);
        return before;
    }

    @Override
    @Transactional(readOnly = true)
    public List<CharacterSheet> findByOwner(String username) {
        return characterSheetRepository.findByOwnerUsername(username);
    }

    @Override
    public CharacterSheet saveCharacter(CharacterSheet sheet) {
        FightRef.requireValidId("character", sheet.getId());
        if (sheet.getName() == null || sheet.getName().isBlank()) {
            throw new ValidationException("Character name is required");
        }
        return characterSheetRepository.save(sheet);
    }
}
