package com.acks.controller;

import com.acks.exception.IllegalActionException;
import com.acks.exception.NotFoundException;
import com.acks.model.CharacterSheet;
import com.acks.model.FightRef;
import com.acks.service.CharacterSheetStore;
import com.acks.service.ViewerRoleResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

import static com.acks.controller.MapController.DM_TOKEN_HEADER;
import static com.acks.controller.MapController.USER_HEADER;

/**
 * Read access to character records and a DM import endpoint, so a campaign can be set up
 * without a separate character tool. A sheet is readable by the DM and by the player named as
 * its owner.
 */
@RestController
@RequestMapping("/api/characters")
@RequiredArgsConstructor
@Slf4j
public class CharacterController {

    private final CharacterSheetStore characterSheetStore;
    private final ViewerRoleResolver viewerRoleResolver;

    @GetMapping("/{characterId}")
    public ResponseEntity<CharacterSheet> getCharacter(@PathVariable String characterId,
                                                       @RequestHeader(value = USER_HEADER, required = false) String user,
                                                       @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        CharacterSheet sheet = characterSheetStore.getCharacter(characterId);
        requireOwnerOrDm(sheet.getOwnerUsername(), user, dmToken);
        return ResponseEntity.ok(sheet);
    }

    @GetMapping
    public ResponseEntity<List<CharacterSheet>> findByOwner(@RequestParam String owner,
                                                            @RequestHeader(value = USER_HEADER, required = false) String user,
                                                            @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        requireOwnerOrDm(owner, user, dmToken);
        return ResponseEntity.ok(characterSheetStore.findByOwner(owner));
    }

    @PutMapping("/{characterId}")
    public ResponseEntity<CharacterSheet> importCharacter(@PathVariable String characterId,
                                                          @RequestBody CharacterSheet sheet,
                                                          @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        viewerRoleResolver.requireDm(null, dmToken);
        FightRef.requireValidId("character", characterId);
        sheet.setId(characterId);
        existing(characterId).ifPresent(stored -> {
            // Banked XP is earned in play; a re-import must not reset it.
            sheet.setBankedXp(stored.getBankedXp());
            sheet.setVersion(stored.getVersion());
        });
        log.info("Importing character {} ({}) for {}", characterId, sheet.getName(), sheet.getOwnerUsername());
        return ResponseEntity.ok(characterSheetStore.saveCharacter(sheet));
    }

    private void requireOwnerOrDm(String owner, String user, String dmToken) {
        if (dmToken != null) {
            viewerRoleResolver.requireDm(user, dmToken);
            return;
        }
        if (user == null || user.isBlank() || !user.equals(owner)) {
            throw new IllegalActionException("Character sheets are only readable by their owner or the DM");
        }
    }

    private Optional<CharacterSheet> existing(String characterId) {
        try {
            return Optional.of(characterSheetStore.getCharacter(characterId));
        } catch (NotFoundException e) {
            return Optional.empty();
        }
    }
}
