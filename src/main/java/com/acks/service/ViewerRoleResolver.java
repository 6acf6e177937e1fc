package com.acks.service;

import com.acks.exception.IllegalActionException;
import com.acks.exception.ValidationException;
import com.acks.model.CharacterSheet;
import com.acks.model.ViewerRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides who a client is. A client that presents the configured DM token is the DM; anyone
 * else is a player controlling the characters they own.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ViewerRoleResolver {

    public static final String DM_ROLE = "DM";

    private final CharacterSheetStore characterSheetStore;

    @Value("${campaign.dm.token:}")
    private String dmToken = "";

    /**
     * @param requestedRole {@code DM} or {@code PLAYER}; null means player
     * @param token         the DM token, only checked when the DM role is requested
     */
    public ViewerRole resolve(String username, String requestedRole, String token) {
        if (username == null || username.isBlank()) {
            throw new ValidationException("A username is required");
        }
        if (DM_ROLE.equalsIgnoreCase(requestedRole)) {
            return requireDm(username, token);
        }
        Set<String> characterIds = characterSheetStore.findByOwner(username).stream()
                .map(CharacterSheet::getId)
                .collect(Collectors.toSet());
        return new ViewerRole.Player(username, characterIds);
    }

    public ViewerRole.DungeonMaster requireDm(String username, String token) {
        if (!isDmToken(token)) {
            log.warn("Rejected DM access for '{}'", username);
            throw new IllegalActionException("DM access requires a valid DM token");
        }
        return new ViewerRole.DungeonMaster(username == null || username.isBlank() ? DM_ROLE : username);
    }

    private boolean isDmToken(String token) {
        if (dmToken == null || dmToken.isEmpty() || token == null) {
            return false;
        }
        return MessageDigest.isEqual(dmToken.getBytes(StandardCharsets.UTF_8), token.getBytes(StandardCharsets.UTF_8));
    }
}
