package com.acks.controller;

import com.acks.dto.DmOverrideRequest;
import com.acks.dto.FightView;
import com.acks.dto.ResolutionResult;
import com.acks.model.CombatAction;
import com.acks.model.ViewerRole;
import com.acks.service.FightService;
import com.acks.service.ViewerRoleResolver;
import com.acks.websocket.MapViewFilter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import static com.acks.controller.MapController.DM_TOKEN_HEADER;

/**
 * REST API the DM uses to run fights from outside a STOMP session.
 */
@RestController
@RequestMapping("/api/fights")
@RequiredArgsConstructor
@Slf4j
public class FightController {

    private final FightService fightService;
    private final ViewerRoleResolver viewerRoleResolver;

    @GetMapping("/{fightId}")
    public ResponseEntity<FightView> getFight(@PathVariable String fightId,
                                              @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        ViewerRole dm = viewerRoleResolver.requireDm(null, dmToken);
        return ResponseEntity.ok(MapViewFilter.forRole(dm).projectFight(fightService.getFight(fightId)));
    }

    @PostMapping("/{fightId}/actions")
    public ResponseEntity<ResolutionResult> submitAction(@PathVariable String fightId,
                                                         @RequestParam(defaultValue = "false") boolean force,
                                                         @RequestBody CombatAction action,
                                                         @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        ViewerRole dm = viewerRoleResolver.requireDm(null, dmToken);
        log.debug("DM action {} in fight {} (force={})", action.getType(), fightId, force);
        return ResponseEntity.ok(fightService.submitAction(fightId, dm, action, force));
    }

    @PostMapping("/{fightId}/overrides")
    public ResponseEntity<ResolutionResult> override(@PathVariable String fightId,
                                                     @Valid @RequestBody DmOverrideRequest request,
                                                     @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        ViewerRole dm = viewerRoleResolver.requireDm(null, dmToken);
        log.debug("DM override {} in fight {}", request.getKind(), fightId);
        return ResponseEntity.ok(fightService.dmOverride(fightId, dm, request));
    }
}
