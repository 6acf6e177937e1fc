package com.acks.controller;

import com.acks.dto.AddMemberRequest;
import com.acks.dto.AllocateXpRequest;
import com.acks.dto.AllocationResult;
import com.acks.dto.CreatePartyRequest;
import com.acks.dto.PartyDTO;
import com.acks.model.Party;
import com.acks.service.PartyLedgerService;
import com.acks.service.ViewerRoleResolver;
import com.acks.websocket.StateBroadcaster;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

import static com.acks.controller.MapController.DM_TOKEN_HEADER;

/**
 * REST API for parties and their XP pool.
 */
@RestController
@RequestMapping("/api/parties")
@RequiredArgsConstructor
@Slf4j
public class PartyController {

    private final PartyLedgerService partyLedgerService;
    private final ViewerRoleResolver viewerRoleResolver;
    private final StateBroadcaster stateBroadcaster;

    @GetMapping
    public ResponseEntity<List<PartyDTO>> listParties() {
        return ResponseEntity.ok(partyLedgerService.listParties().stream()
                .map(PartyDTO::from)
                .toList());
    }

    @GetMapping("/{partyId}")
    public ResponseEntity<PartyDTO> getParty(@PathVariable String partyId) {
        return ResponseEntity.ok(PartyDTO.from(partyLedgerService.getParty(partyId)));
    }

    @PostMapping
    public ResponseEntity<PartyDTO> createParty(@Valid @RequestBody CreatePartyRequest request,
                                                @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        viewerRoleResolver.requireDm(null, dmToken);
        Party party = partyLedgerService.createParty(request.getId(), request.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(PartyDTO.from(party));
    }

    @PostMapping("/{partyId}/members")
    public ResponseEntity<PartyDTO> addMember(@PathVariable String partyId,
                                              @Valid @RequestBody AddMemberRequest request,
                                              @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        viewerRoleResolver.requireDm(null, dmToken);
        Party party = partyLedgerService.addMember(partyId, request.getCharacterId(), request.getRole());
        stateBroadcaster.broadcastPartyUpdate(party);
        return ResponseEntity.ok(PartyDTO.from(party));
    }

    @DeleteMapping("/{partyId}/members/{characterId}")
    public ResponseEntity<PartyDTO> removeMember(@PathVariable String partyId,
                                                 @PathVariable String characterId,
                                                 @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        viewerRoleResolver.requireDm(null, dmToken);
        Party party = partyLedgerService.removeMember(partyId, characterId);
        stateBroadcaster.broadcastPartyUpdate(party);
        return ResponseEntity.ok(PartyDTO.from(party));
    }

    /**
     * A suggested distribution of {@code amount} pending XP; nothing is changed.
     */
    @GetMapping("/{partyId}/split")
    public ResponseEntity<Map<String, Long>> proposeSplit(@PathVariable String partyId,
                                                          @RequestParam long amount) {
        return ResponseEntity.ok(partyLedgerService.proposeSplit(partyId, amount));
    }

    @PostMapping("/{partyId}/allocate")
    public ResponseEntity<AllocationResult> allocate(@PathVariable String partyId,
                                                     @Valid @RequestBody AllocateXpRequest request,
                                                     @RequestHeader(value = DM_TOKEN_HEADER, required = false) String dmToken) {
        viewerRoleResolver.requireDm(null, dmToken);
        AllocationResult result = partyLedgerService.allocate(partyId, request.getDistribution());
        stateBroadcaster.broadcastPartyUpdate(partyLedgerService.getParty(partyId));
        return ResponseEntity.ok(result);
    }
}
