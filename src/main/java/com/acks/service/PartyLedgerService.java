package com.acks.service;

import com.acks.dto.AllocationResult;
import com.acks.exception.ConcurrencyConflictException;
import com.acks.exception.NotFoundException;
import com.acks.exception.PersistenceFailureException;
import com.acks.exception.ValidationException;
import com.acks.model.CharacterCondition;
import com.acks.model.CharacterSheet;
import com.acks.model.FightRef;
import com.acks.model.MemberRole;
import com.acks.model.Party;
import com.acks.model.PartyMember;
import com.acks.repository.PartyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The party's pool of earned but unallocated XP. Fights only ever add to the pool; XP reaches a
 * character's sheet through {@link #allocate(String, Map)} and nothing else.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class PartyLedgerService {

    private final PartyRepository partyRepository;
    private final CharacterSheetStore characterSheetStore;

    @Value("${campaign.xp.henchman-share:0.5}")
    private double henchmanShare = 0.5;

    @Transactional(readOnly = true)
    public Party getParty(String partyId) {
        return partyRepository.findById(partyId)
                .orElseThrow(() -> NotFoundException.of("Party", partyId));
    }

    @Transactional(readOnly = true)
    public List<Party> listParties() {
        return partyRepository.findAll();
    }

    @Transactional(readOnly = true)
    public List<Party> partiesOf(String characterId) {
        return partyRepository.findByMemberCharacterId(characterId);
    }

    public Party createParty(String partyId, String name) {
        FightRef.requireValidId("party", partyId);
        if (name == null || name.isBlank()) {
            throw new ValidationException("Party name is required");
        }
        if (partyRepository.existsById(partyId)) {
            throw new ConcurrencyConflictException("Party already exists: " + partyId);
        }
        Party party = save(Party.builder().id(partyId).name(name).build());
        log.info("Created party {} ({})", partyId, name);
        return party;
    }

    public Party addMember(String partyId, String characterId, MemberRole role) {
        characterSheetStore.getCharacter(characterId);
        Party party = lockParty(partyId);
        if (party.hasMember(characterId)) {
            throw new ValidationException("Character " + characterId + " is already in party " + partyId);
        }
        party.getMembers().add(new PartyMember(characterId, role == null ? MemberRole.MEMBER : role));
        log.info("Character {} joined party {} as {}", characterId, partyId, role);
        return save(party);
    }

    public Party removeMember(String partyId, String characterId) {
        Party party = lockParty(partyId);
        PartyMember member = party.findMember(characterId)
                .orElseThrow(() -> NotFoundException.of("Party member", partyId + "/" + characterId));
        party.getMembers().remove(member);
        log.info("Character {} left party {}", characterId, partyId);
        return save(party);
    }

    /**
     * Add XP earned by the party to its pending pool.
     */
    public Party trackPendingXP(String partyId, long amount) {
        if (amount < 0) {
            throw new ValidationException("Pending XP can only grow");
        }
        Party party = lockParty(partyId);
        party.setPendingXp(party.getPendingXp() + amount);
        save(party);
        log.info("Party {} pending XP +{} = {}", partyId, amount, party.getPendingXp());
        return party;
    }

    /**
     * Take back XP added by {@link #trackPendingXP(String, long)} when the change that earned it
     * failed to commit.
     */
    public void revertPendingXP(String partyId, long amount) {
        Party party = lockParty(partyId);
        party.setPendingXp(Math.max(0, party.getPendingXp() - amount));
        save(party);
        log.warn("Party {} pending XP reverted by {}", partyId, amount);
    }

    /**
     * An even split of {@code amount} over the living members, each henchman counting for the
     * configured share of a full member. Rounding leftovers go to full members in id order.
     */
    @Transactional(readOnly = true)
    public Map<String, Long> proposeSplit(String partyId, long amount) {
        Party party = getParty(partyId);
        if (amount < 0 || amount > party.getPendingXp()) {
            throw new ValidationException("Cannot split " + amount + " XP from a pool of " + party.getPendingXp());
        }
        List<PartyMember> living = new ArrayList<>();
        for (PartyMember member : party.getMembers()) {
            if (characterSheetStore.getCharacter(member.getCharacterId()).getCondition() != CharacterCondition.DEAD) {
                living.add(member);
            }
        }
        living.sort(Comparator.comparing(PartyMember::getCharacterId));
        Map<String, Long> split = new LinkedHashMap<>();
        double totalWeight = living.stream().mapToDouble(this::weightOf).sum();
        if (living.isEmpty() || totalWeight <= 0) {
            return split;
        }
        long assigned = 0;
        for (PartyMember member : living) {
            long share = (long) Math.floor(amount * weightOf(member) / totalWeight);
            split.put(member.getCharacterId(), share);
            assigned += share;
        }
        List<PartyMember> takers = living.stream().filter(m -> !m.isHenchman()).toList();
        if (takers.isEmpty()) {
            takers = living;
        }
        for (int i = 0; assigned < amount; i = (i + 1) % takers.size()) {
            split.merge(takers.get(i).getCharacterId(), 1L, Long::sum);
            assigned++;
        }
        return split;
    }

    /**
     * Move XP from the pending pool to members' banked XP. Either every listed character is
     * credited and the pool shrinks by the total, or nothing changes at all.
     */
    public AllocationResult allocate(String partyId, Map<String, Long> distribution) {
        Party party = lockParty(partyId);
        if (distribution == null || distribution.isEmpty()) {
            throw new ValidationException("Distribution is empty");
        }
        long total = 0;
        Map<String, CharacterSheet> recipients = new LinkedHashMap<>();
        for (Map.Entry<String, Long> share : distribution.entrySet()) {
            String characterId = share.getKey();
            if (share.getValue() == null || share.getValue() <= 0) {
                throw new ValidationException("Share for " + characterId + " must be positive");
            }
            if (!party.hasMember(characterId)) {
                throw new ValidationException("Character " + characterId + " is not in party " + partyId);
            }
            CharacterSheet sheet = characterSheetStore.getCharacter(characterId);
            if (sheet.getCondition() == CharacterCondition.DEAD) {
                throw new ValidationException("Character " + characterId + " is dead");
            }
            recipients.put(characterId, sheet);
            total += share.getValue();
        }
        if (total > party.getPendingXp()) {
            throw new ValidationException("Distribution of " + total + " XP exceeds the pending pool of "
                    + party.getPendingXp());
        }

        Deque<Runnable> undo = new ArrayDeque<>();
        Map<String, Long> credited = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, CharacterSheet> recipient : recipients.entrySet()) {
                String characterId = recipient.getKey();
                long share = distribution.get(characterId);
                long withBonus = share + share * recipient.getValue().getXpBonusPercent() / 100;
                CharacterMutation mutation = CharacterMutation.addBankedXp(withBonus);
                CharacterSheet before = characterSheetStore.updateCharacter(characterId, mutation);
                undo.push(() -> characterSheetStore.updateCharacter(characterId, mutation.inverseFor(before)));
                credited.put(characterId, withBonus);
            }
            party.setPendingXp(party.getPendingXp() - total);
            save(party);
        } catch (RuntimeException e) {
            log.error("Allocation for party {} failed, undoing {} credit(s)", partyId, undo.size(), e);
            compensate(undo);
            throw e;
        }

        log.info("Party {} allocated {} XP to {}", partyId, total, credited.keySet());
        return AllocationResult.builder()
                .partyId(partyId)
                .distributed(total)
                .remainingPendingXp(party.getPendingXp())
                .credited(credited)
                .build();
    }

    double weightOf(PartyMember member) {
        return member.isHenchman() ? henchmanShare : 1.0;
    }

    private static void compensate(Deque<Runnable> undo) {
        while (!undo.isEmpty()) {
            try {
                undo.pop().run();
            } catch (RuntimeException e) {
                log.error("Compensation step failed; character XP may need manual correction", e);
            }
        }
    }

    private Party lockParty(String partyId) {
        return partyRepository.findByIdForUpdate(partyId)
                .orElseThrow(() -> NotFoundException.of("Party", partyId));
    }

    private Party save(Party party) {
        try {
            return partyRepository.saveAndFlush(party);
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("Party " + party.getId() + " was modified concurrently", e);
        } catch (DataAccessException e) {
            log.error("Could not save party {}", party.getId(), e);
            throw new PersistenceFailureException("Could not save party " + party.getId(), e);
        }
    }
}
