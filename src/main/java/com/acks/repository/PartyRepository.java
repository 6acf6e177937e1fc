package com.acks.repository;

import com.acks.model.Party;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for parties.
 */
@Repository
public interface PartyRepository extends JpaRepository<Party, String> {

    @Query("SELECT p FROM Party p JOIN p.members m WHERE m.characterId = :characterId")
    List<Party> findByMemberCharacterId(@Param("characterId") String characterId);

    /** Loads the party with a row lock held until the surrounding transaction ends. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Party p WHERE p.id = :id")
    Optional<Party> findByIdForUpdate(@Param("id") String id);
}
