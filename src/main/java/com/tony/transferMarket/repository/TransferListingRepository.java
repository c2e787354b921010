package com.tony.transferMarket.repository;

import com.tony.transferMarket.model.TransferListing;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TransferListingRepository extends JpaRepository<TransferListing, Long> {

    List<TransferListing> findBySaveId(Long saveId);

    List<TransferListing> findBySaveIdAndTeamId(Long saveId, Long teamId);

    List<TransferListing> findBySaveIdAndTeamIdIn(Long saveId, Collection<Long> teamIds);

    Optional<TransferListing> findBySaveIdAndPlayerId(Long saveId, Long playerId);

    boolean existsBySaveIdAndPlayerId(Long saveId, Long playerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM TransferListing l WHERE l.save.id = :saveId AND l.player.id = :playerId")
    int deleteBySaveAndPlayer(@Param("saveId") Long saveId, @Param("playerId") Long playerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM TransferListing l WHERE l.save.id = :saveId AND l.player.id = :playerId AND l.team.id = :teamId")
    int deleteOwned(@Param("saveId") Long saveId, @Param("playerId") Long playerId, @Param("teamId") Long teamId);
}
