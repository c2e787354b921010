package com.tony.transferMarket.repository;

import com.tony.transferMarket.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface TeamRepository extends JpaRepository<Team, Long> {

    List<Team> findBySaveId(Long saveId);

    // Tous les clubs IA d'une partie (= tous sauf le club humain)
    @Query("SELECT t FROM Team t WHERE t.save.id = :saveId AND t.id <> :humanTeamId ORDER BY t.id")
    List<Team> findAiTeams(@Param("saveId") Long saveId, @Param("humanTeamId") Long humanTeamId);

    // Budget ET trésorerie bougent ensemble (crédit si delta > 0, débit sinon)
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Team t SET t.budget = t.budget + :delta, t.balance = t.balance + :delta WHERE t.id = :teamId")
    int adjustFinances(@Param("teamId") Long teamId, @Param("delta") long delta);
}
