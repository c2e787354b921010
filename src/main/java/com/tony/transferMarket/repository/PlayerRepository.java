package com.tony.transferMarket.repository;

import com.tony.transferMarket.model.Player;
import com.tony.transferMarket.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface PlayerRepository extends JpaRepository<Player, Long> {

    // team_Id : la propriété team.id, pas le getter utilitaire Player#getTeamId
    List<Player> findBySaveIdAndTeam_IdIn(Long saveId, Collection<Long> teamIds);

    // Joueurs libres = sans club
    List<Player> findBySaveIdAndTeamIsNull(Long saveId);

    long countByTeam_Id(Long teamId);

    @Query("SELECT COALESCE(SUM(p.wage), 0) FROM Player p WHERE p.team.id = :teamId")
    long sumWagesByTeamId(@Param("teamId") Long teamId);

    // Mise à jour gardée : le joueur doit encore appartenir au club vendeur
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Player p SET p.team = :team, p.wage = :wage, p.contractEndSeason = :contractEnd, p.morale = :morale " +
            "WHERE p.id = :playerId AND p.team.id = :fromTeamId")
    int reassign(@Param("playerId") Long playerId,
                 @Param("fromTeamId") Long fromTeamId,
                 @Param("team") Team team,
                 @Param("wage") long wage,
                 @Param("contractEnd") int contractEnd,
                 @Param("morale") int morale);

    // Même chose pour un joueur libre : il doit l'être encore
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Player p SET p.team = :team, p.wage = :wage, p.contractEndSeason = :contractEnd, p.morale = :morale " +
            "WHERE p.id = :playerId AND p.team IS NULL")
    int signFreeAgent(@Param("playerId") Long playerId,
                      @Param("team") Team team,
                      @Param("wage") long wage,
                      @Param("contractEnd") int contractEnd,
                      @Param("morale") int morale);

    // Libération : le joueur quitte son club et rejoint les joueurs libres
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Player p SET p.team = NULL WHERE p.id = :playerId AND p.team.id = :fromTeamId")
    int release(@Param("playerId") Long playerId, @Param("fromTeamId") Long fromTeamId);
}
