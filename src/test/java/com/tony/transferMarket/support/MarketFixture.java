package com.tony.transferMarket.support;

import com.tony.transferMarket.model.*;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

/**
 * Construction d'une partie en base pour les tests JPA.
 * Chaque méthode persiste puis flush, les identifiants sont donc disponibles immédiatement.
 */
public class MarketFixture {

    private final TestEntityManager em;

    public MarketFixture(TestEntityManager em) {
        this.em = em;
    }

    public GameSave save(int season, int round) {
        return em.persistFlushFind(new GameSave("Test", season, round));
    }

    public Team team(GameSave save, String name, int reputation, long budget, long wageBudget) {
        return em.persistFlushFind(new Team(save, name, reputation, budget, wageBudget));
    }

    public Team humanTeam(GameSave save, String name, int reputation, long budget, long wageBudget) {
        Team team = team(save, name, reputation, budget, wageBudget);
        GameSave managed = em.find(GameSave.class, save.getId());
        managed.setHumanTeam(team);
        em.flush();
        return team;
    }

    public Player player(GameSave save, Team team, String name, Position position, int age, int rating) {
        Player player = TestPlayers.player(name, position, age, rating);
        player.setSave(em.find(GameSave.class, save.getId()));
        player.setTeam(team != null ? em.find(Team.class, team.getId()) : null);
        return em.persistFlushFind(player);
    }

    public TransferListing listing(GameSave save, Player player, long askingPrice, int listedRound) {
        TransferListing listing = new TransferListing(
                em.find(GameSave.class, save.getId()),
                em.find(Player.class, player.getId()),
                em.find(Team.class, player.getTeamId()),
                askingPrice, ListingStatus.AVAILABLE, listedRound);
        return em.persistFlushFind(listing);
    }

    public TransferOffer offer(GameSave save, Player player, Team buyer, long fee, long wage,
                               OfferStatus status, int createdRound, int expiresRound) {
        TransferOffer offer = new TransferOffer();
        offer.setSave(em.find(GameSave.class, save.getId()));
        offer.setPlayer(em.find(Player.class, player.getId()));
        offer.setSellerTeam(player.getTeamId() != null ? em.find(Team.class, player.getTeamId()) : null);
        offer.setBuyerTeam(em.find(Team.class, buyer.getId()));
        offer.setFee(fee);
        offer.setWage(wage);
        offer.setContractYears(3);
        offer.setStatus(status);
        offer.setCreatedRound(createdRound);
        offer.setExpiresRound(expiresRound);
        return em.persistFlushFind(offer);
    }

    public <T> T reload(Class<T> type, Object id) {
        em.clear();
        return em.find(type, id);
    }
}
