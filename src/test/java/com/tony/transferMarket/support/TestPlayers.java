package com.tony.transferMarket.support;

import com.tony.transferMarket.model.Player;
import com.tony.transferMarket.model.PlayerAttributes;
import com.tony.transferMarket.model.Position;

/**
 * Joueurs de test dont tous les attributs valent {@code rating} : la note globale vaut donc {@code rating}.
 */
public final class TestPlayers {

    private TestPlayers() {
    }

    public static PlayerAttributes uniform(int rating) {
        return new PlayerAttributes(rating, rating, rating, rating, rating, rating, rating, rating,
                rating, rating, rating, rating, rating, rating, rating);
    }

    public static Player player(String name, Position position, int age, int rating) {
        Player player = new Player();
        player.setName(name);
        player.setPosition(position);
        player.setAge(age);
        player.setPotential(rating);
        player.setAttributes(uniform(rating));
        player.setWage(20_000L);
        player.setMarketValue(10_000_000L);
        player.setContractEndSeason(2030);
        return player;
    }
}
