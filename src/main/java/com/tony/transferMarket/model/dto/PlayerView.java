package com.tony.transferMarket.model.dto;

import com.tony.transferMarket.model.Player;
import com.tony.transferMarket.model.Position;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PlayerView {
    private Long id;
    private String name;
    private Position position;
    private Integer age;
    private int overall;
    private Integer potential;
    private Long teamId;
    private String teamName;
    private Long wage;
    private Long marketValue;
    private Integer contractEndSeason;

    public static PlayerView of(Player player, int overall) {
        return PlayerView.builder()
                .id(player.getId())
                .name(player.getName())
                .position(player.getPosition())
                .age(player.getAge())
                .overall(overall)
                .potential(player.getPotential())
                .teamId(player.getTeamId())
                .teamName(player.getTeam() != null ? player.getTeam().getName() : null)
                .wage(player.getWage())
                .marketValue(player.getMarketValue())
                .contractEndSeason(player.getContractEndSeason())
                .build();
    }
}
