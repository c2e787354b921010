package com.tony.transferMarket.model.dto;

import com.tony.transferMarket.model.ListingStatus;
import com.tony.transferMarket.model.Player;
import com.tony.transferMarket.model.TransferListing;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ListingView {
    private Long id;
    private Long playerId;
    private String playerName;
    private String position;
    private Integer age;
    private int overall;
    private Integer potential;
    private Long teamId;
    private String teamName;
    private Long askingPrice;
    private Long currentWage;
    private ListingStatus status;
    private Integer contractEndSeason;
    private Integer listedRound;

    public static ListingView of(TransferListing listing, int overall) {
        Player player = listing.getPlayer();
        return ListingView.builder()
                .id(listing.getId())
                .playerId(player.getId())
                .playerName(player.getName())
                .position(player.getPosition() != null ? player.getPosition().name() : null)
                .age(player.getAge())
                .overall(overall)
                .potential(player.getPotential())
                .teamId(listing.getTeam().getId())
                .teamName(listing.getTeam().getName())
                .askingPrice(listing.getAskingPrice())
                .currentWage(player.getWage())
                .status(listing.getStatus())
                .contractEndSeason(player.getContractEndSeason())
                .listedRound(listing.getListedRound())
                .build();
    }
}
