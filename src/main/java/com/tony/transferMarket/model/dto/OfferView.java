package com.tony.transferMarket.model.dto;

import com.tony.transferMarket.model.OfferStatus;
import com.tony.transferMarket.model.TransferOffer;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class OfferView {
    private Long id;
    private Long playerId;
    private String playerName;
    private Long sellerTeamId;
    private String sellerTeamName;
    private Long buyerTeamId;
    private String buyerTeamName;
    private Long fee;
    private Long wage;
    private Integer contractYears;
    private OfferStatus status;
    private Long counterFee;
    private Long counterWage;
    private Integer createdRound;
    private Integer expiresRound;
    private Integer respondedRound;

    public static OfferView of(TransferOffer offer) {
        return OfferView.builder()
                .id(offer.getId())
                .playerId(offer.getPlayer().getId())
                .playerName(offer.getPlayer().getName())
                .sellerTeamId(offer.getSellerTeamId())
                .sellerTeamName(offer.getSellerTeam() != null ? offer.getSellerTeam().getName() : null)
                .buyerTeamId(offer.getBuyerTeam().getId())
                .buyerTeamName(offer.getBuyerTeam().getName())
                .fee(offer.getFee())
                .wage(offer.getWage())
                .contractYears(offer.getContractYears())
                .status(offer.getStatus())
                .counterFee(offer.getCounterFee())
                .counterWage(offer.getCounterWage())
                .createdRound(offer.getCreatedRound())
                .expiresRound(offer.getExpiresRound())
                .respondedRound(offer.getRespondedRound())
                .build();
    }
}
