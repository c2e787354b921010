package com.tony.transferMarket.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class TeamOffersView {
    private List<OfferView> incoming; // offres reçues (club vendeur)
    private List<OfferView> outgoing; // offres faites (club acheteur)
}
