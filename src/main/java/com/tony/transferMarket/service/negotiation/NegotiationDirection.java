package com.tony.transferMarket.service.negotiation;

public enum NegotiationDirection {
    // Le club humain achète
    OUTGOING,
    // Une IA a fait une offre sur un joueur du club humain
    INCOMING
}
