package com.tony.transferMarket.service.mutation;

import com.tony.transferMarket.model.OfferStatus;

/**
 * Changement de statut gardé : ne s'applique que si l'offre est encore dans le statut {@code expected}.
 * Les termes optionnels remplacent ceux de l'offre (accord, relance) ou posent une contre-proposition.
 */
public record SetOfferStatus(Long offerId, OfferStatus expected, OfferStatus target, Integer round,
                             Long fee, Long wage, Long counterFee, Long counterWage) implements MarketMutation {

    public static SetOfferStatus respond(Long offerId, OfferStatus expected, OfferStatus target, int round) {
        return new SetOfferStatus(offerId, expected, target, round, null, null, null, null);
    }

    public static SetOfferStatus accept(Long offerId, OfferStatus expected, long fee, long wage, int round) {
        return new SetOfferStatus(offerId, expected, OfferStatus.ACCEPTED, round, fee, wage, null, null);
    }

    public static SetOfferStatus counter(Long offerId, OfferStatus expected, long counterFee, long counterWage, int round) {
        return new SetOfferStatus(offerId, expected, OfferStatus.COUNTER, round, null, null, counterFee, counterWage);
    }

    // Nouvelle offre de l'acheteur en réponse à une contre-proposition
    public static SetOfferStatus rebid(Long offerId, long fee, long wage, int round) {
        return new SetOfferStatus(offerId, OfferStatus.COUNTER, OfferStatus.PENDING, round, fee, wage, null, null);
    }

    public static SetOfferStatus complete(Long offerId) {
        return new SetOfferStatus(offerId, OfferStatus.ACCEPTED, OfferStatus.COMPLETED, null, null, null, null, null);
    }

    public boolean hasTerms() {
        return fee != null && wage != null;
    }

    public boolean hasCounterTerms() {
        return counterFee != null && counterWage != null;
    }

    @Override
    public int boundValues() {
        return 4 + (hasTerms() ? 2 : 0) + (hasCounterTerms() ? 2 : 0);
    }
}
