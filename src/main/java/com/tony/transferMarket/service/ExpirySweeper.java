package com.tony.transferMarket.service;

import com.tony.transferMarket.model.OfferStatus;
import com.tony.transferMarket.repository.TransferOfferRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class ExpirySweeper {

    private final TransferOfferRepository offerRepository;

    /**
     * Passe en {@code EXPIRED} les offres en cours dont la journée d'expiration est dépassée.
     * Une offre qui expire à la journée 5 reste valable pendant toute la journée 5.
     *
     * @return le nombre d'offres expirées
     */
    @Transactional
    public int sweep(Long saveId, int currentRound) {
        int expired = offerRepository.expireStale(saveId, OfferStatus.OUTSTANDING, OfferStatus.EXPIRED, currentRound);
        if (expired > 0) {
            log.info("⌛ {} offre(s) expirée(s) (partie {}, journée {})", expired, saveId, currentRound);
        }
        return expired;
    }
}
