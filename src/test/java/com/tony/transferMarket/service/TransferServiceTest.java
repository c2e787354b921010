package com.tony.transferMarket.service;

import com.tony.transferMarket.exception.AuthorizationException;
import com.tony.transferMarket.exception.ConflictException;
import com.tony.transferMarket.exception.ValidationException;
import com.tony.transferMarket.model.*;
import com.tony.transferMarket.model.dto.*;
import com.tony.transferMarket.repository.TransactionRepository;
import com.tony.transferMarket.repository.TransferListingRepository;
import com.tony.transferMarket.support.MarketJpaTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransferServiceTest extends MarketJpaTest {

    @Autowired
    private TransferService transferService;
    @Autowired
    private TransferListingRepository listingRepository;
    @Autowired
    private TransactionRepository transactionRepository;

    private GameSave save;
    private Team human;
    private Team aiSeller;
    private Team aiBuyer;

    @BeforeEach
    void setUp() {
        save = fixture.save(2026, 4);
        human = fixture.humanTeam(save, "FC Lumière", 62, 30_000_000L, 1_500_000L);
        aiSeller = fixture.team(save, "AS Montagne", 55, 18_000_000L, 1_400_000L);
        aiBuyer = fixture.team(save, "Olympique Riviera", 70, 45_000_000L, 2_000_000L);
    }

    @Nested
    @DisplayName("Libérations")
    class Releases {

        private Player substitute;

        @BeforeEach
        void setUpSubstitute() {
            // 30 ans, note 60, deux saisons restantes, aucun temps de jeu : 20 000 × 38 × 2 × 0.6
            substitute = fixture.player(save, human, "Yanis Roche", Position.MID, 30, 60);
            Player managed = em.find(Player.class, substitute.getId());
            managed.setContractEndSeason(2028);
            em.flush();
        }

        @Test
        @DisplayName("Le devis de libération est calculé pour un joueur du club")
        void quotesReleaseFee() {
            ReleaseFeeQuote quote = transferService.getReleaseFeeQuote(save.getId(), substitute.getId(), human.getId());

            assertThat(quote.getFee()).isEqualTo(912_000L);
            assertThat(quote.getYearsRemaining()).isEqualTo(2);
            assertThat(quote.getPlayerId()).isEqualTo(substitute.getId());
        }

        @Test
        @DisplayName("Libérer un joueur le rend libre, débite l'indemnité et nettoie annonce et offres")
        void releasesToFreeAgency() {
            // ARRANGE
            fixture.listing(save, substitute, 2_000_000L, 3);
            TransferOffer pending = fixture.offer(save, substitute, aiBuyer, 1_000_000L, 20_000L, OfferStatus.PENDING, 4, 7);
            TransferOffer accepted = fixture.offer(save, substitute, aiSeller, 1_500_000L, 20_000L, OfferStatus.ACCEPTED, 4, 7);

            // ACT
            ReleaseFeeQuote quote = transferService.releasePlayerToFreeAgency(save.getId(), substitute.getId(), human.getId());

            // ASSERT
            assertThat(quote.getFee()).isEqualTo(912_000L);
            assertThat(fixture.reload(Player.class, substitute.getId()).isFreeAgent()).isTrue();
            Team club = em.find(Team.class, human.getId());
            assertThat(club.getBudget()).isEqualTo(29_088_000L);
            assertThat(club.getBalance()).isEqualTo(29_088_000L);
            assertThat(transactionRepository.findBySaveId(save.getId()))
                    .singleElement()
                    .satisfies(t -> {
                        assertThat(t.getCategory()).isEqualTo(Transaction.CATEGORY_PLAYER_RELEASE);
                        assertThat(t.getType()).isEqualTo(TransactionType.EXPENSE);
                        assertThat(t.getAmount()).isEqualTo(912_000L);
                    });
            assertThat(listingRepository.existsBySaveIdAndPlayerId(save.getId(), substitute.getId())).isFalse();
            assertThat(em.find(TransferOffer.class, pending.getId()).getStatus()).isEqualTo(OfferStatus.CANCELLED);
            assertThat(em.find(TransferOffer.class, accepted.getId()).getStatus()).isEqualTo(OfferStatus.CANCELLED);
        }

        @Test
        @DisplayName("Sans trésorerie suffisante, la libération est refusée")
        void rejectsWhenCashIsShort() {
            Team club = em.find(Team.class, human.getId());
            club.setBalance(100_000L);
            em.flush();

            assertThatThrownBy(() -> transferService.releasePlayerToFreeAgency(save.getId(), substitute.getId(), human.getId()))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("need 912000, have 100000");
            assertThat(fixture.reload(Player.class, substitute.getId()).getTeamId()).isEqualTo(human.getId());
        }

        @Test
        @DisplayName("Seuls les joueurs du club humain peuvent être libérés")
        void rejectsOtherClubsPlayers() {
            Player other = fixture.player(save, aiSeller, "Léo Marchand", Position.ATT, 25, 66);

            assertThatThrownBy(() -> transferService.releasePlayerToFreeAgency(save.getId(), other.getId(), human.getId()))
                    .isInstanceOf(AuthorizationException.class);
            assertThatThrownBy(() -> transferService.releasePlayerToFreeAgency(save.getId(), other.getId(), aiSeller.getId()))
                    .isInstanceOf(AuthorizationException.class);
        }
    }

    @Nested
    @DisplayName("Annonces")
    class Listings {

        @Test
        @DisplayName("Sans prix fourni, l'annonce reprend le prix de valorisation")
        void listsAtValuationPrice() {
            Player player = fixture.player(save, human, "Noah Vidal", Position.MID, 26, 68);

            Long listingId = transferService.listPlayerForSale(save.getId(), player.getId(), human.getId(), null);

            TransferListing listing = listingRepository.findById(listingId).orElseThrow();
            assertThat(listing.getAskingPrice()).isEqualTo(10_000_000L);
            assertThat(listing.getStatus()).isEqualTo(ListingStatus.AVAILABLE);
            assertThat(listing.getListedRound()).isEqualTo(4);
        }

        @Test
        @DisplayName("Un contrat finissant est signalé sur l'annonce")
        void flagsExpiringContract() {
            Player player = fixture.player(save, human, "Noah Vidal", Position.MID, 26, 68);
            Player managed = em.find(Player.class, player.getId());
            managed.setContractEndSeason(2027);
            em.flush();

            Long listingId = transferService.listPlayerForSale(save.getId(), player.getId(), human.getId(), 4_000_000L);

            TransferListing listing = listingRepository.findById(listingId).orElseThrow();
            assertThat(listing.getStatus()).isEqualTo(ListingStatus.CONTRACT_EXPIRING);
            assertThat(listing.getAskingPrice()).isEqualTo(4_000_000L);
        }

        @Test
        @DisplayName("Un joueur ne peut être listé qu'une fois")
        void secondListingConflicts() {
            Player player = fixture.player(save, human, "Noah Vidal", Position.MID, 26, 68);
            transferService.listPlayerForSale(save.getId(), player.getId(), human.getId(), null);

            assertThatThrownBy(() -> transferService.listPlayerForSale(save.getId(), player.getId(), human.getId(), null))
                    .isInstanceOf(ConflictException.class)
                    .hasMessage("already listed");
        }

        @Test
        @DisplayName("Impossible de lister le joueur d'un autre club")
        void cannotListForeignPlayer() {
            Player player = fixture.player(save, aiSeller, "Sacha Morel", Position.ATT, 24, 66);

            assertThatThrownBy(() -> transferService.listPlayerForSale(save.getId(), player.getId(), human.getId(), null))
                    .isInstanceOf(AuthorizationException.class);
            assertThatThrownBy(() -> transferService.listPlayerForSale(save.getId(), player.getId(), aiSeller.getId(), null))
                    .isInstanceOf(AuthorizationException.class);
        }

        @Test
        @DisplayName("Retrait d'une annonce par son club")
        void removesOwnListing() {
            Player player = fixture.player(save, human, "Noah Vidal", Position.MID, 26, 68);
            transferService.listPlayerForSale(save.getId(), player.getId(), human.getId(), null);

            transferService.removeListing(save.getId(), player.getId(), human.getId());

            assertThat(transferService.getTeamListings(save.getId(), human.getId())).isEmpty();
        }

        @Test
        @DisplayName("Le marché exclut les annonces du club demandeur et liste les joueurs libres")
        void marketExcludesOwnListings() {
            Player own = fixture.player(save, human, "Noah Vidal", Position.MID, 26, 68);
            Player weak = fixture.player(save, aiSeller, "Sacha Morel", Position.ATT, 24, 60);
            Player strong = fixture.player(save, aiSeller, "Enzo Caron", Position.DEF, 27, 72);
            fixture.player(save, null, "Hugo Marchal", Position.DEF, 30, 64);
            fixture.listing(save, own, 5_000_000L, 3);
            fixture.listing(save, weak, 5_000_000L, 3);
            fixture.listing(save, strong, 5_000_000L, 3);

            MarketView market = transferService.getMarket(save.getId(), human.getId());

            assertThat(market.getListed()).extracting(ListingView::getPlayerName)
                    .containsExactly("Enzo Caron", "Sacha Morel");
            assertThat(market.getFreeAgents()).extracting(PlayerView::getName).containsExactly("Hugo Marchal");
        }
    }

    @Nested
    @DisplayName("Offres du club humain")
    class HumanOffers {

        @Test
        @DisplayName("Une offre au prix demandé est acceptée sur-le-champ par le vendeur IA")
        void aiSellerAcceptsAskingPrice() {
            Player player = fixture.player(save, aiSeller, "Sacha Morel", Position.ATT, 26, 66);
            fixture.listing(save, player, 9_000_000L, 2);

            OfferOutcome outcome = transferService.makeOffer(save.getId(), player.getId(), aiSeller.getId(),
                    human.getId(), 9_000_000L, 25_000L, 3);

            assertThat(outcome.getAiResponse().getAction()).isEqualTo("accept");
            assertThat(em.find(TransferOffer.class, outcome.getOfferId()).getStatus()).isEqualTo(OfferStatus.ACCEPTED);
        }

        @Test
        @DisplayName("Une offre proche déclenche une contre-proposition au point milieu")
        void aiSellerCountersCloseOffer() {
            Player player = fixture.player(save, aiSeller, "Sacha Morel", Position.ATT, 26, 66);
            fixture.listing(save, player, 10_000_000L, 2);

            OfferOutcome outcome = transferService.makeOffer(save.getId(), player.getId(), aiSeller.getId(),
                    human.getId(), 7_000_000L, 25_000L, 3);

            assertThat(outcome.getAiResponse().getAction()).isEqualTo("counter");
            assertThat(outcome.getAiResponse().getCounterFee()).isEqualTo(8_500_000L);
            assertThat(outcome.getAiResponse().getCounterWage()).isEqualTo(25_000L);

            TransferOffer offer = em.find(TransferOffer.class, outcome.getOfferId());
            assertThat(offer.getStatus()).isEqualTo(OfferStatus.COUNTER);
            assertThat(offer.getRespondedRound()).isEqualTo(4);
        }

        @Test
        @DisplayName("Contre-proposition acceptée puis transfert finalisé")
        void acceptCounterThenComplete() {
            Player player = fixture.player(save, aiSeller, "Sacha Morel", Position.ATT, 26, 66);
            fixture.listing(save, player, 10_000_000L, 2);
            OfferOutcome outcome = transferService.makeOffer(save.getId(), player.getId(), aiSeller.getId(),
                    human.getId(), 7_000_000L, 25_000L, 3);

            OfferView accepted = transferService.acceptCounterOffer(save.getId(), outcome.getOfferId());
            assertThat(accepted.getStatus()).isEqualTo(OfferStatus.ACCEPTED);
            assertThat(accepted.getFee()).isEqualTo(8_500_000L);

            String transferId = transferService.completeTransfer(save.getId(), outcome.getOfferId());

            assertThat(transferId).isNotBlank();
            assertThat(fixture.reload(Player.class, player.getId()).getTeamId()).isEqualTo(human.getId());
            assertThat(em.find(Team.class, human.getId()).getBudget()).isEqualTo(21_500_000L);
        }

        @Test
        @DisplayName("Une seule offre en cours par joueur et par acheteur")
        void duplicateOutstandingOfferConflicts() {
            Player player = fixture.player(save, aiSeller, "Sacha Morel", Position.ATT, 26, 66);
            fixture.listing(save, player, 10_000_000L, 2);
            transferService.makeOffer(save.getId(), player.getId(), aiSeller.getId(), human.getId(), 7_000_000L, 25_000L, 3);

            assertThatThrownBy(() -> transferService.makeOffer(save.getId(), player.getId(), aiSeller.getId(),
                    human.getId(), 7_500_000L, 25_000L, 3))
                    .isInstanceOf(ConflictException.class);
        }

        @Test
        @DisplayName("Une offre trop basse est refusée")
        void lowballIsRejected() {
            Player player = fixture.player(save, aiSeller, "Sacha Morel", Position.ATT, 26, 66);
            fixture.listing(save, player, 10_000_000L, 2);

            OfferOutcome outcome = transferService.makeOffer(save.getId(), player.getId(), aiSeller.getId(),
                    human.getId(), 3_000_000L, 25_000L, 3);

            assertThat(outcome.getAiResponse().getAction()).isEqualTo("reject");
        }

        @Test
        @DisplayName("Un joueur libre accepte un salaire à la hauteur de ses attentes, sans indemnité")
        void freeAgentAcceptsFairWage() {
            Player freeAgent = fixture.player(save, null, "Hugo Marchal", Position.DEF, 30, 64);

            OfferOutcome outcome = transferService.makeOffer(save.getId(), freeAgent.getId(), null, human.getId(),
                    5_000_000L, 14_000L, 3);

            assertThat(outcome.getAiResponse().getAction()).isEqualTo("accept");
            TransferOffer offer = em.find(TransferOffer.class, outcome.getOfferId());
            assertThat(offer.getFee()).isZero();
            assertThat(offer.getStatus()).isEqualTo(OfferStatus.ACCEPTED);
        }

        @Test
        @DisplayName("Le joueur doit toujours appartenir au club visé")
        void playerMovedAway() {
            Player player = fixture.player(save, aiBuyer, "Sacha Morel", Position.ATT, 26, 66);

            assertThatThrownBy(() -> transferService.makeOffer(save.getId(), player.getId(), aiSeller.getId(),
                    human.getId(), 7_000_000L, 25_000L, 3))
                    .isInstanceOf(ConflictException.class);
        }

        @Test
        @DisplayName("Durée de contrat hors bornes refusée")
        void invalidContractLength() {
            Player player = fixture.player(save, aiSeller, "Sacha Morel", Position.ATT, 26, 66);

            assertThatThrownBy(() -> transferService.makeOffer(save.getId(), player.getId(), aiSeller.getId(),
                    human.getId(), 7_000_000L, 25_000L, 6))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Offres reçues par le club humain")
    class IncomingOffers {

        @Test
        @DisplayName("Le vendeur humain peut contre-proposer puis l'offre apparaît côté reçu")
        void humanCounters() {
            Player player = fixture.player(save, human, "Noah Vidal", Position.MID, 26, 68);
            TransferOffer offer = fixture.offer(save, player, aiBuyer, 6_000_000L, 28_000L, OfferStatus.PENDING, 4, 7);

            OfferView view = transferService.respondToOffer(save.getId(), offer.getId(), "counter", 9_000_000L, 30_000L);

            assertThat(view.getStatus()).isEqualTo(OfferStatus.COUNTER);
            assertThat(view.getCounterFee()).isEqualTo(9_000_000L);

            TeamOffersView offers = transferService.getTeamOffers(save.getId(), human.getId());
            assertThat(offers.getIncoming()).extracting(OfferView::getId).containsExactly(offer.getId());
            assertThat(offers.getOutgoing()).isEmpty();
        }

        @Test
        @DisplayName("Refus d'une offre reçue")
        void humanRejects() {
            Player player = fixture.player(save, human, "Noah Vidal", Position.MID, 26, 68);
            TransferOffer offer = fixture.offer(save, player, aiBuyer, 6_000_000L, 28_000L, OfferStatus.PENDING, 4, 7);

            OfferView view = transferService.respondToOffer(save.getId(), offer.getId(), "REJECT", null, null);

            assertThat(view.getStatus()).isEqualTo(OfferStatus.REJECTED);
        }

        @Test
        @DisplayName("Action inconnue ou contre-proposition incomplète")
        void invalidResponses() {
            Player player = fixture.player(save, human, "Noah Vidal", Position.MID, 26, 68);
            TransferOffer offer = fixture.offer(save, player, aiBuyer, 6_000_000L, 28_000L, OfferStatus.PENDING, 4, 7);

            assertThatThrownBy(() -> transferService.respondToOffer(save.getId(), offer.getId(), "maybe", null, null))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> transferService.respondToOffer(save.getId(), offer.getId(), "counter", 9_000_000L, null))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Seul le club vendeur peut répondre")
        void onlySellerResponds() {
            Player player = fixture.player(save, aiSeller, "Sacha Morel", Position.ATT, 26, 66);
            TransferOffer offer = fixture.offer(save, player, aiBuyer, 6_000_000L, 28_000L, OfferStatus.PENDING, 4, 7);

            assertThatThrownBy(() -> transferService.respondToOffer(save.getId(), offer.getId(), "accept", null, null))
                    .isInstanceOf(AuthorizationException.class);
        }
    }

    @Test
    @DisplayName("Le diagnostic ventile annonces et offres de la partie")
    void diagnosticsGroupListingsAndOffers() {
        // ARRANGE
        Player youngster = fixture.player(save, aiSeller, "Léo Marchand", Position.ATT, 22, 66);
        Player veteran = fixture.player(save, aiSeller, "Paul Girard", Position.DEF, 32, 64);
        fixture.listing(save, youngster, 8_000_000L, 4);
        fixture.listing(save, veteran, 3_000_000L, 0);
        fixture.offer(save, youngster, human, 7_000_000L, 40_000L, OfferStatus.PENDING, 4, 7);
        TransferOffer answered = fixture.offer(save, veteran, human, 1_000_000L, 20_000L, OfferStatus.REJECTED, 3, 6);
        TransferOffer managed = em.find(TransferOffer.class, answered.getId());
        managed.setRespondedRound(4);
        em.flush();

        // ACT
        MarketDiagnostics diagnostics = transferService.getDiagnostics(save.getId());

        // ASSERT
        assertThat(diagnostics.getTotalListings()).isEqualTo(2);
        assertThat(diagnostics.getListingsByAge()).containsEntry("u24", 1).containsEntry("30+", 1);
        assertThat(diagnostics.getListingsByDuration()).containsEntry("<3", 1).containsEntry("3-6", 1);
        assertThat(diagnostics.getOffersByStatus()).containsEntry("pending", 1L).containsEntry("rejected", 1L);
        assertThat(diagnostics.getAiResponsesThisRound()).isEqualTo(1);
    }
}
