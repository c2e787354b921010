package com.tony.transferMarket.controller;

import com.tony.transferMarket.model.dto.*;
import com.tony.transferMarket.service.TransferService;
import com.tony.transferMarket.service.negotiation.NegotiationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/saves/{saveId}/transfers")
@RequiredArgsConstructor
public class TransferController {
    private final TransferService transferService;
    private final NegotiationService negotiationService;

    @GetMapping("/market")
    public ResponseEntity<MarketView> getMarket(@PathVariable Long saveId,
                                                @RequestParam(required = false) Long excludeTeamId) {
        return ResponseEntity.ok(transferService.getMarket(saveId, excludeTeamId));
    }

    @GetMapping("/teams/{teamId}/listings")
    public ResponseEntity<List<ListingView>> getTeamListings(@PathVariable Long saveId, @PathVariable Long teamId) {
        return ResponseEntity.ok(transferService.getTeamListings(saveId, teamId));
    }

    @GetMapping("/teams/{teamId}/offers")
    public ResponseEntity<TeamOffersView> getTeamOffers(@PathVariable Long saveId, @PathVariable Long teamId) {
        return ResponseEntity.ok(transferService.getTeamOffers(saveId, teamId));
    }

    // --- Annonces ---

    @PostMapping("/listings")
    public ResponseEntity<Map<String, Long>> listPlayer(@PathVariable Long saveId,
                                                        @Valid @RequestBody ListPlayerRequest request) {
        Long listingId = transferService.listPlayerForSale(saveId, request.getPlayerId(), request.getTeamId(),
                request.getAskingPrice());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("listingId", listingId));
    }

    @DeleteMapping("/listings/{playerId}")
    public ResponseEntity<Void> removeListing(@PathVariable Long saveId, @PathVariable Long playerId,
                                              @RequestParam Long teamId) {
        transferService.removeListing(saveId, playerId, teamId);
        return ResponseEntity.noContent().build();
    }

    // --- Libérations ---

    @GetMapping("/releases/{playerId}/quote")
    public ResponseEntity<ReleaseFeeQuote> getReleaseFeeQuote(@PathVariable Long saveId, @PathVariable Long playerId,
                                                              @RequestParam Long teamId) {
        return ResponseEntity.ok(transferService.getReleaseFeeQuote(saveId, playerId, teamId));
    }

    @PostMapping("/releases")
    public ResponseEntity<ReleaseFeeQuote> releasePlayer(@PathVariable Long saveId,
                                                         @Valid @RequestBody ReleasePlayerRequest request) {
        return ResponseEntity.ok(transferService.releasePlayerToFreeAgency(saveId, request.getPlayerId(),
                request.getTeamId()));
    }

    // --- Offres ---

    @PostMapping("/offers")
    public ResponseEntity<OfferOutcome> makeOffer(@PathVariable Long saveId, @Valid @RequestBody OfferRequest request) {
        OfferOutcome outcome = transferService.makeOffer(saveId, request.getPlayerId(), request.getSellerTeamId(),
                request.getBuyerTeamId(), request.getFee(), request.getWage(), request.getContractYears());
        return ResponseEntity.status(HttpStatus.CREATED).body(outcome);
    }

    @PostMapping("/offers/{offerId}/respond")
    public ResponseEntity<OfferView> respondToOffer(@PathVariable Long saveId, @PathVariable Long offerId,
                                                    @Valid @RequestBody OfferResponseRequest request) {
        return ResponseEntity.ok(transferService.respondToOffer(saveId, offerId, request.getAction(),
                request.getCounterFee(), request.getCounterWage()));
    }

    @PostMapping("/offers/{offerId}/accept-counter")
    public ResponseEntity<OfferView> acceptCounterOffer(@PathVariable Long saveId, @PathVariable Long offerId) {
        return ResponseEntity.ok(transferService.acceptCounterOffer(saveId, offerId));
    }

    @PostMapping("/offers/{offerId}/complete")
    public ResponseEntity<Map<String, String>> completeTransfer(@PathVariable Long saveId, @PathVariable Long offerId) {
        return ResponseEntity.ok(Map.of("transferId", transferService.completeTransfer(saveId, offerId)));
    }

    // --- Négociations ---

    @PostMapping("/negotiations")
    public ResponseEntity<NegotiationResult> negotiate(@PathVariable Long saveId,
                                                       @Valid @RequestBody NegotiationRequest request) {
        NegotiationService.Terms terms = new NegotiationService.Terms(request.getFee(), request.getWage(),
                request.getContractYears());
        return ResponseEntity.ok(negotiationService.negotiateTransfer(saveId, request.getPlayerId(),
                request.getSellerTeamId(), request.getBuyerTeamId(), terms, request.getNegotiationId(),
                request.getAction()));
    }

    @PostMapping("/offers/{offerId}/negotiate")
    public ResponseEntity<NegotiationResult> negotiateIncoming(@PathVariable Long saveId, @PathVariable Long offerId,
                                                               @Valid @RequestBody IncomingNegotiationRequest request) {
        return ResponseEntity.ok(negotiationService.negotiateIncomingOffer(saveId, offerId, request.getAction(),
                request.getCounterFee(), request.getNegotiationId()));
    }
}
