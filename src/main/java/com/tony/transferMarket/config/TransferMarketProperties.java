package com.tony.transferMarket.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "transfer")
@Data
public class TransferMarketProperties {

    private Market market = new Market();
    private Negotiation negotiation = new Negotiation();
    private Storage storage = new Storage();
    private Ai ai = new Ai();
    private Seed seed = new Seed();

    /** Config IA utilisée quand l'appelant n'en fournit pas. */
    public TransferConfig defaultTransferConfig() {
        return market.getActivity().preset();
    }

    @Data
    public static class Market {
        private MarketActivity activity = MarketActivity.NORMAL;
    }

    @Data
    public static class Negotiation {
        // Nombre de contre-propositions au-delà de l'offre d'ouverture
        private int maxRounds = 2;
        // +5% sur le prix demandé à chaque tour
        private double hardeningStep = 0.05;
        // Amélioration minimale d'une relance (frais OU salaire)
        private double minImprovement = 0.05;
        private Duration sessionTtl = Duration.ofMinutes(30);
        private Duration sweepInterval = Duration.ofMinutes(5);
        private double listedFinalTolerance = 0.90;
        private double freeAgentFinalTolerance = 0.70;
    }

    @Data
    public static class Storage {
        // Limite de valeurs liées par appel à la base
        private int maxBoundValues = 100;
    }

    @Data
    public static class Ai {
        private int poolSize = 2;
        private int queueCapacity = 16;
    }

    @Data
    public static class Seed {
        private boolean enabled = true;
        private String location = "seed/players.csv";
    }
}
