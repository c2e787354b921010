package com.tony.transferMarket.config;

import com.opencsv.bean.CsvBindByName;
import com.opencsv.bean.CsvToBeanBuilder;
import com.tony.transferMarket.model.*;
import com.tony.transferMarket.repository.GameSaveRepository;
import com.tony.transferMarket.repository.PlayerRepository;
import com.tony.transferMarket.repository.TeamRepository;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partie de démonstration : 4 clubs (le premier contrôlé par l'humain) et quelques joueurs libres,
 * chargés depuis un CSV du classpath.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataInitializer implements CommandLineRunner {
    private final GameSaveRepository saveRepository;
    private final TeamRepository teamRepository;
    private final PlayerRepository playerRepository;
    private final TransferMarketProperties properties;

    // Nom, réputation, budget transferts, masse salariale max
    private static final Object[][] CLUBS = {
            {"FC Lumière", 62, 30_000_000L, 1_500_000L},
            {"Olympique Riviera", 70, 45_000_000L, 2_000_000L},
            {"AS Montagne", 55, 18_000_000L, 1_400_000L},
            {"Racing Estuaire", 50, 12_000_000L, 1_000_000L}
    };

    @Override
    @Transactional
    public void run(String... args) throws Exception {
        // On ne remplit que si la base est vide
        if (!properties.getSeed().isEnabled() || saveRepository.count() > 0) {
            return;
        }
        log.info("🌱 Création de la partie de démonstration depuis {}", properties.getSeed().getLocation());

        GameSave save = saveRepository.save(new GameSave("Démo", 2026, 1));
        Map<String, Team> teams = new LinkedHashMap<>();
        for (Object[] club : CLUBS) {
            Team team = new Team(save, (String) club[0], (Integer) club[1], (Long) club[2], (Long) club[3]);
            teams.put(team.getName(), teamRepository.save(team));
        }
        save.setHumanTeam(teams.get((String) CLUBS[0][0]));
        saveRepository.save(save);

        List<PlayerRow> rows;
        try (Reader reader = new InputStreamReader(
                new ClassPathResource(properties.getSeed().getLocation()).getInputStream(), StandardCharsets.UTF_8)) {
            rows = new CsvToBeanBuilder<PlayerRow>(reader)
                    .withType(PlayerRow.class).withSeparator(',').withIgnoreLeadingWhiteSpace(true).build().parse();
        }

        int freeAgents = 0;
        for (PlayerRow row : rows) {
            Team team = row.getTeam() == null || row.getTeam().isBlank() ? null : teams.get(row.getTeam());
            if (team == null && row.getTeam() != null && !row.getTeam().isBlank()) {
                log.warn("⚠️ Club inconnu dans le CSV : {} (joueur {} ignoré)", row.getTeam(), row.getName());
                continue;
            }
            playerRepository.save(row.toPlayer(save, team));
            if (team == null) freeAgents++;
        }
        log.info("✅ Partie {} créée : {} clubs, {} joueurs dont {} libres", save.getId(), teams.size(), rows.size(), freeAgents);
    }

    @Data
    public static class PlayerRow {
        @CsvBindByName(column = "team") private String team;
        @CsvBindByName(column = "name", required = true) private String name;
        @CsvBindByName(column = "position", required = true) private String position;
        @CsvBindByName(column = "age") private Integer age;
        @CsvBindByName(column = "potential") private Integer potential;
        @CsvBindByName(column = "contractEnd") private Integer contractEnd;
        @CsvBindByName(column = "wage") private Long wage;
        @CsvBindByName(column = "marketValue") private Long marketValue;
        @CsvBindByName(column = "speed") private Integer speed;
        @CsvBindByName(column = "strength") private Integer strength;
        @CsvBindByName(column = "stamina") private Integer stamina;
        @CsvBindByName(column = "shooting") private Integer shooting;
        @CsvBindByName(column = "passing") private Integer passing;
        @CsvBindByName(column = "dribbling") private Integer dribbling;
        @CsvBindByName(column = "heading") private Integer heading;
        @CsvBindByName(column = "tackling") private Integer tackling;
        @CsvBindByName(column = "positioning") private Integer positioning;
        @CsvBindByName(column = "vision") private Integer vision;
        @CsvBindByName(column = "composure") private Integer composure;
        @CsvBindByName(column = "aggression") private Integer aggression;
        @CsvBindByName(column = "reflexes") private Integer reflexes;
        @CsvBindByName(column = "handling") private Integer handling;
        @CsvBindByName(column = "diving") private Integer diving;

        Player toPlayer(GameSave save, Team team) {
            Player player = new Player();
            player.setSave(save);
            player.setTeam(team);
            player.setName(name);
            player.setPosition(Position.valueOf(position.trim().toUpperCase()));
            player.setAge(age);
            player.setPotential(potential);
            player.setContractEndSeason(contractEnd);
            player.setWage(wage != null ? wage : 0L);
            player.setMarketValue(marketValue != null ? marketValue : 0L);
            player.setAttributes(PlayerAttributes.builder()
                    .speed(speed).strength(strength).stamina(stamina)
                    .shooting(shooting).passing(passing).dribbling(dribbling).heading(heading).tackling(tackling)
                    .positioning(positioning).vision(vision).composure(composure).aggression(aggression)
                    .reflexes(reflexes).handling(handling).diving(diving)
                    .build());
            return player;
        }
    }
}
