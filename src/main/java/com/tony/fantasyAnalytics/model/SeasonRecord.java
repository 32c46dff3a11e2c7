package com.tony.fantasyAnalytics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Une saison d'un joueur, telle que fournie par l'ingestion (scraping ou CSV).
 * Les noms JSON suivent le format du flux historique : Player, Position, Team, Fantasy_Points, Year.
 */
@Entity
@Table(name = "season_record", indexes = {
        @Index(name = "idx_season_year", columnList = "season_year"),
        @Index(name = "idx_season_player", columnList = "player_name")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeasonRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @JsonIgnore
    private Long id;

    @NotBlank(message = "Le nom du joueur est requis")
    @Column(name = "player_name", nullable = false)
    @JsonProperty("Player")
    private String playerName;

    @Enumerated(EnumType.STRING)
    @JsonProperty("Position")
    private Position position;

    @JsonProperty("Team")
    private String team;

    @JsonProperty("Fantasy_Points")
    private Double fantasyPoints;

    @Column(name = "season_year")
    @JsonProperty("Year")
    private Integer year;

    public SeasonRecord(String playerName, Position position, String team, Double fantasyPoints, Integer year) {
        this.playerName = playerName;
        this.position = position;
        this.team = team;
        this.fantasyPoints = fantasyPoints;
        this.year = year;
    }

    // Valeur illisible, négative ou absente -> 0 (on ne casse jamais le lot pour une ligne)
    @JsonIgnore
    public double safePoints() {
        if (fantasyPoints == null || !Double.isFinite(fantasyPoints) || fantasyPoints < 0) return 0.0;
        return fantasyPoints;
    }

    @JsonIgnore
    public Position safePosition() {
        return position != null ? position : Position.OTHER;
    }
}
