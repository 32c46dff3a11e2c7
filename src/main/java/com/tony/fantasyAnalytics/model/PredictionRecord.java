package com.tony.fantasyAnalytics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Prévision saison N+1 d'un joueur. Le format JSON plat est un contrat :
 * Player, Position, Team, Current_Points, Predicted_Next_Year, Percent_Change, Confidence, Age, Experience.
 */
@Entity
@Table(name = "prediction_record", indexes = {
        @Index(name = "idx_pred_season", columnList = "season")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonPropertyOrder({"Player", "Position", "Team", "Current_Points", "Predicted_Next_Year",
        "Percent_Change", "Confidence", "Age", "Experience"})
public class PredictionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @JsonIgnore
    private Long id;

    // Saison "courante" à partir de laquelle la prévision a été faite
    @JsonIgnore
    private Integer season;

    // Artefact du modèle utilisé
    @JsonIgnore
    private String modelKey;

    @JsonProperty("Player")
    private String player;

    @Enumerated(EnumType.STRING)
    @JsonProperty("Position")
    private Position position;

    @JsonProperty("Team")
    private String team;

    @JsonProperty("Current_Points")
    private Double currentPoints;

    @JsonProperty("Predicted_Next_Year")
    private Double predictedNextYear;

    // null quand Current_Points = 0 (division par zéro)
    @JsonProperty("Percent_Change")
    private Double percentChange;

    @JsonProperty("Confidence")
    private Double confidence;

    @JsonProperty("Age")
    private Integer age;

    @JsonProperty("Experience")
    private Integer experience;
}
