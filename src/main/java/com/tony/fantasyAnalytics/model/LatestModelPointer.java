package com.tony.fantasyAnalytics.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Pointeur mutable vers le dernier artefact entraîné. Une seule ligne (id = "latest"),
 * le dernier qui écrit gagne : aucun verrou entre deux entraînements concurrents.
 */
@Entity
@Table(name = "latest_model_pointer")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LatestModelPointer {

    public static final String SINGLETON_ID = "latest";

    @Id
    private String id = SINGLETON_ID;

    private String artifactKey;

    private LocalDateTime lastUpdated;
}
