package com.tony.fantasyAnalytics.repository;

import com.tony.fantasyAnalytics.model.ModelArtifact;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ModelArtifactRepository extends JpaRepository<ModelArtifact, String> {

    List<ModelArtifact> findAllByOrderByCreatedAtDesc();
}
