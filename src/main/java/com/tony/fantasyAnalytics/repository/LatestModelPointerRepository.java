package com.tony.fantasyAnalytics.repository;

import com.tony.fantasyAnalytics.model.LatestModelPointer;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LatestModelPointerRepository extends JpaRepository<LatestModelPointer, String> {
}
