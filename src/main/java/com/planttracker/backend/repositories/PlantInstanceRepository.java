package com.planttracker.backend.repositories;

import com.planttracker.backend.models.PlantInstance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PlantInstanceRepository extends JpaRepository<PlantInstance, Long> {

    // Active instances of a user whose nickname equals the given name, oldest first
    @Query("SELECT pi FROM PlantInstance pi WHERE pi.userId = :userId AND pi.isActive = true " +
            "AND LOWER(pi.nickname) = LOWER(:nickname) ORDER BY pi.id")
    List<PlantInstance> findActiveByUserIdAndNickname(@Param("userId") Long userId,
                                                      @Param("nickname") String nickname);
}
