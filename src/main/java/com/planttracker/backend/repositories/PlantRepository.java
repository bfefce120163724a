package com.planttracker.backend.repositories;

import com.planttracker.backend.models.Plant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PlantRepository extends JpaRepository<Plant, Long> {

    @Query("SELECT p FROM Plant p ORDER BY p.id")
    List<Plant> findAllOrdered();

    // Cultivar compared null-safe so "no cultivar" matches "no cultivar"
    @Query("SELECT p FROM Plant p WHERE LOWER(p.family) = LOWER(:family) AND LOWER(p.genus) = LOWER(:genus) " +
            "AND LOWER(p.species) = LOWER(:species) AND " +
            "((:cultivar IS NULL AND p.cultivar IS NULL) OR LOWER(p.cultivar) = LOWER(:cultivar))")
    Optional<Plant> findByTaxonomy(@Param("family") String family,
                                   @Param("genus") String genus,
                                   @Param("species") String species,
                                   @Param("cultivar") String cultivar);
}
