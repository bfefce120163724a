package com.planttracker.backend.repositories;

import com.planttracker.backend.models.Propagation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PropagationRepository extends JpaRepository<Propagation, Long> {
}
