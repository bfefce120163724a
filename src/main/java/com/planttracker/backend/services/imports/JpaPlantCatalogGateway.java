package com.planttracker.backend.services.imports;

import com.planttracker.backend.exceptions.CatalogUnavailableException;
import com.planttracker.backend.models.Plant;
import com.planttracker.backend.models.PlantInstance;
import com.planttracker.backend.models.Propagation;
import com.planttracker.backend.repositories.PlantInstanceRepository;
import com.planttracker.backend.repositories.PlantRepository;
import com.planttracker.backend.repositories.PropagationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;
import java.util.function.Supplier;

/**
 * {@link PlantCatalogGateway} backed by Spring Data repositories.
 *
 * Every call is a single repository transaction. Failures to reach the database are
 * rethrown as {@link CatalogUnavailableException}; constraint violations and other data
 * errors propagate unchanged and only fail the calling row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaPlantCatalogGateway implements PlantCatalogGateway {

    private final PlantRepository plantRepository;
    private final PlantInstanceRepository plantInstanceRepository;
    private final PropagationRepository propagationRepository;

    @Override
    public CatalogSnapshot getCatalogSnapshot() {
        List<CatalogPlant> plants = guard("load catalog", () -> plantRepository.findAllOrdered()).stream()
                .map(JpaPlantCatalogGateway::toCatalogPlant)
                .toList();
        log.debug("Loaded catalog snapshot with {} plants", plants.size());
        return CatalogSnapshot.of(plants);
    }

    @Override
    public CatalogPlant persistTaxonomy(ProcessedRecord record, Long userId) {
        return guard("persist taxonomy", () -> {
            Plant existing = plantRepository.findByTaxonomy(record.getFamily(), record.getGenus(),
                    record.getSpecies(), record.getCultivar()).orElse(null);
            if (existing != null) {
                log.info("Taxonomy {} {} already stored as plant {}", record.getGenus(), record.getSpecies(), existing.getId());
                return toCatalogPlant(existing);
            }

            Plant plant = Plant.builder()
                    .family(record.getFamily())
                    .genus(record.getGenus())
                    .species(record.getSpecies())
                    .cultivar(record.getCultivar())
                    .commonName(record.getCommonName())
                    .createdBy(userId)
                    .isVerified(false)
                    .build();
            Plant saved = plantRepository.save(plant);
            log.debug("Created catalog plant {} for row {}", saved.getId(), record.getRowIndex());
            return toCatalogPlant(saved);
        });
    }

    @Override
    public Long persistInstance(PlantInstanceRecord record, Long plantId, Long userId) {
        PlantInstance instance = PlantInstance.builder()
                .userId(userId)
                .plantId(plantId)
                .nickname(record.getNickname())
                .location(record.getLocation())
                .lastFertilized(record.getLastFertilized())
                .fertilizerSchedule(record.getFertilizerSchedule())
                .fertilizerDue(record.getFertilizerDue())
                .lastRepot(record.getLastRepot())
                .build();
        return guard("persist plant instance", () -> plantInstanceRepository.save(instance).getId());
    }

    @Override
    public Long persistPropagation(PropagationRecord record, Long plantId, Long parentInstanceId, Long userId) {
        Propagation propagation = Propagation.builder()
                .userId(userId)
                .plantId(plantId)
                .parentInstanceId(parentInstanceId)
                .nickname(record.getNickname())
                .location(record.getLocation())
                .dateStarted(record.getDateStarted())
                .sourceType(record.getSourceType())
                .externalSource(record.isInternal() ? null : record.getExternalSource())
                .externalSourceDetails(record.getExternalSourceDetails())
                .build();
        return guard("persist propagation", () -> propagationRepository.save(propagation).getId());
    }

    @Override
    public Long resolveParentInstance(String parentName, Long userId) {
        if (parentName == null || parentName.isBlank()) {
            return null;
        }
        List<PlantInstance> candidates = guard("resolve parent plant",
                () -> plantInstanceRepository.findActiveByUserIdAndNickname(userId, parentName.trim()));
        if (candidates.size() > 1) {
            log.debug("{} plants of user {} are named '{}', using the oldest", candidates.size(), userId, parentName);
        }
        return candidates.isEmpty() ? null : candidates.get(0).getId();
    }

    /**
     * Only fills a blank common name. Care instructions and the verification flag are left
     * to catalog administration.
     */
    @Override
    public CatalogPlant mergeTaxonomy(Long existingPlantId, ProcessedRecord record) {
        return guard("merge taxonomy", () -> {
            Plant plant = plantRepository.findById(existingPlantId)
                    .orElseThrow(() -> new IllegalArgumentException("Plant not found: " + existingPlantId));
            if ((plant.getCommonName() == null || plant.getCommonName().isBlank()) && record.getCommonName() != null) {
                plant.setCommonName(record.getCommonName());
                plant = plantRepository.save(plant);
                log.info("Merged common name '{}' into plant {}", record.getCommonName(), existingPlantId);
            }
            return toCatalogPlant(plant);
        });
    }

    private <T> T guard(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            log.error("Catalog store unavailable during {}: {}", operation, e.getMessage());
            throw new CatalogUnavailableException("Catalog store unavailable during " + operation, e);
        }
    }

    static CatalogPlant toCatalogPlant(Plant plant) {
        return CatalogPlant.builder()
                .id(plant.getId())
                .family(plant.getFamily())
                .genus(plant.getGenus())
                .species(plant.getSpecies())
                .cultivar(plant.getCultivar())
                .commonName(plant.getCommonName())
                .verified(Boolean.TRUE.equals(plant.getIsVerified()))
                .build();
    }
}
