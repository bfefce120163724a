package com.planttracker.backend.services.imports;

import com.planttracker.backend.enums.ExternalSource;
import com.planttracker.backend.enums.SourceType;
import com.planttracker.backend.exceptions.CatalogUnavailableException;
import com.planttracker.backend.models.Plant;
import com.planttracker.backend.models.PlantInstance;
import com.planttracker.backend.models.Propagation;
import com.planttracker.backend.repositories.PlantInstanceRepository;
import com.planttracker.backend.repositories.PlantRepository;
import com.planttracker.backend.repositories.PropagationRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaPlantCatalogGatewayTest {

    private static final Long USER_ID = 42L;

    @Mock
    private PlantRepository plantRepository;

    @Mock
    private PlantInstanceRepository plantInstanceRepository;

    @Mock
    private PropagationRepository propagationRepository;

    @InjectMocks
    private JpaPlantCatalogGateway catalogGateway;

    private final TaxonomyRecord bunnyEars = TaxonomyRecord.builder()
            .rowIndex(0).family("Cactaceae").genus("Opuntia").species("microdasys").commonName("Bunny Ears").build();

    @Test
    void getCatalogSnapshot_ShouldMapEveryPlant() {
        // Given
        when(plantRepository.findAllOrdered()).thenReturn(List.of(
                plant(1L, "Araceae", "Monstera", "deliciosa", "Swiss Cheese Plant", true),
                plant(2L, "Araceae", "Epipremnum", "aureum", "Pothos", false)));

        // When
        CatalogSnapshot snapshot = catalogGateway.getCatalogSnapshot();

        // Then
        assertThat(snapshot.size()).isEqualTo(2);
        assertThat(snapshot.getPlants()).extracting(CatalogPlant::getId).containsExactly(1L, 2L);
        assertThat(snapshot.getPlants()).extracting(CatalogPlant::isVerified).containsExactly(true, false);
    }

    @Test
    void getCatalogSnapshot_DatabaseDown_ShouldThrowCatalogUnavailable() {
        // Given
        when(plantRepository.findAllOrdered()).thenThrow(new DataAccessResourceFailureException("Connection refused"));

        // When / Then
        assertThatThrownBy(() -> catalogGateway.getCatalogSnapshot())
                .isInstanceOf(CatalogUnavailableException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    void persistTaxonomy_NewTaxonomy_ShouldSaveUnverifiedPlant() {
        // Given
        when(plantRepository.findByTaxonomy("Cactaceae", "Opuntia", "microdasys", null)).thenReturn(Optional.empty());
        when(plantRepository.save(any(Plant.class))).thenAnswer(invocation -> {
            Plant plant = invocation.getArgument(0);
            plant.setId(10L);
            return plant;
        });

        // When
        CatalogPlant created = catalogGateway.persistTaxonomy(bunnyEars, USER_ID);

        // Then
        assertThat(created.getId()).isEqualTo(10L);
        assertThat(created.isVerified()).isFalse();
        ArgumentCaptor<Plant> captor = ArgumentCaptor.forClass(Plant.class);
        verify(plantRepository).save(captor.capture());
        assertThat(captor.getValue().getCreatedBy()).isEqualTo(USER_ID);
        assertThat(captor.getValue().getCommonName()).isEqualTo("Bunny Ears");
    }

    @Test
    void persistTaxonomy_ExistingTaxonomy_ShouldReturnStoredPlant() {
        // Given
        when(plantRepository.findByTaxonomy("Cactaceae", "Opuntia", "microdasys", null))
                .thenReturn(Optional.of(plant(5L, "Cactaceae", "Opuntia", "microdasys", "Bunny Ears", true)));

        // When
        CatalogPlant existing = catalogGateway.persistTaxonomy(bunnyEars, USER_ID);

        // Then
        assertThat(existing.getId()).isEqualTo(5L);
        verify(plantRepository, never()).save(any());
    }

    @Test
    void persistInstance_ShouldCopyRowFields() {
        // Given
        PlantInstanceRecord record = PlantInstanceRecord.builder()
                .rowIndex(3).commonName("Pothos").nickname("Pothos").location("Shelf")
                .lastFertilized(LocalDate.of(2025, 5, 1)).fertilizerSchedule("2-3 weeks")
                .fertilizerDue(LocalDate.of(2025, 5, 22)).build();
        when(plantInstanceRepository.save(any(PlantInstance.class))).thenAnswer(invocation -> {
            PlantInstance instance = invocation.getArgument(0);
            instance.setId(300L);
            return instance;
        });

        // When
        Long id = catalogGateway.persistInstance(record, 2L, USER_ID);

        // Then
        assertThat(id).isEqualTo(300L);
        ArgumentCaptor<PlantInstance> captor = ArgumentCaptor.forClass(PlantInstance.class);
        verify(plantInstanceRepository).save(captor.capture());
        PlantInstance saved = captor.getValue();
        assertThat(saved.getPlantId()).isEqualTo(2L);
        assertThat(saved.getUserId()).isEqualTo(USER_ID);
        assertThat(saved.getFertilizerDue()).isEqualTo(LocalDate.of(2025, 5, 22));
        assertThat(saved.getIsActive()).isTrue();
    }

    @Test
    void persistInstance_ConstraintViolation_ShouldPropagateUnchanged() {
        // Given
        PlantInstanceRecord record = PlantInstanceRecord.builder().rowIndex(0).commonName("Pothos").nickname("Pothos")
                .location("Shelf").build();
        when(plantInstanceRepository.save(any(PlantInstance.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        // When / Then
        assertThatThrownBy(() -> catalogGateway.persistInstance(record, 2L, USER_ID))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void persistPropagation_InternalCutting_ShouldLinkParentWithoutExternalSource() {
        // Given
        PropagationRecord record = PropagationRecord.builder()
                .rowIndex(1).commonName("Pothos").nickname("Pothos").location("Window")
                .dateStarted(LocalDate.of(2025, 3, 1)).sourceType(SourceType.INTERNAL)
                .externalSource(ExternalSource.OTHER).parentPlantName("Big Pothos").build();
        when(propagationRepository.save(any(Propagation.class))).thenAnswer(invocation -> {
            Propagation propagation = invocation.getArgument(0);
            propagation.setId(900L);
            return propagation;
        });

        // When
        Long id = catalogGateway.persistPropagation(record, 2L, 55L, USER_ID);

        // Then
        assertThat(id).isEqualTo(900L);
        ArgumentCaptor<Propagation> captor = ArgumentCaptor.forClass(Propagation.class);
        verify(propagationRepository).save(captor.capture());
        assertThat(captor.getValue().getParentInstanceId()).isEqualTo(55L);
        assertThat(captor.getValue().getExternalSource()).isNull();
        assertThat(captor.getValue().getSourceType()).isEqualTo(SourceType.INTERNAL);
    }

    @Test
    void persistPropagation_NoTransaction_ShouldThrowCatalogUnavailable() {
        // Given
        PropagationRecord record = PropagationRecord.builder().rowIndex(1).commonName("Pothos").nickname("Pothos")
                .location("Window").dateStarted(LocalDate.of(2025, 3, 1)).sourceType(SourceType.EXTERNAL)
                .externalSource(ExternalSource.PURCHASE).build();
        when(propagationRepository.save(any(Propagation.class)))
                .thenThrow(new CannotCreateTransactionException("pool exhausted"));

        // When / Then
        assertThatThrownBy(() -> catalogGateway.persistPropagation(record, 2L, null, USER_ID))
                .isInstanceOf(CatalogUnavailableException.class);
    }

    @Test
    void resolveParentInstance_ShouldReturnOldestMatch() {
        // Given
        PlantInstance first = PlantInstance.builder().id(11L).nickname("Big Pothos").build();
        PlantInstance second = PlantInstance.builder().id(12L).nickname("big pothos").build();
        when(plantInstanceRepository.findActiveByUserIdAndNickname(USER_ID, "Big Pothos"))
                .thenReturn(List.of(first, second));

        // When
        Long parentId = catalogGateway.resolveParentInstance("  Big Pothos ", USER_ID);

        // Then
        assertThat(parentId).isEqualTo(11L);
    }

    @Test
    void resolveParentInstance_UnknownOrBlankName_ShouldReturnNull() {
        // Given
        when(plantInstanceRepository.findActiveByUserIdAndNickname(USER_ID, "Nobody")).thenReturn(List.of());

        // When / Then
        assertThat(catalogGateway.resolveParentInstance("Nobody", USER_ID)).isNull();
        assertThat(catalogGateway.resolveParentInstance("  ", USER_ID)).isNull();
        verify(plantInstanceRepository, times(1)).findActiveByUserIdAndNickname(any(), any());
    }

    @Test
    void mergeTaxonomy_BlankCommonName_ShouldFillIt() {
        // Given
        Plant stored = plant(5L, "Cactaceae", "Opuntia", "microdasys", " ", true);
        when(plantRepository.findById(5L)).thenReturn(Optional.of(stored));
        when(plantRepository.save(stored)).thenReturn(stored);

        // When
        CatalogPlant merged = catalogGateway.mergeTaxonomy(5L, bunnyEars);

        // Then
        assertThat(merged.getCommonName()).isEqualTo("Bunny Ears");
    }

    @Test
    void mergeTaxonomy_ExistingCommonName_ShouldLeavePlantUnchanged() {
        // Given
        when(plantRepository.findById(5L))
                .thenReturn(Optional.of(plant(5L, "Cactaceae", "Opuntia", "microdasys", "Polka Dot Cactus", true)));

        // When
        CatalogPlant merged = catalogGateway.mergeTaxonomy(5L, bunnyEars);

        // Then
        assertThat(merged.getCommonName()).isEqualTo("Polka Dot Cactus");
        verify(plantRepository, never()).save(any());
    }

    @Test
    void mergeTaxonomy_UnknownPlant_ShouldThrow() {
        // Given
        when(plantRepository.findById(404L)).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> catalogGateway.mergeTaxonomy(404L, bunnyEars))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("404");
    }

    private static Plant plant(Long id, String family, String genus, String species, String commonName, boolean verified) {
        return Plant.builder()
                .id(id)
                .family(family)
                .genus(genus)
                .species(species)
                .commonName(commonName)
                .isVerified(verified)
                .build();
    }
}
