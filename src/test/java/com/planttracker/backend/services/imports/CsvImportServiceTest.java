package com.planttracker.backend.services.imports;

import com.planttracker.backend.config.ImportProperties;
import com.planttracker.backend.dto.imports.ImportConfig;
import com.planttracker.backend.dto.imports.ImportConflict;
import com.planttracker.backend.dto.imports.ImportError;
import com.planttracker.backend.dto.imports.ImportProgress;
import com.planttracker.backend.dto.imports.ImportSummary;
import com.planttracker.backend.dto.imports.ValidationReport;
import com.planttracker.backend.enums.ConflictType;
import com.planttracker.backend.enums.ImportStatus;
import com.planttracker.backend.enums.ImportType;
import com.planttracker.backend.enums.SuggestedAction;
import com.planttracker.backend.exceptions.CatalogUnavailableException;
import com.planttracker.backend.exceptions.ImportAccessDeniedException;
import com.planttracker.backend.exceptions.ImportNotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CsvImportServiceTest {

    private static final Long USER_ID = 42L;

    @Mock
    private PlantCatalogGateway catalogGateway;

    private final Clock clock = Clock.fixed(Instant.parse("2025-06-15T10:00:00Z"), ZoneOffset.UTC);
    private final CatalogPlant pothos = CatalogPlant.builder()
            .id(3L).family("Araceae").genus("Epipremnum").species("aureum").commonName("Pothos").verified(true).build();
    private final CatalogPlant monstera = CatalogPlant.builder()
            .id(1L).family("Araceae").genus("Monstera").species("deliciosa").commonName("Swiss Cheese Plant").verified(true).build();

    private final CatalogPlant heartleaf = CatalogPlant.builder()
            .id(5L).family("Araceae").genus("Philodendron").species("hederaceum").commonName("Heartleaf Philodendron").build();

    private ImportProgressStore progressStore;
    private SimpleMeterRegistry meterRegistry;
    private PlantMatcher plantMatcher;
    private CsvImportService csvImportService;

    @BeforeEach
    void setUp() {
        progressStore = new ImportProgressStore(clock);
        meterRegistry = new SimpleMeterRegistry();
        plantMatcher = spy(new PlantMatcher());
        csvImportService = service(new SyncTaskExecutor());
    }

    @Test
    void startImport_FiveHundredInstancesWithOneFailingWrite_ShouldCompleteWithOneRowError() {
        // Given
        StringBuilder csv = new StringBuilder("Common Name,Location\n");
        for (int i = 1; i <= 500; i++) {
            csv.append("Pothos,Shelf ").append(i).append('\n');
        }
        when(catalogGateway.getCatalogSnapshot()).thenReturn(CatalogSnapshot.of(List.of(monstera, pothos)));
        when(catalogGateway.persistInstance(any(PlantInstanceRecord.class), eq(3L), eq(USER_ID))).thenAnswer(invocation -> {
            PlantInstanceRecord record = invocation.getArgument(0);
            if ("Shelf 237".equals(record.getLocation())) {
                throw new IllegalStateException("constraint violation");
            }
            return 1000L + record.getRowIndex();
        });

        // When
        String jobId = csvImportService.startImport(bytes(csv.toString()), "pothos.csv",
                ImportType.PLANT_INSTANCES, ImportConfig.defaults(), USER_ID);

        // Then
        ImportProgress progress = csvImportService.getProgress(jobId, USER_ID);
        assertThat(progress.getStatus()).isEqualTo(ImportStatus.COMPLETED);
        assertThat(progress.getProgress()).isEqualTo(100.0);
        assertThat(progress.getFileName()).isEqualTo("pothos.csv");

        ImportSummary summary = progress.getSummary();
        assertThat(summary.getTotalRows()).isEqualTo(500);
        assertThat(summary.getProcessedRows()).isEqualTo(500);
        assertThat(summary.getSuccessfulImports()).isEqualTo(499);
        assertThat(summary.getSkippedRows()).isZero();
        assertThat(summary.getConflicts()).isEmpty();
        assertThat(summary.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getRowIndex()).isEqualTo(236);
            assertThat(error.getMessage()).isEqualTo("Failed to import row: constraint violation");
            assertThat(error.isBlocking()).isTrue();
        });
        verify(catalogGateway, times(500)).persistInstance(any(), eq(3L), eq(USER_ID));
        verify(catalogGateway, never()).persistTaxonomy(any(), any());
    }

    @Test
    void startImport_ShouldPutEveryRowInExactlyOneBucket() {
        // Given
        String csv = "Family,Genus,Species,Cultivar,Common Name\n"
                + "Araceae,Monstera,deliciosa,,Swiss Cheese Plant\n"   // exact duplicate
                + ",,,Variegata,\n"                                    // empty, skipped
                + "Araceae,,deliciosa,,Broken\n"                       // missing genus
                + "Cactaceae,Opuntia,microdasys,,Bunny Ears\n";        // new plant
        when(catalogGateway.getCatalogSnapshot()).thenReturn(CatalogSnapshot.of(List.of(monstera)));
        when(catalogGateway.persistTaxonomy(any(), eq(USER_ID))).thenAnswer(invocation -> created(invocation.getArgument(0), 99L));

        // When
        String jobId = csvImportService.startImport(bytes(csv), "taxonomy.csv", ImportType.PLANT_TAXONOMY,
                ImportConfig.defaults(), USER_ID);

        // Then
        ImportSummary summary = csvImportService.getProgress(jobId, USER_ID).getSummary();
        assertThat(summary.getTotalRows()).isEqualTo(4);
        assertThat(summary.getProcessedRows()).isEqualTo(4);
        assertThat(summary.getSuccessfulImports()).isEqualTo(1);
        assertThat(summary.getSkippedRows()).isEqualTo(1);
        assertThat(summary.getConflicts()).extracting(ImportConflict::getRowIndex).containsExactly(0);
        assertThat(summary.getErrors()).extracting(ImportError::getRowIndex).containsExactly(2);
        assertThat(summary.getErrors()).extracting(ImportError::getField).containsExactly("Genus");
        assertThat(summary.getConflicts().get(0).getType()).isEqualTo(ConflictType.DUPLICATE_PLANT);
        assertThat(summary.getConflicts().get(0).getSuggestedAction()).isEqualTo(SuggestedAction.SKIP);

        assertThat(meterRegistry.get("plant_import.rows").tag("outcome", "persisted").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("plant_import.rows").tag("outcome", "skipped").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("plant_import.rows").tag("outcome", "conflicted").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("plant_import.rows").tag("outcome", "errored").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("plant_import.jobs").tag("status", "completed")
                .tag("import_type", "plant_taxonomy").counter().count()).isEqualTo(1.0);
    }

    @Test
    void startImport_RepeatedNewPlant_ShouldMatchThePlantCreatedEarlierInTheFile() {
        // Given
        String csv = "Family,Genus,Species,Common Name\n"
                + "Cactaceae,Opuntia,microdasys,Bunny Ears\n"
                + "Cactaceae,Opuntia,microdasys,Bunny Ears\n";
        when(catalogGateway.getCatalogSnapshot()).thenReturn(CatalogSnapshot.of(List.of(monstera)));
        when(catalogGateway.persistTaxonomy(any(), eq(USER_ID))).thenAnswer(invocation -> created(invocation.getArgument(0), 99L));

        // When
        String jobId = csvImportService.startImport(bytes(csv), null, ImportType.PLANT_TAXONOMY,
                ImportConfig.defaults(), USER_ID);

        // Then
        ImportProgress progress = csvImportService.getProgress(jobId, USER_ID);
        assertThat(progress.getFileName()).isEqualTo("import.csv");
        assertThat(progress.getSummary().getSuccessfulImports()).isEqualTo(1);
        assertThat(progress.getConflicts()).singleElement().satisfies(conflict -> {
            assertThat(conflict.getRowIndex()).isEqualTo(1);
            assertThat(conflict.getType()).isEqualTo(ConflictType.DUPLICATE_PLANT);
            assertThat(conflict.getExistingRecord().getId()).isEqualTo(99L);
        });
        verify(catalogGateway, times(1)).persistTaxonomy(any(), eq(USER_ID));
    }

    @Test
    void startImport_TieBelowThreshold_ShouldRecordConflictInsteadOfCreatingPlant() {
        // Given
        CatalogPlant cordatum = CatalogPlant.builder()
                .id(6L).family("Araceae").genus("Philodendron").species("cordatum").commonName("Heartleaf Philodendron").build();
        String csv = "Family,Genus,Species,Common Name,Location\n"
                + "Araceae,Philodendron,gloriosum,Velvet Philodendron,Hallway\n";
        when(catalogGateway.getCatalogSnapshot()).thenReturn(CatalogSnapshot.of(List.of(monstera, heartleaf, cordatum)));

        // When
        String jobId = csvImportService.startImport(bytes(csv), "instances.csv", ImportType.PLANT_INSTANCES,
                ImportConfig.defaults(), USER_ID);

        // Then
        ImportSummary summary = csvImportService.getProgress(jobId, USER_ID).getSummary();
        assertThat(summary.getSuccessfulImports()).isZero();
        assertThat(summary.getConflicts()).singleElement().satisfies(conflict -> {
            assertThat(conflict.getType()).isEqualTo(ConflictType.INVALID_TAXONOMY);
            assertThat(conflict.getSuggestedAction()).isEqualTo(SuggestedAction.MANUAL_REVIEW);
            assertThat(conflict.getMessage()).contains("2 candidates");
        });
        verify(catalogGateway, never()).persistTaxonomy(any(), any());
        verify(catalogGateway, never()).persistInstance(any(), any(), any());
    }

    @Test
    void startImport_LoneWeakCandidate_ShouldRecordConflictNamingIt() {
        // Given
        String csv = "Family,Genus,Species,Common Name,Location\n"
                + "Araceae,Philodendron,gloriosum,Velvet Philodendron,Hallway\n";
        when(catalogGateway.getCatalogSnapshot()).thenReturn(CatalogSnapshot.of(List.of(monstera, heartleaf)));

        // When
        String jobId = csvImportService.startImport(bytes(csv), "instances.csv", ImportType.PLANT_INSTANCES,
                ImportConfig.defaults(), USER_ID);

        // Then
        ImportSummary summary = csvImportService.getProgress(jobId, USER_ID).getSummary();
        assertThat(summary.getSuccessfulImports()).isZero();
        assertThat(summary.getConflicts()).singleElement().satisfies(conflict -> {
            assertThat(conflict.getType()).isEqualTo(ConflictType.INVALID_TAXONOMY);
            assertThat(conflict.getExistingRecord()).isEqualTo(heartleaf);
            assertThat(conflict.getMessage()).contains("Philodendron hederaceum (Heartleaf Philodendron)", "0.5881");
        });
        verify(catalogGateway, never()).persistTaxonomy(any(), any());
    }

    @Test
    void startImport_PropagationNamedByNickname_ShouldLinkByTaxonomyWithWarning() {
        // Given
        CatalogPlant gloriosum = CatalogPlant.builder()
                .id(4L).family("Araceae").genus("Philodendron").species("gloriosum").commonName("Velvet Philodendron").build();
        String csv = "Family,Genus,Species,Common Name,Date Started,Source\n"
                + "Aroideae,Philodendron,gloriosum,Gloria cutting,2025-04-02,Etsy\n";
        when(catalogGateway.getCatalogSnapshot()).thenReturn(CatalogSnapshot.of(List.of(monstera, gloriosum)));
        when(catalogGateway.persistPropagation(any(), eq(4L), isNull(), eq(USER_ID))).thenReturn(700L);

        // When
        String jobId = csvImportService.startImport(bytes(csv), "cuttings.csv", ImportType.PROPAGATIONS,
                ImportConfig.defaults(), USER_ID);

        // Then
        ImportSummary summary = csvImportService.getProgress(jobId, USER_ID).getSummary();
        assertThat(summary.getSuccessfulImports()).isEqualTo(1);
        assertThat(summary.getConflicts()).isEmpty();
        assertThat(summary.getWarnings()).extracting(ImportError::getMessage)
                .contains("Using taxonomy match for propagation: Gloria cutting -> Velvet Philodendron");
        verify(catalogGateway, never()).persistTaxonomy(any(), any());
    }

    @Test
    void startImport_AllRequiredFieldsEmptyWithSkippingOff_ShouldErrorWithoutMatching() {
        // Given
        String csv = "Family,Genus,Species,Cultivar,Common Name\n,,,Variegata,\n";
        when(catalogGateway.getCatalogSnapshot()).thenReturn(CatalogSnapshot.of(List.of(monstera)));
        ImportConfig config = ImportConfig.builder().skipEmptyRows(false).build();

        // When
        String jobId = csvImportService.startImport(bytes(csv), "t.csv", ImportType.PLANT_TAXONOMY, config, USER_ID);

        // Then
        ImportSummary summary = csvImportService.getProgress(jobId, USER_ID).getSummary();
        assertThat(summary.getSkippedRows()).isZero();
        assertThat(summary.getErrors()).hasSize(4).allMatch(error -> error.getRowIndex() == 0);
        verify(plantMatcher, never()).match(any(), any(), any());
        verify(catalogGateway, never()).persistTaxonomy(any(), any());
    }

    @Test
    void startImport_HeaderOnly_ShouldCompleteWithZeroRows() {
        // Given
        when(catalogGateway.getCatalogSnapshot()).thenReturn(CatalogSnapshot.empty());

        // When
        String jobId = csvImportService.startImport(bytes("Common Name,Location\n"), "empty.csv",
                ImportType.PLANT_INSTANCES, ImportConfig.defaults(), USER_ID);

        // Then
        ImportProgress progress = csvImportService.getProgress(jobId, USER_ID);
        assertThat(progress.getStatus()).isEqualTo(ImportStatus.COMPLETED);
        assertThat(progress.getProgress()).isEqualTo(100.0);
        assertThat(progress.getSummary().getTotalRows()).isZero();
    }

    @Test
    void startImport_UnrecognizedColumns_ShouldFailJob() {
        // When
        String jobId = csvImportService.startImport(bytes("Foo,Bar\n1,2\n"), "foo.csv",
                ImportType.PLANT_TAXONOMY, ImportConfig.defaults(), USER_ID);

        // Then
        ImportProgress progress = csvImportService.getProgress(jobId, USER_ID);
        assertThat(progress.getStatus()).isEqualTo(ImportStatus.FAILED);
        assertThat(progress.getEndTime()).isNotNull();
        assertThat(progress.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getRowIndex()).isEqualTo(-1);
            assertThat(error.getMessage()).contains("None of the columns");
        });
        verifyNoInteractions(catalogGateway);
        assertThat(meterRegistry.get("plant_import.jobs").tag("status", "failed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void startImport_BlankContent_ShouldFailJob() {
        // When
        String jobId = csvImportService.startImport(bytes("\n\n   \n"), "blank.csv",
                ImportType.PLANT_TAXONOMY, ImportConfig.defaults(), USER_ID);

        // Then
        ImportProgress progress = csvImportService.getProgress(jobId, USER_ID);
        assertThat(progress.getStatus()).isEqualTo(ImportStatus.FAILED);
        assertThat(progress.getErrors()).extracting(ImportError::getMessage).containsExactly("CSV file is empty");
    }

    @Test
    void startImport_CatalogUnreachableAtStart_ShouldFailJob() {
        // Given
        when(catalogGateway.getCatalogSnapshot())
                .thenThrow(new CatalogUnavailableException("Plant catalog is unavailable", new RuntimeException("refused")));

        // When
        String jobId = csvImportService.startImport(bytes("Common Name,Location\nPothos,Shelf\n"), "p.csv",
                ImportType.PLANT_INSTANCES, ImportConfig.defaults(), USER_ID);

        // Then
        ImportProgress progress = csvImportService.getProgress(jobId, USER_ID);
        assertThat(progress.getStatus()).isEqualTo(ImportStatus.FAILED);
        assertThat(progress.getSummary().getProcessedRows()).isZero();
        assertThat(progress.getErrors()).extracting(ImportError::getMessage).containsExactly("Plant catalog is unavailable");
    }

    @Test
    void startImport_CatalogLostMidRun_ShouldFailWithPartialSummary() {
        // Given
        String csv = "Common Name,Location\nPothos,Shelf 1\nPothos,Shelf 2\nPothos,Shelf 3\nPothos,Shelf 4\n";
        when(catalogGateway.getCatalogSnapshot()).thenReturn(CatalogSnapshot.of(List.of(pothos)));
        when(catalogGateway.persistInstance(any(), eq(3L), eq(USER_ID)))
                .thenReturn(1L)
                .thenReturn(2L)
                .thenThrow(new CatalogUnavailableException("Plant catalog is unavailable", new RuntimeException("pool exhausted")));

        // When
        String jobId = csvImportService.startImport(bytes(csv), "p.csv", ImportType.PLANT_INSTANCES,
                ImportConfig.defaults(), USER_ID);

        // Then
        ImportProgress progress = csvImportService.getProgress(jobId, USER_ID);
        assertThat(progress.getStatus()).isEqualTo(ImportStatus.FAILED);
        assertThat(progress.getProgress()).isEqualTo(50.0);
        assertThat(progress.getSummary().getProcessedRows()).isEqualTo(2);
        assertThat(progress.getSummary().getSuccessfulImports()).isEqualTo(2);
        assertThat(progress.getSummary().getErrors()).extracting(ImportError::getRowIndex).containsExactly(-1);
        verify(catalogGateway, times(3)).persistInstance(any(), eq(3L), eq(USER_ID));
    }

    @Test
    void startImport_ExecutorRejectsJob_ShouldFailImmediately() {
        // Given
        TaskExecutor rejecting = task -> {
            throw new TaskRejectedException("queue full");
        };
        CsvImportService busyService = service(rejecting);

        // When
        String jobId = busyService.startImport(bytes("Common Name,Location\nPothos,Shelf\n"), "p.csv",
                ImportType.PLANT_INSTANCES, ImportConfig.defaults(), USER_ID);

        // Then
        ImportProgress progress = busyService.getProgress(jobId, USER_ID);
        assertThat(progress.getStatus()).isEqualTo(ImportStatus.FAILED);
        assertThat(progress.getErrors()).extracting(ImportError::getMessage)
                .containsExactly("Import queue is full, try again later");
        verifyNoInteractions(catalogGateway);
    }

    @Test
    void startImport_QueuedJob_ShouldStayPendingUntilExecuted() {
        // Given
        List<Runnable> queued = new ArrayList<>();
        CsvImportService queuedService = service(queued::add);

        // When
        String jobId = queuedService.startImport(bytes("Common Name,Location\nPothos,Shelf\n"), "p.csv",
                ImportType.PLANT_INSTANCES, null, USER_ID);

        // Then
        ImportProgress progress = queuedService.getProgress(jobId, USER_ID);
        assertThat(progress.getStatus()).isEqualTo(ImportStatus.PENDING);
        assertThat(progress.getProgress()).isZero();
        assertThat(progress.getStartTime()).isNotNull();
        assertThat(queued).hasSize(1);
    }

    @Test
    void startImport_EmptyContent_ShouldThrow() {
        assertThatThrownBy(() -> csvImportService.startImport(new byte[0], "p.csv", ImportType.PLANT_INSTANCES,
                ImportConfig.defaults(), USER_ID))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("File is empty");
        assertThat(progressStore.size()).isZero();
    }

    @Test
    void validateOnly_ShouldBeRepeatableAndNeverWrite() {
        // Given
        String csv = "Family,Genus,Species,Common Name\n"
                + "Araceae,Monstera,deliciosa,Swiss Cheese Plant\n"
                + "Cactaceae,Opuntia,microdasys,Bunny Ears\n"
                + "Cactaceae,Opuntia,microdasys,Bunny Ears\n"
                + ",Ficus,,\n";
        when(catalogGateway.getCatalogSnapshot()).thenReturn(CatalogSnapshot.of(List.of(monstera)));

        // When
        ValidationReport first = csvImportService.validateOnly(csv, ImportType.PLANT_TAXONOMY, null, USER_ID);
        ValidationReport second = csvImportService.validateOnly(csv, ImportType.PLANT_TAXONOMY, null, USER_ID);

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(first.isValid()).isFalse();
        assertThat(first.getRecordCount()).isEqualTo(2);
        assertThat(first.getConflicts()).extracting(ImportConflict::getRowIndex).containsExactly(0);
        assertThat(first.getErrors()).allMatch(error -> error.getRowIndex() == 3);
        verify(catalogGateway, times(2)).getCatalogSnapshot();
        verifyNoMoreInteractions(catalogGateway);
        assertThat(progressStore.size()).isZero();
    }

    @Test
    void getProgress_UnknownJob_ShouldThrowNotFound() {
        assertThatThrownBy(() -> csvImportService.getProgress("missing", USER_ID))
                .isInstanceOf(ImportNotFoundException.class);
    }

    @Test
    void getProgress_OtherUsersJob_ShouldThrowAccessDenied() {
        // Given
        List<Runnable> queued = new ArrayList<>();
        CsvImportService queuedService = service(queued::add);
        String jobId = queuedService.startImport(bytes("Common Name\nPothos\n"), "p.csv",
                ImportType.PLANT_INSTANCES, null, USER_ID);

        // When / Then
        assertThatThrownBy(() -> queuedService.getProgress(jobId, 99L))
                .isInstanceOf(ImportAccessDeniedException.class);
        assertThat(queuedService.getProgress(jobId, null).getUserId()).isEqualTo(USER_ID);
        assertThat(queuedService.getImportsForUser(USER_ID)).hasSize(1);
        assertThat(queuedService.getImportsForUser(99L)).isEmpty();
    }

    private CsvImportService service(TaskExecutor executor) {
        RowSchemaValidator validator = new RowSchemaValidator(new DateParser(clock), new ScheduleParser());
        return new CsvImportService(new CsvParser(), validator, plantMatcher,
                new ImportConflictResolver(catalogGateway), catalogGateway, progressStore,
                ImportProperties.defaults(), executor, meterRegistry, clock);
    }

    private static CatalogPlant created(ProcessedRecord record, Long id) {
        return CatalogPlant.builder()
                .id(id)
                .family(record.getFamily())
                .genus(record.getGenus())
                .species(record.getSpecies())
                .cultivar(record.getCultivar())
                .commonName(record.getCommonName())
                .build();
    }

    private static byte[] bytes(String csv) {
        return csv.getBytes(StandardCharsets.UTF_8);
    }
}
