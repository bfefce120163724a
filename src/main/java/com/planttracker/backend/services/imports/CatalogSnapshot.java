package com.planttracker.backend.services.imports;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable copy of the plant catalog taken when a job starts.
 *
 * Catalog writes made by other requests after the snapshot was taken are never visible.
 * Plants created by the job itself are appended through {@link #withPlant(CatalogPlant)},
 * which returns a new snapshot, so later rows of the same file match against them.
 */
public final class CatalogSnapshot {

    private final List<CatalogPlant> plants;

    private CatalogSnapshot(List<CatalogPlant> plants) {
        this.plants = Collections.unmodifiableList(plants);
    }

    public static CatalogSnapshot of(List<CatalogPlant> plants) {
        return new CatalogSnapshot(new ArrayList<>(plants));
    }

    public static CatalogSnapshot empty() {
        return new CatalogSnapshot(new ArrayList<>());
    }

    public CatalogSnapshot withPlant(CatalogPlant plant) {
        List<CatalogPlant> extended = new ArrayList<>(plants.size() + 1);
        extended.addAll(plants);
        extended.add(plant);
        return new CatalogSnapshot(extended);
    }

    public List<CatalogPlant> getPlants() {
        return plants;
    }

    public int size() {
        return plants.size();
    }
}
