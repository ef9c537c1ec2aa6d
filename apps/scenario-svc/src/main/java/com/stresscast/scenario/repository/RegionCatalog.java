package com.stresscast.scenario.repository;

import com.stresscast.scenario.model.Region;
import java.util.List;

/**
 * The fourteen departments of El Salvador with reference populations.
 */
public final class RegionCatalog {

    public static final List<Region> DEPARTMENTS = List.of(
            new Region("AH", "Ahuachapán", 340_000),
            new Region("CA", "Cabañas", 160_000),
            new Region("CH", "Chalatenango", 220_000),
            new Region("CU", "Cuscatlán", 250_000),
            new Region("LI", "La Libertad", 750_000),
            new Region("LP", "La Paz", 340_000),
            new Region("LU", "La Unión", 270_000),
            new Region("MO", "Morazán", 190_000),
            new Region("SA", "Santa Ana", 550_000),
            new Region("SM", "San Miguel", 520_000),
            new Region("SO", "Sonsonate", 480_000),
            new Region("SS", "San Salvador", 1_800_000),
            new Region("SV", "San Vicente", 180_000),
            new Region("US", "Usulután", 370_000)
    );

    private RegionCatalog() {
    }
}
