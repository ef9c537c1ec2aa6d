package com.stresscast.scenario.entity;

import jakarta.persistence.*;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "water_daily",
        uniqueConstraints = @UniqueConstraint(name = "water_daily_region_date_unique", columnNames = {"region_id", "date"}))
public class WaterDailyEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "region_id", nullable = false, length = 8)
    private String regionId;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "water_demand_m3", nullable = false)
    private double waterDemandM3;

    @Column(name = "water_supply_m3", nullable = false)
    private double waterSupplyM3;

    @Column(name = "reservoir_level_pct")
    private Double reservoirLevelPct;

    public WaterDailyEntity() {}

    public WaterDailyEntity(UUID id, String regionId, LocalDate date,
                            double waterDemandM3, double waterSupplyM3, Double reservoirLevelPct) {
        this.id = id;
        this.regionId = regionId;
        this.date = date;
        this.waterDemandM3 = waterDemandM3;
        this.waterSupplyM3 = waterSupplyM3;
        this.reservoirLevelPct = reservoirLevelPct;
    }

    public UUID getId() { return id; }
    public String getRegionId() { return regionId; }
    public LocalDate getDate() { return date; }
    public double getWaterDemandM3() { return waterDemandM3; }
    public double getWaterSupplyM3() { return waterSupplyM3; }
    public Double getReservoirLevelPct() { return reservoirLevelPct; }
}
