package com.stresscast.scenario.entity;

import jakarta.persistence.*;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "energy_daily",
        uniqueConstraints = @UniqueConstraint(name = "energy_daily_region_date_unique", columnNames = {"region_id", "date"}))
public class EnergyDailyEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "region_id", nullable = false, length = 8)
    private String regionId;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "demand_mwh", nullable = false)
    private double demandMwh;

    public EnergyDailyEntity() {}

    public EnergyDailyEntity(UUID id, String regionId, LocalDate date, double demandMwh) {
        this.id = id;
        this.regionId = regionId;
        this.date = date;
        this.demandMwh = demandMwh;
    }

    public UUID getId() { return id; }
    public String getRegionId() { return regionId; }
    public LocalDate getDate() { return date; }
    public double getDemandMwh() { return demandMwh; }
}
