package com.stresscast.scenario.entity;

import jakarta.persistence.*;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "agriculture_daily")
public class AgricultureDailyEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "region_id", nullable = false, length = 8)
    private String regionId;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "crop_type", nullable = false, length = 16)
    private String cropType;

    @Column(name = "yield_kg_per_hectare", nullable = false)
    private double yieldKgPerHectare;

    @Column(name = "rainfall_mm", nullable = false)
    private double rainfallMm;

    @Column(name = "temperature_avg_c", nullable = false)
    private double temperatureAvgC;

    @Column(name = "soil_moisture_pct", nullable = false)
    private double soilMoisturePct;

    public AgricultureDailyEntity() {}

    public AgricultureDailyEntity(UUID id, String regionId, LocalDate date, String cropType,
                                  double yieldKgPerHectare, double rainfallMm,
                                  double temperatureAvgC, double soilMoisturePct) {
        this.id = id;
        this.regionId = regionId;
        this.date = date;
        this.cropType = cropType;
        this.yieldKgPerHectare = yieldKgPerHectare;
        this.rainfallMm = rainfallMm;
        this.temperatureAvgC = temperatureAvgC;
        this.soilMoisturePct = soilMoisturePct;
    }

    public UUID getId() { return id; }
    public String getRegionId() { return regionId; }
    public LocalDate getDate() { return date; }
    public String getCropType() { return cropType; }
    public double getYieldKgPerHectare() { return yieldKgPerHectare; }
    public double getRainfallMm() { return rainfallMm; }
    public double getTemperatureAvgC() { return temperatureAvgC; }
    public double getSoilMoisturePct() { return soilMoisturePct; }
}
