package com.stresscast.scenario.entity;

import jakarta.persistence.*;

@Entity
@Table(name = "regions")
public class RegionEntity {
    @Id
    @Column(name = "id", length = 8)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "population")
    private Long population;

    // Default constructor for JPA
    public RegionEntity() {}

    public RegionEntity(String id, String name, Long population) {
        this.id = id;
        this.name = name;
        this.population = population;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Long getPopulation() { return population; }
    public void setPopulation(Long population) { this.population = population; }
}
