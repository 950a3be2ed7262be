package com.example.identityapi.entity;

import jakarta.persistence.*;

/**
 * Country reference data mapping to 'countries' table.
 * Rows are seeded by migration and never written by the API.
 */
@Entity
@Table(name = "countries")
public class Country {

    @Id
    private Integer id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    protected Country() {
    }

    public Country(Integer id, String name) {
        this.id = id;
        this.name = name;
    }

    public Integer getId() {
        return id;
    }

    public String getName() {
        return name;
    }
}
