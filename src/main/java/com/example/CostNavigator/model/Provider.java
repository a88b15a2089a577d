package com.example.CostNavigator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * Hospital reference row. Loaded by the ETL job; the navigator only reads it.
 */
@Entity
@Table(name = "providers", indexes = {
        @Index(name = "idx_providers_zip", columnList = "zip_code"),
        @Index(name = "idx_providers_state", columnList = "state")
})
@Getter
@Setter
public class Provider {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_id", length = 32, nullable = false, unique = true)
    private String providerId;

    @Column(nullable = false)
    private String name;

    @Column(length = 128)
    private String city;

    @Column(length = 8)
    private String state;

    @Column(name = "zip_code", length = 16)
    private String zipCode;

    private Double latitude;

    private Double longitude;
}
