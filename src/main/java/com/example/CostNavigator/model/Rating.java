package com.example.CostNavigator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "ratings",
        uniqueConstraints = @UniqueConstraint(name = "uq_rating_per_provider", columnNames = "provider_id"))
@Getter
@Setter
public class Rating {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_id", length = 32, nullable = false)
    private String providerId;

    /** 1..10 */
    @Column(nullable = false)
    private Integer rating;
}
