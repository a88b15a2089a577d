package com.example.CostNavigator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "procedures",
        indexes = @Index(name = "idx_procedures_drg", columnList = "ms_drg_definition"),
        uniqueConstraints = @UniqueConstraint(name = "uq_procedure_per_provider_drg",
                columnNames = {"provider_id", "ms_drg_definition"}))
@Getter
@Setter
public class ProcedureOffering {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_id", length = 32, nullable = false)
    private String providerId;

    /** "&lt;code&gt; - &lt;description&gt;", e.g. "470 - MAJOR HIP AND KNEE JOINT REPLACEMENT". */
    @Column(name = "ms_drg_definition", nullable = false)
    private String msDrgDefinition;

    @Column(name = "total_discharges")
    private Integer totalDischarges;

    @Column(name = "average_covered_charges", precision = 14, scale = 2)
    private BigDecimal averageCoveredCharges;

    @Column(name = "average_total_payments", precision = 14, scale = 2)
    private BigDecimal averageTotalPayments;

    @Column(name = "average_medicare_payments", precision = 14, scale = 2)
    private BigDecimal averageMedicarePayments;
}
