package com.example.CostNavigator.repository;

import com.example.CostNavigator.model.ProcedureOffering;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProcedureOfferingRepository extends JpaRepository<ProcedureOffering, Long> {
}
