package com.drautomation.api.repository;

import com.drautomation.api.model.entity.SystemAlert;
import com.drautomation.api.model.enums.AutomationComponent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SystemAlertRepository extends JpaRepository<SystemAlert, String> {

    List<SystemAlert> findAllByOrderByCreatedAtDesc();

    List<SystemAlert> findByResolvedAtIsNullOrderByCreatedAtDesc();

    List<SystemAlert> findByComponentAndResolvedAtIsNull(AutomationComponent component);
}
