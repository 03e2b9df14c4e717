package com.platform.drcontrol.persistence.repository;

import com.platform.drcontrol.persistence.entity.FailoverRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Spring Data JPA repository for the failover record slot.
 */
@Repository
public interface FailoverRecordJpaRepository extends JpaRepository<FailoverRecordEntity, String> {
}
