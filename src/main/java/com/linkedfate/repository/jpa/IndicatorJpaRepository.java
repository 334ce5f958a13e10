package com.linkedfate.repository.jpa;

import com.linkedfate.entity.IndicatorEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface IndicatorJpaRepository extends JpaRepository<IndicatorEntity, Long> {

    Optional<IndicatorEntity> findByCode(String code);
}
