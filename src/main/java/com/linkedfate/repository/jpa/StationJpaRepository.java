package com.linkedfate.repository.jpa;

import com.linkedfate.entity.StationEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface StationJpaRepository extends JpaRepository<StationEntity, Long> {

    Optional<StationEntity> findByExternalId(String externalId);

    List<StationEntity> findByStationType(String stationType, Pageable pageable);
}
