package com.wavescope.analytics.persistence;

import com.wavescope.analytics.variant.VariantType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VariantRepository extends JpaRepository<VariantEntity, Long> {

    Optional<VariantEntity> findByTrendIdAndVariantTypeAndVariantName(
            String trendId, VariantType variantType, String variantName);

    List<VariantEntity> findByTrendIdOrderByVariantTypeAscVariantNameAsc(String trendId);
}
