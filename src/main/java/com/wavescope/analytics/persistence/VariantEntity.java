package com.wavescope.analytics.persistence;

import com.wavescope.analytics.variant.VariantType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "trend_variant",
       uniqueConstraints = @UniqueConstraint(name = "uk_variant_key",
               columnNames = {"trend_id", "variant_type", "variant_name"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VariantEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trend_id", nullable = false, length = 200)
    private String trendId;

    @Enumerated(EnumType.STRING)
    @Column(name = "variant_type", nullable = false, length = 20)
    private VariantType variantType;

    @Column(name = "variant_name", nullable = false, length = 60)
    private String variantName;

    @Column(name = "time_range_start")
    private LocalDateTime timeRangeStart;

    @Column(name = "time_range_end")
    private LocalDateTime timeRangeEnd;

    /**
     * Typed payload serialized as JSON.
     */
    @Column(name = "payload", length = 16000)
    private String payload;

    @Column(name = "detail_json", length = 4000)
    private String metadata;

    @CreationTimestamp
    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
