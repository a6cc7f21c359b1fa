package com.gastrofeed.catalog.service.variant;

import com.gastrofeed.catalog.model.VariantGroup;

import java.util.List;

/**
 * @param groups     detected families, numbered from 1
 * @param assigned   records whose parent code was set
 * @param extracted  records that received difference attributes
 */
public record VariantDetectionResult(List<VariantGroup> groups, int assigned, int extracted) {
}
