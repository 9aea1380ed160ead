package com.vikings.dto;

import com.vikings.cpu.path.ReachabilitySet;
import com.vikings.model.Region;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.function.IntFunction;

/**
 * Everything a player can reach from a region within a horizon.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReachabilityDTO {
    private int start;
    private int horizon;
    private boolean truncated;
    private List<ReachableRegionDTO> regions;

    public static ReachabilityDTO fromSet(ReachabilitySet set, IntFunction<Region> regionLookup) {
        List<ReachableRegionDTO> entries = set.regionIds().stream()
                .map(id -> ReachableRegionDTO.builder()
                        .regionId(id)
                        .name(regionLookup.apply(id).getName())
                        .cost(set.costOf(id).orElse(0))
                        .path(set.pathTo(id))
                        .build())
                .toList();
        return ReachabilityDTO.builder()
                .start(set.getStart())
                .horizon(set.getHorizon())
                .truncated(set.isTruncated())
                .regions(entries)
                .build();
    }
}
