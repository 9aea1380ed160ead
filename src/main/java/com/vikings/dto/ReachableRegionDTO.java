package com.vikings.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One entry of a reachability query.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReachableRegionDTO {
    private int regionId;
    private String name;
    private int cost;
    private List<Integer> path;
}
