package com.vikings.model;

import com.vikings.cpu.Mover;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A player's army on the world map.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Army implements Mover {

    /** Stable identifier, never the display name. */
    private String id;

    private String name;

    private String playerId;

    private int regionId;

    private int movementPoints;

    private int maxMovementPoints;

    private int strength;

    private int maxStrength;

    @Override
    public void spendMovementPoints(int cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("Movement cost must not be negative: " + cost);
        }
        movementPoints = Math.max(0, movementPoints - cost);
    }

    @Override
    public void relocateTo(int regionId) {
        this.regionId = regionId;
    }

    public void restoreMovementPoints() {
        movementPoints = maxMovementPoints;
    }

    public boolean isDepleted() {
        return strength <= 0;
    }
}
