package com.arenahub.gameservice.games.dungeon.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EquipmentSlot {

    private String slot;
    /** 空槽为 null */
    private LootItem item;

    public EquipmentSlot copy() {
        return new EquipmentSlot(slot, item == null ? null : item.copy());
    }
}
