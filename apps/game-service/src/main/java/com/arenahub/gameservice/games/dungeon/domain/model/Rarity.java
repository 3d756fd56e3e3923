package com.arenahub.gameservice.games.dungeon.domain.model;

public enum Rarity {
    COMMON,
    UNCOMMON,
    RARE,
    EPIC
}
