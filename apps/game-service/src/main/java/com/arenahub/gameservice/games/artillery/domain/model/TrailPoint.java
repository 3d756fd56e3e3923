package com.arenahub.gameservice.games.artillery.domain.model;

public record TrailPoint(double x, double y) {
}
