package com.arenahub.gameservice.games.brawler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BrawlerConfig {

    private int stageCount = 3;
    private int wavesPerStage = 3;
    /** 每波敌人数 */
    private int enemyDensity = 3;
    /** 每波刷新地面武器的概率 */
    private double weaponSpawnRate = 0.3;
    private Long seed;
}
