package com.arenahub.gameservice.games.sumo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SumoConfig {

    /** 出界半径：|position| 达到即出界 */
    private int ringSize = 10;
    /** light | medium | heavy */
    private String weightClass = "medium";
    /** 开局冲撞在 turnCount 不超过此值时额外 +1 距离 */
    private int tachiaiBonusWindow = 1;
    private Long seed;
}
