package com.arenahub.gameservice.games.artillery.domain.weapon;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * 会话配置里对单个武器的字段覆盖，null 表示沿用默认值。类别不可覆盖。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class WeaponOverride {

    private String name;
    private Integer damage;
    private Integer radius;
    private Integer defaultAmmo;
    private Double speed;
    private Boolean gravity;
    private Boolean windAffected;
    private Double fuse;
    private Boolean bounces;
    private Double bounciness;
    private Integer shots;
    private Integer clusters;
    private Boolean endsTurn;
}
