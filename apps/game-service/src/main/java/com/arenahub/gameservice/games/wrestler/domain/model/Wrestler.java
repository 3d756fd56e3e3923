package com.arenahub.gameservice.games.wrestler.domain.model;

import lombok.Data;

/**
 * 摔角手。双打赛里 tagPartner 指向队友，active 表示是否在场上。
 */
@Data
public class Wrestler {

    private int hp;
    private int maxHp;
    private int stamina;
    private int maxStamina;
    private int momentum;
    /** center | ropes | corner | turnbuckle */
    private String position = "center";
    private int ropeBreaksLeft;
    private boolean eliminated;
    private String tagPartner;
    private boolean active = true;
    /** 队伍标识：双打为两人共用，其余赛制为自身 id */
    private String teamId;
    private boolean cpu;

    public Wrestler copy() {
        Wrestler w = new Wrestler();
        w.hp = hp;
        w.maxHp = maxHp;
        w.stamina = stamina;
        w.maxStamina = maxStamina;
        w.momentum = momentum;
        w.position = position;
        w.ropeBreaksLeft = ropeBreaksLeft;
        w.eliminated = eliminated;
        w.tagPartner = tagPartner;
        w.active = active;
        w.teamId = teamId;
        w.cpu = cpu;
        return w;
    }
}
