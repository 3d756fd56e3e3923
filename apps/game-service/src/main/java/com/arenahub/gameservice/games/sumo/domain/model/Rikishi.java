package com.arenahub.gameservice.games.sumo.domain.model;

import com.arenahub.gameservice.games.sumo.domain.constants.SumoTables;
import lombok.Data;

/**
 * 力士。position 为一维坐标，0 是土俵中心。
 */
@Data
public class Rikishi {

    private int position;
    private int balance = SumoTables.MAX_BALANCE;
    private int stamina = SumoTables.MAX_STAMINA;
    private int maxStamina = SumoTables.MAX_STAMINA;
    /** null | mawashi | arm */
    private String grip;
    /** 还没出过手，可以立合冲撞 */
    private boolean tachiai = true;
    private WeightClass weightClass = WeightClass.MEDIUM;
    private String lastAction;
    /** 刚刚冲撞过，对手闪身时会被惩罚 */
    private boolean pendingCharge;
    private boolean cpu;

    public Rikishi copy() {
        Rikishi r = new Rikishi();
        r.position = position;
        r.balance = balance;
        r.stamina = stamina;
        r.maxStamina = maxStamina;
        r.grip = grip;
        r.tachiai = tachiai;
        r.weightClass = weightClass;
        r.lastAction = lastAction;
        r.pendingCharge = pendingCharge;
        r.cpu = cpu;
        return r;
    }
}
