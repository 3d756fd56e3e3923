package com.arenahub.gameservice.games.artillery.domain.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 飞行中的弹体（含放置类的炸药与地雷）。fuse 为剩余秒数，-1 表示无引信。
 */
@Data
public class Projectile {

    private String id;
    private String weaponSlug;
    private double x;
    private double y;
    private double vx;
    private double vy;
    private double fuse;
    private double bounciness;
    private List<TrailPoint> trail = new ArrayList<>();
    private boolean active = true;
    /** 发射者虫子 id */
    private String ownerId;
    /** 集束弹分裂出的子弹头 */
    private boolean clusterChild;
    private String homingTargetId;

    public Projectile copy() {
        Projectile p = new Projectile();
        p.id = id;
        p.weaponSlug = weaponSlug;
        p.x = x;
        p.y = y;
        p.vx = vx;
        p.vy = vy;
        p.fuse = fuse;
        p.bounciness = bounciness;
        p.trail = new ArrayList<>(trail);
        p.active = active;
        p.ownerId = ownerId;
        p.clusterChild = clusterChild;
        p.homingTargetId = homingTargetId;
        return p;
    }
}
