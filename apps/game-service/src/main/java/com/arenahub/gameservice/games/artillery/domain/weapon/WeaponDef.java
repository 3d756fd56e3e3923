package com.arenahub.gameservice.games.artillery.domain.weapon;

/**
 * 武器定义（不可变）。fuse 单位为秒，-1 表示碰撞即爆；defaultAmmo 为 -1 表示无限。
 */
public record WeaponDef(
        String slug,
        String name,
        int damage,
        int radius,
        WeaponCategory category,
        int defaultAmmo,
        double speed,
        boolean gravity,
        boolean windAffected,
        double fuse,
        boolean bounces,
        double bounciness,
        int shots,
        int clusters,
        boolean endsTurn) {

    /**
     * 叠加覆盖项得到新定义，自身不变。
     */
    public WeaponDef with(WeaponOverride o) {
        if (o == null) {
            return this;
        }
        return new WeaponDef(
                slug,
                o.getName() != null ? o.getName() : name,
                o.getDamage() != null ? o.getDamage() : damage,
                o.getRadius() != null ? o.getRadius() : radius,
                category,
                o.getDefaultAmmo() != null ? o.getDefaultAmmo() : defaultAmmo,
                o.getSpeed() != null ? o.getSpeed() : speed,
                o.getGravity() != null ? o.getGravity() : gravity,
                o.getWindAffected() != null ? o.getWindAffected() : windAffected,
                o.getFuse() != null ? o.getFuse() : fuse,
                o.getBounces() != null ? o.getBounces() : bounces,
                o.getBounciness() != null ? o.getBounciness() : bounciness,
                o.getShots() != null ? o.getShots() : shots,
                o.getClusters() != null ? o.getClusters() : clusters,
                o.getEndsTurn() != null ? o.getEndsTurn() : endsTurn);
    }

    public boolean infiniteAmmo() {
        return defaultAmmo < 0;
    }
}
