package com.arenahub.gameservice.games.artillery;

import com.arenahub.gameservice.engine.core.BaseGame;
import com.arenahub.gameservice.engine.core.EngineMode;
import com.arenahub.gameservice.engine.core.GameAction;
import com.arenahub.gameservice.engine.core.KernelMessages;
import com.arenahub.gameservice.engine.core.SeededRandom;
import com.arenahub.gameservice.engine.core.Verdict;
import com.arenahub.gameservice.engine.state.ArtilleryState;
import com.arenahub.gameservice.games.artillery.domain.ai.ArtilleryAi;
import com.arenahub.gameservice.games.artillery.domain.constants.ArtilleryMessages;
import com.arenahub.gameservice.games.artillery.domain.model.ArtilleryPlayer;
import com.arenahub.gameservice.games.artillery.domain.model.Crate;
import com.arenahub.gameservice.games.artillery.domain.model.Projectile;
import com.arenahub.gameservice.games.artillery.domain.model.TurnPhase;
import com.arenahub.gameservice.games.artillery.domain.model.Worm;
import com.arenahub.gameservice.games.artillery.domain.physics.Explosions;
import com.arenahub.gameservice.games.artillery.domain.physics.PhysicsSettings;
import com.arenahub.gameservice.games.artillery.domain.physics.ProjectileSimulator;
import com.arenahub.gameservice.games.artillery.domain.physics.Terrain;
import com.arenahub.gameservice.games.artillery.domain.physics.WormPhysics;
import com.arenahub.gameservice.games.artillery.domain.weapon.WeaponCategory;
import com.arenahub.gameservice.games.artillery.domain.weapon.WeaponDef;
import com.arenahub.gameservice.games.artillery.domain.weapon.WeaponRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.arenahub.gameservice.games.artillery.domain.constants.ArtilleryRules.*;

/**
 * 可破坏地形的回合制炮击对战。
 * <p>
 * 物理按 tick 推进，tick 只由外部信号触发（tick 动作，或 NPC 回合内的同步结算循环），没有后台调度。
 * 回合阶段：moving → aiming → retreat → resolving → between_turns → 下一回合。
 * 轮到 NPC 时在同一次调用里代打完整回合：开火后循环结算至多 {@code AUTOPLAY_TICK_CEILING} 个 tick，
 * 超限则强制收尾并发出 autoplay_ceiling_reached。
 */
@Slf4j
public class ArtilleryGame extends BaseGame<ArtilleryState> {

    public static final String SLUG = "artillery";

    private static final Set<String> TURN_ACTIONS = Set.of(
            "move", "jump", "aim", "select_weapon", "set_fuse", "fire", "use_item", "end_turn");

    private final ArtilleryConfig config;
    private final PhysicsSettings physics;
    private final WeaponRegistry weapons;
    private final Explosions explosions;
    private final ProjectileSimulator projectiles;
    private final WormPhysics wormPhysics;
    private final ArtilleryAi ai;

    public ArtilleryGame(ArtilleryConfig config) {
        super(ArtilleryState.class);
        this.config = config == null ? new ArtilleryConfig() : config;
        this.physics = this.config.physicsSettings();
        this.weapons = this.config.weaponRegistry();
        this.explosions = new Explosions(physics, weapons, this::emit);
        this.projectiles = new ProjectileSimulator(physics, weapons, explosions, this::emit);
        this.wormPhysics = new WormPhysics(physics, explosions, this::emit);
        this.ai = new ArtilleryAi(weapons);
    }

    @Override
    public String slug() {
        return SLUG;
    }

    @Override
    public EngineMode mode() {
        return EngineMode.TICK_BASED;
    }

    @Override
    public int minPlayers() {
        return config.isNpcFill() ? 1 : 2;
    }

    @Override
    public int maxPlayers() {
        return config.effectiveMaxPlayers();
    }

    /** 合并覆盖项之后的武器定义，供宿主与测试查看 */
    public Optional<WeaponDef> weapon(String slug) {
        return weapons.find(slug);
    }

    // =================================================================== 初始化

    @Override
    protected ArtilleryState initializeState(List<String> playerIds) {
        ArtilleryState s = new ArtilleryState();
        SeededRandom rng = new SeededRandom(config.getSeed() == null ? 0L : config.getSeed());
        s.setRandom(rng);
        s.setWidth(Math.max(8, config.getMapWidth()));
        s.setHeight(Math.max(8, config.getMapHeight()));
        s.setMode("teams".equals(config.getMode()) ? "teams" : "ffa");

        // 1) NPC 补位
        List<String> all = new ArrayList<>(playerIds);
        if (config.isNpcFill()) {
            for (int i = 0; all.size() < config.effectiveMaxPlayers(); i++) {
                all.add(NPC_PREFIX + i);
            }
        }

        // 2) 地形
        s.setGround(Terrain.generate(s.getWidth(), s.getHeight(), rng));

        // 3) 参战方与虫子，各自在自己的分区里出生
        boolean teams = "teams".equals(s.getMode());
        int teamCount = teams ? Math.max(2, Math.min(4, config.getTeamCount())) : all.size();
        int perPlayer = config.effectiveWormsPerPlayer();
        int hp = config.effectiveWormHp();
        double sectionWidth = (double) s.getWidth() / all.size();
        int nameIndex = 0;
        for (int i = 0; i < all.size(); i++) {
            String pid = all.get(i);
            boolean npc = !playerIds.contains(pid);
            ArtilleryPlayer player = new ArtilleryPlayer();
            player.setId(pid);
            player.setTeamId(teams ? i % teamCount : i);
            player.setNpc(npc);
            player.setWeapons(weapons.startingInventory());
            List<String> names = namePool(npc);
            for (int w = 0; w < perPlayer; w++) {
                Worm worm = new Worm();
                worm.setId(pid + "_w" + w);
                worm.setPlayerId(pid);
                worm.setTeamId(player.getTeamId());
                worm.setName(names.get(nameIndex++ % names.size()));
                double spawnX = Math.floor(sectionWidth * i + sectionWidth * 0.2 + rng.nextDouble() * sectionWidth * 0.6);
                worm.setX(Math.min(s.getWidth() - 1, spawnX));
                worm.setY(s.groundAt((int) worm.getX()) - 1);
                worm.setHp(hp);
                worm.setMaxHp(hp);
                worm.setFacingRight(i < all.size() / 2.0);
                s.getWorms().put(worm.getId(), worm);
                player.getWormIds().add(worm.getId());
            }
            s.getPlayers().put(pid, player);
        }

        // 4) 出手顺序随机
        List<String> order = new ArrayList<>(all);
        rng.shuffle(order);
        s.setTurnOrder(order);
        s.setCurrentTurnIndex(0);
        ArtilleryPlayer first = s.getPlayers().get(order.get(0));
        s.setActiveWormId(first.getWormIds().get(0));
        first.setWormCycleIndex(1);

        s.setTurnPhase(TurnPhase.MOVING);
        s.setWind(physics.windEnabled() ? rng.between(-WIND_RANGE, WIND_RANGE) : 0);
        s.setWaterLevel(s.getHeight() - WATER_MARGIN);
        s.setRoundTimeRemaining(config.getRoundTime());
        resetTurnFields(s);

        emit("turn_start", order.get(0), turnStartData(s));
        log.info("[artillery] 地图 {}x{} 参战方={} 先手={}", s.getWidth(), s.getHeight(), all, order.get(0));

        // 5) NPC 先手则当场代打
        runNpcTurns(s);
        return s;
    }

    private List<String> namePool(boolean npc) {
        List<String> custom = config.getWormNames();
        if (custom != null && !custom.isEmpty()) {
            return custom;
        }
        return npc ? NPC_WORM_NAMES : HUMAN_WORM_NAMES;
    }

    // =================================================================== 动作分发

    @Override
    protected Verdict processAction(ArtilleryState s, String pid, GameAction action) {
        s.setLastSignalAt(action.timestamp());
        if (s.getTurnStartedAt() == 0 && action.timestamp() > 0) {
            s.setTurnStartedAt(action.timestamp());
        }

        String type = action.type();
        Verdict v;
        if (TURN_ACTIONS.contains(type)) {
            String current = s.currentPlayerId();
            if (!pid.equals(current)) {
                return Verdict.reject(KernelMessages.formatNotYourTurn(current));
            }
            v = switch (type) {
                case "move" -> move(s, action);
                case "jump" -> jump(s, pid, action);
                case "aim" -> aim(s, action);
                case "select_weapon" -> selectWeapon(s, pid, action);
                case "set_fuse" -> setFuse(s, action);
                case "use_item" -> fire(s, pid, withItemAsWeapon(action), false);
                case "end_turn" -> endTurn(s);
                default -> fire(s, pid, action, false);
            };
        } else if ("tick".equals(type)) {
            v = tick(s, action);
        } else if ("npc_turn".equals(type)) {
            ArtilleryPlayer current = s.getPlayers().get(s.currentPlayerId());
            v = current != null && current.isNpc() ? Verdict.accept() : Verdict.reject(ArtilleryMessages.NOT_NPC_TURN);
        } else {
            return Verdict.reject(KernelMessages.formatUnknownAction(type));
        }

        if (v.accepted() && !s.isGameOver()) {
            runNpcTurns(s);
        }
        return v;
    }

    private static GameAction withItemAsWeapon(GameAction action) {
        Map<String, Object> payload = new LinkedHashMap<>(action.payload());
        Object item = payload.get("item");
        if (item != null) {
            payload.put("weapon", item);
        }
        return new GameAction("fire", payload, action.timestamp());
    }

    // =================================================================== 移动

    private Verdict move(ArtilleryState s, GameAction action) {
        if (!canMove(s)) return Verdict.reject(ArtilleryMessages.CANNOT_MOVE);
        Worm worm = activeWorm(s);
        if (worm == null) return Verdict.reject(ArtilleryMessages.NO_ACTIVE_WORM);
        if (worm.moving()) return Verdict.reject(ArtilleryMessages.AIRBORNE);
        Integer dir = direction(action);
        if (dir == null) return Verdict.reject(ArtilleryMessages.INVALID_DIRECTION);

        double newX = worm.getX() + dir * physics.walkSpeed();
        if (newX < 0 || newX >= s.getWidth()) {
            return Verdict.reject(ArtilleryMessages.OUT_OF_BOUNDS);
        }
        int targetGround = s.groundAt((int) Math.floor(newX));
        int currentGround = s.groundAt((int) Math.floor(worm.getX()));
        if (currentGround - targetGround > MAX_CLIMB) {
            return Verdict.reject(ArtilleryMessages.SLOPE_TOO_STEEP);
        }
        worm.setFacingRight(dir > 0);
        worm.setX(newX);
        worm.setY(targetGround - 1);
        collectCrates(s, worm);
        return Verdict.accept();
    }

    private Verdict jump(ArtilleryState s, String pid, GameAction action) {
        if (!canMove(s)) return Verdict.reject(ArtilleryMessages.CANNOT_MOVE);
        Worm worm = activeWorm(s);
        if (worm == null) return Verdict.reject(ArtilleryMessages.NO_ACTIVE_WORM);
        if (worm.moving()) return Verdict.reject(ArtilleryMessages.AIRBORNE);
        if (action.payload().containsKey("direction")) {
            Integer dir = direction(action);
            if (dir == null) return Verdict.reject(ArtilleryMessages.INVALID_DIRECTION);
            worm.setFacingRight(dir > 0);
        }
        boolean backflip = action.bool("backflip").orElse(false)
                || "backflip".equals(action.string("type").orElse(null));
        int facing = worm.isFacingRight() ? 1 : -1;
        if (backflip) {
            worm.setVx(BACKFLIP_VX * facing);
            worm.setVy(-physics.jumpForce() * BACKFLIP_LIFT);
        } else {
            worm.setVx(JUMP_FORWARD_VX * facing);
            worm.setVy(-physics.jumpForce());
        }
        worm.setFallStartY(worm.getY());
        emit("worm_jump", pid, Map.of("wormId", worm.getId(), "type", backflip ? "backflip" : "forward"));
        return Verdict.accept();
    }

    private static Integer direction(GameAction action) {
        String d = action.string("direction").orElse(null);
        if ("left".equals(d)) return -1;
        if ("right".equals(d)) return 1;
        return null;
    }

    private static boolean canMove(ArtilleryState s) {
        TurnPhase p = s.getTurnPhase();
        return p == TurnPhase.MOVING || p == TurnPhase.AIMING || p == TurnPhase.RETREAT;
    }

    private static boolean canAim(ArtilleryState s) {
        return !s.isHasFiredThisTurn()
                && (s.getTurnPhase() == TurnPhase.MOVING || s.getTurnPhase() == TurnPhase.AIMING);
    }

    // =================================================================== 瞄准

    private Verdict aim(ArtilleryState s, GameAction action) {
        if (!canAim(s)) return Verdict.reject(ArtilleryMessages.CANNOT_FIRE);
        Optional<Double> angle = action.decimal("angle");
        if (angle.isEmpty()) return Verdict.reject(ArtilleryMessages.INVALID_ANGLE);
        Double power = null;
        if (action.payload().containsKey("power")) {
            power = action.decimal("power").orElse(null);
            if (power == null || power < 0 || power > 100) return Verdict.reject(ArtilleryMessages.INVALID_POWER);
        }
        s.setAimAngle(angle.get());
        if (power != null) s.setPower(power);
        setPhase(s, TurnPhase.AIMING);
        return Verdict.accept();
    }

    private Verdict selectWeapon(ArtilleryState s, String pid, GameAction action) {
        if (!canAim(s)) return Verdict.reject(ArtilleryMessages.CANNOT_FIRE);
        String slug = action.string("weapon").orElse("");
        if (WeaponRegistry.isFragment(slug) || weapons.find(slug).isEmpty()) {
            return Verdict.reject(ArtilleryMessages.UNKNOWN_WEAPON, slug);
        }
        if (s.getPlayers().get(pid).ammoOf(slug) == 0) {
            return Verdict.reject(ArtilleryMessages.NO_AMMO, slug);
        }
        s.setSelectedWeapon(slug);
        return Verdict.accept();
    }

    private Verdict setFuse(ArtilleryState s, GameAction action) {
        if (!canAim(s)) return Verdict.reject(ArtilleryMessages.CANNOT_FIRE);
        Integer fuse = action.integer("fuse").orElse(null);
        if (fuse == null || fuse < MIN_FUSE || fuse > MAX_FUSE) {
            return Verdict.reject(ArtilleryMessages.INVALID_FUSE);
        }
        s.setFuseTimer(fuse);
        return Verdict.accept();
    }

    // =================================================================== 开火

    /**
     * 开火。所有校验（阶段、武器、弹药、参数、传送目标）都在扣弹药之前完成。
     */
    private Verdict fire(ArtilleryState s, String pid, GameAction action, boolean npc) {
        if (!canAim(s)) {
            return Verdict.reject(s.isHasFiredThisTurn() ? ArtilleryMessages.ALREADY_FIRED : ArtilleryMessages.CANNOT_FIRE);
        }
        Worm worm = activeWorm(s);
        if (worm == null) return Verdict.reject(ArtilleryMessages.NO_ACTIVE_WORM);

        String slug = action.string("weapon").orElse(s.getSelectedWeapon());
        WeaponDef weapon = WeaponRegistry.isFragment(slug) ? null : weapons.find(slug).orElse(null);
        if (weapon == null) return Verdict.reject(ArtilleryMessages.UNKNOWN_WEAPON, slug);
        ArtilleryPlayer player = s.getPlayers().get(pid);
        if (player.ammoOf(slug) == 0) return Verdict.reject(ArtilleryMessages.NO_AMMO, slug);

        double angle = s.getAimAngle();
        if (action.payload().containsKey("angle")) {
            Optional<Double> a = action.decimal("angle");
            if (a.isEmpty()) return Verdict.reject(ArtilleryMessages.INVALID_ANGLE);
            angle = a.get();
        }
        double power = s.getPower();
        if (action.payload().containsKey("power")) {
            Optional<Double> p = action.decimal("power");
            if (p.isEmpty()) return Verdict.reject(ArtilleryMessages.INVALID_POWER);
            power = Math.max(0, Math.min(100, p.get()));
        }
        Double targetX = null;
        Double targetY = null;
        if (action.payload().containsKey("x") || action.payload().containsKey("targetX")) {
            targetX = action.decimal("x").or(() -> action.decimal("targetX")).orElse(null);
            if (targetX == null) return Verdict.reject(ArtilleryMessages.INVALID_COORDINATE);
        }
        if (action.payload().containsKey("y") || action.payload().containsKey("targetY")) {
            targetY = action.decimal("y").or(() -> action.decimal("targetY")).orElse(null);
            if (targetY == null) return Verdict.reject(ArtilleryMessages.INVALID_COORDINATE);
        }
        if ("teleport".equals(slug)) {
            double tx = targetX == null ? worm.getX() : targetX;
            double ty = targetY == null ? worm.getY() : targetY;
            if (tx < 0 || tx >= s.getWidth() || ty < 0 || ty >= s.getHeight()) {
                return Verdict.reject(ArtilleryMessages.TELEPORT_OUT_OF_BOUNDS);
            }
        }

        // 校验完毕，开始修改
        if (player.ammoOf(slug) > 0) {
            player.getWeapons().put(slug, player.ammoOf(slug) - 1);
        }
        s.setSelectedWeapon(slug);
        s.setAimAngle(angle);
        s.setPower(power);
        if (action.payload().containsKey("angle")) {
            worm.setFacingRight(Math.cos(angle) >= 0);
        }

        if (weapon.category() == WeaponCategory.UTILITY) {
            useUtility(s, pid, worm, weapon, angle, targetX, targetY);
            return Verdict.accept();
        }

        switch (weapon.category()) {
            case HITSCAN -> fireHitscan(s, worm, weapon, angle);
            case MELEE -> fireMelee(s, worm, weapon);
            case PLACED -> spawnProjectile(s, "placed_", weapon, worm.getX(), worm.getY(), 0, 0, weapon.fuse(), worm.getId());
            case AREA_STRIKE -> fireAirStrike(s, worm, weapon,
                    targetX != null ? targetX : worm.getX() + (worm.isFacingRight() ? AIRSTRIKE_DEFAULT_OFFSET : -AIRSTRIKE_DEFAULT_OFFSET));
            default -> launch(s, worm, weapon, angle, power);
        }
        s.setHasFiredThisTurn(true);
        if (weapon.endsTurn()) {
            setPhase(s, TurnPhase.RETREAT);
            s.setRetreatStartedAt(s.getLastSignalAt());
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("weapon", slug);
        data.put("angle", angle);
        data.put("power", power);
        data.put("wormId", worm.getId());
        if (npc) data.put("npc", true);
        emit("weapon_fire", pid, data);
        return Verdict.accept();
    }

    private void launch(ArtilleryState s, Worm worm, WeaponDef weapon, double angle, double power) {
        double speed = weapon.speed() * (power / 100);
        double fuse = weapon.bounces() ? s.getFuseTimer() : weapon.fuse();
        Projectile p = spawnProjectile(s, "proj_", weapon, worm.getX(), worm.getY() - MUZZLE_OFFSET,
                Math.cos(angle) * speed, Math.sin(angle) * speed, fuse, worm.getId());
        if (weapon.category() == WeaponCategory.HOMING) {
            p.setHomingTargetId(nearestEnemy(s, worm).map(Worm::getId).orElse(null));
        }
    }

    private Projectile spawnProjectile(ArtilleryState s, String prefix, WeaponDef weapon, double x, double y,
                                       double vx, double vy, double fuse, String ownerId) {
        s.setNextProjectileId(s.getNextProjectileId() + 1);
        Projectile p = new Projectile();
        p.setId(prefix + s.getNextProjectileId());
        p.setWeaponSlug(weapon.slug());
        p.setX(x);
        p.setY(y);
        p.setVx(vx);
        p.setVy(vy);
        p.setFuse(fuse);
        p.setBounciness(weapon.bounciness());
        p.setOwnerId(ownerId);
        s.getProjectiles().add(p);
        return p;
    }

    private void fireAirStrike(ArtilleryState s, Worm worm, WeaponDef weapon, double targetX) {
        double startX = targetX - (weapon.shots() - 1) * AIRSTRIKE_SPACING / 2;
        for (int i = 0; i < weapon.shots(); i++) {
            spawnProjectile(s, "air_", weapon, startX + i * AIRSTRIKE_SPACING, -20 - i * 10,
                    0, weapon.speed(), -1, worm.getId());
        }
    }

    /** 射线逐步推进，碰地留小坑，碰到虫子直接结算 */
    private void fireHitscan(ArtilleryState s, Worm shooter, WeaponDef weapon, double angle) {
        double dx = Math.cos(angle) * HITSCAN_STEP;
        double dy = Math.sin(angle) * HITSCAN_STEP;
        for (int shot = 0; shot < weapon.shots(); shot++) {
            double hx = shooter.getX();
            double hy = shooter.getY() - MUZZLE_OFFSET;
            Worm hit = null;
            for (int step = 0; step < HITSCAN_STEPS && hit == null; step++) {
                hx += dx;
                hy += dy;
                if (hx < 0 || hx >= s.getWidth() || hy < 0 || hy >= s.getHeight()) break;
                if (hy >= s.getGround()[(int) Math.floor(hx)]) {
                    Terrain.carveCrater(s, hx, hy, HITSCAN_CRATER);
                    break;
                }
                for (Worm w : s.getWorms().values()) {
                    if (w.isAlive() && !w.getId().equals(shooter.getId())
                            && Math.hypot(w.getX() - hx, w.getY() - hy) < HITSCAN_HIT_RADIUS) {
                        hit = w;
                        break;
                    }
                }
            }
            if (hit == null) continue;
            double knock = Math.atan2(hit.getY() - shooter.getY(), hit.getX() - shooter.getX());
            hit.setVx(hit.getVx() + Math.cos(knock) * HITSCAN_KNOCKBACK);
            hit.setVy(hit.getVy() + Math.sin(knock) * HITSCAN_KNOCKBACK - 2);
            explosions.applyDamage(hit, weapon.damage(), shooter.getId(), weapon.slug());
            emit("hitscan_hit", shooter.getPlayerId(), Map.of(
                    "weapon", weapon.slug(), "hitX", hx, "hitY", hy, "targetWorm", hit.getId()));
        }
    }

    private void fireMelee(ArtilleryState s, Worm attacker, WeaponDef weapon) {
        Worm target = null;
        double best = Double.MAX_VALUE;
        for (Worm w : s.getWorms().values()) {
            if (!w.isAlive() || w.getId().equals(attacker.getId())) continue;
            double d = Math.hypot(w.getX() - attacker.getX(), w.getY() - attacker.getY());
            if (d < MELEE_RANGE && d < best) {
                best = d;
                target = w;
            }
        }
        if (target == null) {
            emit("melee_miss", attacker.getPlayerId(), Map.of("weapon", weapon.slug()));
            return;
        }
        double kb = switch (weapon.slug()) {
            case "baseball-bat" -> BAT_KNOCKBACK;
            case "prod" -> PROD_KNOCKBACK;
            default -> MELEE_KNOCKBACK;
        };
        int dir = attacker.isFacingRight() ? 1 : -1;
        target.setVx(dir * kb);
        target.setVy(-kb * 0.5);
        explosions.applyDamage(target, weapon.damage(), attacker.getId(), weapon.slug());
        emit("melee_hit", attacker.getPlayerId(), Map.of(
                "weapon", weapon.slug(), "targetWorm", target.getId(), "damage", weapon.damage(), "knockback", kb));
    }

    /**
     * 工具类武器直接改位置或地形。只有忍者绳不结束回合。
     */
    private void useUtility(ArtilleryState s, String pid, Worm worm, WeaponDef weapon, double angle,
                            Double targetX, Double targetY) {
        int dir = worm.isFacingRight() ? 1 : -1;
        switch (weapon.slug()) {
            case "teleport" -> {
                worm.setX(targetX == null ? worm.getX() : targetX);
                worm.setY(targetY == null ? worm.getY() : targetY);
                worm.setVx(0);
                worm.setVy(0);
                emit("teleport", pid, Map.of("wormId", worm.getId(), "x", worm.getX(), "y", worm.getY()));
                finishUtility(s, weapon);
            }
            case "ninja-rope" -> {
                double nx = Math.max(0, Math.min(s.getWidth() - 1, worm.getX() + Math.cos(angle) * NINJA_ROPE_LENGTH));
                worm.setX(nx);
                worm.setY(s.groundAt((int) Math.floor(nx)) - 1);
                collectCrates(s, worm);
                emit("ninja_rope", pid, Map.of("wormId", worm.getId(), "x", nx));
                finishUtility(s, weapon);
            }
            case "girder" -> {
                double gx = targetX != null ? targetX : worm.getX() + dir * GIRDER_HALF_WIDTH * 2;
                double gy = targetY != null ? targetY : worm.getY() - 20;
                Terrain.placeGirder(s, gx, gy, GIRDER_HALF_WIDTH);
                emit("girder_placed", pid, Map.of("x", gx, "y", gy));
                finishUtility(s, weapon);
            }
            case "blowtorch" -> {
                Terrain.tunnel(s, worm.getX(), worm.getY(), dir, BLOWTORCH_LENGTH);
                worm.setX(Math.max(0, Math.min(s.getWidth() - 1, worm.getX() + dir * BLOWTORCH_LENGTH * 0.8)));
                for (Worm w : s.getWorms().values()) {
                    if (w.isAlive() && !w.getId().equals(worm.getId())
                            && Math.abs(w.getX() - worm.getX()) < BLOWTORCH_LENGTH
                            && Math.abs(w.getY() - worm.getY()) < 10) {
                        explosions.applyDamage(w, weapon.damage(), worm.getId(), weapon.slug());
                    }
                }
                emit("blowtorch", pid, Map.of("wormId", worm.getId()));
                finishUtility(s, weapon);
            }
            case "drill" -> {
                Terrain.drill(s, worm.getX(), worm.getY(), DRILL_DEPTH);
                worm.setY(worm.getY() + DRILL_DEPTH * 0.8);
                for (Worm w : s.getWorms().values()) {
                    if (w.isAlive() && !w.getId().equals(worm.getId())
                            && Math.abs(w.getX() - worm.getX()) < 5
                            && w.getY() > worm.getY() - DRILL_DEPTH && w.getY() < worm.getY()) {
                        explosions.applyDamage(w, weapon.damage(), worm.getId(), weapon.slug());
                    }
                }
                if (worm.getY() >= s.getWaterLevel()) {
                    wormPhysics.drown(worm);
                }
                emit("drill", pid, Map.of("wormId", worm.getId()));
                finishUtility(s, weapon);
            }
            default -> {
                emit("turn_skipped", pid, Map.of("reason", weapon.slug()));
                finishUtility(s, weapon);
            }
        }
    }

    /**
     * 喷灯与钻头之后还有撤退时间；传送、钢梁、跳过立即换人；不结束回合的工具什么都不做。
     */
    private void finishUtility(ArtilleryState s, WeaponDef weapon) {
        if (!weapon.endsTurn()) {
            return;
        }
        s.setHasFiredThisTurn(true);
        if ("blowtorch".equals(weapon.slug()) || "drill".equals(weapon.slug())) {
            setPhase(s, TurnPhase.RETREAT);
            s.setRetreatStartedAt(s.getLastSignalAt());
        } else {
            advanceTurn(s);
        }
    }

    private Verdict endTurn(ArtilleryState s) {
        if (s.getTurnPhase() == TurnPhase.RESOLVING) {
            return Verdict.accept();
        }
        if (s.isHasFiredThisTurn() || projectiles.anyActive(s) || wormPhysics.anyMoving(s)) {
            // 先让场上的东西落定
            setPhase(s, TurnPhase.RESOLVING);
        } else {
            advanceTurn(s);
        }
        return Verdict.accept();
    }

    // =================================================================== tick

    private Verdict tick(ArtilleryState s, GameAction action) {
        int count = 1;
        if (action.payload().containsKey("count")) {
            Integer c = action.integer("count").orElse(null);
            if (c == null || c < 1 || c > MAX_TICKS_PER_SIGNAL) {
                return Verdict.reject(ArtilleryMessages.INVALID_TICK_COUNT, MAX_TICKS_PER_SIGNAL);
            }
            count = c;
        }
        int turnAtStart = s.getTurnCount();
        for (int i = 0; i < count && !s.isGameOver() && s.getTurnCount() == turnAtStart; i++) {
            checkTimers(s);
            resolveTick(s);
        }
        return Verdict.accept();
    }

    /**
     * 回合与撤退计时：按动作时间戳比较，或按已推进的 tick 数折算，先到为准。
     */
    private void checkTimers(ArtilleryState s) {
        long now = s.getLastSignalAt();
        TurnPhase phase = s.getTurnPhase();
        if (phase == TurnPhase.MOVING || phase == TurnPhase.AIMING) {
            long limitMs = config.getTurnTime() * 1000L;
            boolean byClock = now > 0 && s.getTurnStartedAt() > 0 && now - s.getTurnStartedAt() > limitMs;
            boolean byTicks = s.getPhaseTicks() >= config.getTurnTime() * TICKS_PER_SECOND;
            if (byClock || byTicks) {
                emit("turn_timeout", s.currentPlayerId());
                setPhase(s, TurnPhase.RESOLVING);
            }
        } else if (phase == TurnPhase.RETREAT) {
            long limitMs = config.getRetreatTime() * 1000L;
            boolean byClock = now > 0 && s.getRetreatStartedAt() > 0 && now - s.getRetreatStartedAt() > limitMs;
            boolean byTicks = s.getPhaseTicks() >= config.getRetreatTime() * TICKS_PER_SECOND;
            if (byClock || byTicks) {
                setPhase(s, TurnPhase.RESOLVING);
            }
        }
    }

    /**
     * 单个物理 tick：弹体 → 虫子 → 补给箱 → 结算判定 → 回合时钟与突然死亡。
     */
    private void resolveTick(ArtilleryState s) {
        s.setTotalTicks(s.getTotalTicks() + 1);
        s.setPhaseTicks(s.getPhaseTicks() + 1);

        projectiles.step(s);
        boolean wormsMoved = wormPhysics.step(s);
        dropCrates(s);
        Worm active = activeWorm(s);
        if (active != null && !active.moving()) {
            collectCrates(s, active);
        }

        if (s.getTurnPhase() == TurnPhase.RESOLVING && !projectiles.anyActive(s)
                && !wormsMoved && !wormPhysics.anyMoving(s)) {
            setPhase(s, TurnPhase.BETWEEN_TURNS);
            refreshAlive(s);
            if (aliveTeams(s) <= 1) {
                s.setGameOver(true);
            } else {
                advanceTurn(s);
            }
        }

        if (!s.isSuddenDeath()) {
            s.setRoundTimeRemaining(s.getRoundTimeRemaining() - SECONDS_PER_TICK);
            if (s.getRoundTimeRemaining() <= 0) {
                triggerSuddenDeath(s);
            }
        } else {
            applySuddenDeath(s);
        }
        if (!s.isGameOver() && aliveTeams(s) <= 1) {
            s.setGameOver(true);
        }
    }

    // =================================================================== 回合流转

    /**
     * 换下一位：重算存活、剔除出局者（当前行动者被剔除时下标原地夹回），
     * 轮换该方的虫子，重置回合字段，重抽风向，可能掉落补给箱，扣回合时钟。
     */
    private void advanceTurn(ArtilleryState s) {
        refreshAlive(s);
        String current = s.currentPlayerId();
        int oldIndex = s.getCurrentTurnIndex();
        List<String> order = new ArrayList<>();
        for (String pid : s.getTurnOrder()) {
            if (s.getPlayers().get(pid).isAlive()) order.add(pid);
        }
        s.setTurnOrder(order);
        if (aliveTeams(s) <= 1 || order.isEmpty()) {
            s.setGameOver(true);
            return;
        }
        int pos = order.indexOf(current);
        int next = pos >= 0 ? (pos + 1) % order.size() : Math.min(oldIndex, order.size() - 1) % order.size();
        s.setCurrentTurnIndex(next);
        s.setTurnCount(s.getTurnCount() + 1);

        ArtilleryPlayer player = s.getPlayers().get(order.get(next));
        List<String> alive = player.getWormIds().stream()
                .filter(id -> s.getWorms().get(id).isAlive())
                .toList();
        s.setActiveWormId(alive.get(player.getWormCycleIndex() % alive.size()));
        player.setWormCycleIndex((player.getWormCycleIndex() + 1) % alive.size());

        setPhase(s, TurnPhase.MOVING);
        s.setTurnStartedAt(s.getLastSignalAt());
        resetTurnFields(s);
        if (physics.windEnabled()) {
            s.setWind(s.getRandom().between(-WIND_RANGE, WIND_RANGE));
        }
        if (s.getRandom().chance(Math.max(0, Math.min(10, config.getCrateFrequency())) / 10.0)) {
            spawnCrate(s);
        }
        if (!s.isSuddenDeath()) {
            s.setRoundTimeRemaining(s.getRoundTimeRemaining() - config.getTurnTime());
            if (s.getRoundTimeRemaining() <= 0) {
                triggerSuddenDeath(s);
            }
        }
        emit("turn_start", player.getId(), turnStartData(s));
    }

    private void resetTurnFields(ArtilleryState s) {
        s.setHasFiredThisTurn(false);
        s.setRetreatStartedAt(0);
        s.setSelectedWeapon(WeaponRegistry.DEFAULT_WEAPON);
        s.setAimAngle(0);
        s.setPower(50);
    }

    private static Map<String, Object> turnStartData(ArtilleryState s) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("activeWorm", s.getActiveWormId());
        data.put("wind", s.getWind());
        data.put("turnNumber", s.getTurnCount());
        return data;
    }

    private static void setPhase(ArtilleryState s, TurnPhase phase) {
        s.setTurnPhase(phase);
        s.setPhaseTicks(0);
    }

    // =================================================================== NPC 代打

    /**
     * 只要轮到 NPC 就同步代打，单次调用最多连打 {@code MAX_CHAINED_NPC_TURNS} 回合，
     * 剩下的留给下一次 tick / npc_turn。
     */
    private void runNpcTurns(ArtilleryState s) {
        int chained = 0;
        while (!s.isGameOver() && aliveTeams(s) > 1 && chained < MAX_CHAINED_NPC_TURNS) {
            String pid = s.currentPlayerId();
            ArtilleryPlayer player = pid == null ? null : s.getPlayers().get(pid);
            if (player == null || !player.isNpc()) {
                return;
            }
            playNpcTurn(s, pid);
            chained++;
        }
        if (chained >= MAX_CHAINED_NPC_TURNS) {
            log.debug("[artillery] 连续代打 {} 个 NPC 回合，剩余留待下次信号", chained);
        }
    }

    private void playNpcTurn(ArtilleryState s, String pid) {
        int turnAtStart = s.getTurnCount();
        GameAction suggestion = ai.suggest(s, pid);
        if (suggestion == null) {
            advanceTurn(s);
            return;
        }
        Verdict v = fire(s, pid, suggestion, true);
        if (!v.accepted()) {
            log.debug("[artillery] NPC {} 开火被拒绝 reason={}，跳过回合", pid, v.reason());
            advanceTurn(s);
            return;
        }
        if (s.getTurnCount() != turnAtStart || s.isGameOver()) {
            return;
        }
        // NPC 没有撤退时间，直接进入结算
        setPhase(s, TurnPhase.RESOLVING);
        int ticks = 0;
        while (s.getTurnPhase() == TurnPhase.RESOLVING && !s.isGameOver() && ticks < AUTOPLAY_TICK_CEILING) {
            resolveTick(s);
            ticks++;
        }
        if (s.getTurnPhase() == TurnPhase.RESOLVING && !s.isGameOver()) {
            forceSettle(s, pid, ticks);
        }
    }

    /** 结算超限：弹体作废、运动清零，直接进入下一回合 */
    private void forceSettle(ArtilleryState s, String pid, int ticks) {
        log.warn("[artillery] NPC {} 回合结算超过 {} tick，强制收尾", pid, ticks);
        s.getProjectiles().clear();
        for (Worm w : s.getWorms().values()) {
            w.setVx(0);
            w.setVy(0);
            w.setFallStartY(null);
        }
        emit("autoplay_ceiling_reached", pid, Map.of("ticks", ticks));
        setPhase(s, TurnPhase.BETWEEN_TURNS);
        refreshAlive(s);
        if (aliveTeams(s) <= 1) {
            s.setGameOver(true);
        } else {
            advanceTurn(s);
        }
    }

    // =================================================================== 补给箱

    private void spawnCrate(ArtilleryState s) {
        SeededRandom rng = s.getRandom();
        int span = s.getWidth() - 2 * CRATE_MARGIN;
        double x = span > 0 ? rng.nextInt(span) + CRATE_MARGIN : s.getWidth() / 2.0;
        String type = rng.pick(CRATE_TYPES);
        String content = switch (type) {
            case "health" -> "medkit";
            case "weapon" -> rng.pick(CRATE_WEAPONS);
            default -> rng.pick(CRATE_UTILITIES);
        };
        s.setNextCrateId(s.getNextCrateId() + 1);
        Crate c = new Crate();
        c.setId("crate_" + s.getNextCrateId());
        c.setX(x);
        c.setY(0);
        c.setType(type);
        c.setContent(content);
        s.getCrates().add(c);
        emit("crate_drop", null, Map.of("crateId", c.getId(), "type", type));
    }

    /** 下落中的箱子每 tick 降 1 像素，落地停住，落水移除 */
    private void dropCrates(ArtilleryState s) {
        s.getCrates().removeIf(c -> {
            if (!c.isFalling()) return false;
            c.setY(c.getY() + 1);
            int ground = s.groundAt((int) Math.floor(c.getX()));
            if (c.getY() >= s.getWaterLevel()) return true;
            if (c.getY() >= ground - 1) {
                c.setY(ground - 1);
                c.setFalling(false);
            }
            return false;
        });
    }

    /**
     * 拾取附近已落地的箱子。医疗箱是唯一能回血的途径。
     */
    private void collectCrates(ArtilleryState s, Worm worm) {
        ArtilleryPlayer player = s.getPlayers().get(worm.getPlayerId());
        s.getCrates().removeIf(c -> {
            if (c.isFalling() || Math.hypot(worm.getX() - c.getX(), worm.getY() - c.getY()) >= CRATE_PICKUP_RADIUS) {
                return false;
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("type", c.getType());
            data.put("wormId", worm.getId());
            if ("health".equals(c.getType())) {
                int amount = config.getHealthCrateAmount();
                worm.setHp(Math.min(worm.getMaxHp(), worm.getHp() + amount));
                data.put("amount", amount);
            } else {
                int current = player.ammoOf(c.getContent());
                player.getWeapons().put(c.getContent(), current < 0 ? current : current + 1);
                data.put("content", c.getContent());
            }
            emit("crate_collected", worm.getPlayerId(), data);
            return true;
        });
    }

    // =================================================================== 突然死亡

    private void triggerSuddenDeath(ArtilleryState s) {
        s.setSuddenDeath(true);
        String type = suddenDeathType();
        if ("one-hp".equals(type)) {
            for (Worm w : s.getWorms().values()) {
                if (w.isAlive()) w.setHp(Math.min(w.getHp(), 1));
            }
        }
        emit("sudden_death", null, Map.of("type", type));
        log.info("[artillery] 回合时钟耗尽，进入突然死亡 type={}", type);
    }

    private void applySuddenDeath(ArtilleryState s) {
        String type = suddenDeathType();
        if ("water-rise".equals(type)) {
            s.setWaterLevel(s.getWaterLevel() - config.waterRisePerTick());
            for (Worm w : s.getWorms().values()) {
                if (w.isAlive() && w.getY() >= s.getWaterLevel()) {
                    wormPhysics.drown(w);
                }
            }
        } else if ("nuke".equals(type) && s.getTotalTicks() % NUKE_INTERVAL_TICKS == 0) {
            for (Worm w : s.getWorms().values()) {
                if (!w.isAlive()) continue;
                w.setHp(Math.max(0, w.getHp() - 1));
                if (w.getHp() <= 0) {
                    w.setAlive(false);
                    emit("worm_poisoned", w.getPlayerId(), Map.of("wormId", w.getId()));
                }
            }
        }
    }

    private String suddenDeathType() {
        String t = config.getSuddenDeathType();
        return "one-hp".equals(t) || "nuke".equals(t) ? t : "water-rise";
    }

    // =================================================================== 工具

    private static Worm activeWorm(ArtilleryState s) {
        Worm w = s.getActiveWormId() == null ? null : s.getWorms().get(s.getActiveWormId());
        return w != null && w.isAlive() ? w : null;
    }

    private static Optional<Worm> nearestEnemy(ArtilleryState s, Worm from) {
        Worm best = null;
        double bestDist = Double.MAX_VALUE;
        for (Worm w : s.getWorms().values()) {
            if (!w.isAlive() || w.getTeamId() == from.getTeamId()) continue;
            double d = Math.hypot(w.getX() - from.getX(), w.getY() - from.getY());
            if (d < bestDist) {
                bestDist = d;
                best = w;
            }
        }
        return Optional.ofNullable(best);
    }

    private static void refreshAlive(ArtilleryState s) {
        for (ArtilleryPlayer p : s.getPlayers().values()) {
            p.setAlive(p.getWormIds().stream().anyMatch(id -> s.getWorms().get(id).isAlive()));
        }
    }

    private static int aliveTeams(ArtilleryState s) {
        Set<Integer> teams = new HashSet<>();
        for (Worm w : s.getWorms().values()) {
            if (w.isAlive()) teams.add(w.getTeamId());
        }
        return teams.size();
    }

    // =================================================================== 内核钩子

    /** 只看得到己方队伍的武器库存 */
    @Override
    protected ArtilleryState projectForPlayer(ArtilleryState copy, String playerId) {
        ArtilleryPlayer viewer = copy.getPlayers().get(playerId);
        for (ArtilleryPlayer p : copy.getPlayers().values()) {
            if (viewer == null || p.getTeamId() != viewer.getTeamId()) {
                p.setWeapons(new LinkedHashMap<>());
            }
        }
        return copy;
    }

    @Override
    protected String phaseOf(ArtilleryState s) {
        return s.getTurnPhase().label();
    }

    @Override
    protected boolean isEliminated(ArtilleryState s, String playerId) {
        ArtilleryPlayer p = s.getPlayers().get(playerId);
        return p == null || p.getWormIds().stream().noneMatch(id -> s.getWorms().get(id).isAlive());
    }

    @Override
    protected Set<String> spectatorActions() {
        return Set.of("tick", "npc_turn");
    }

    @Override
    protected boolean checkGameOver(ArtilleryState s) {
        return s.isGameOver() || aliveTeams(s) <= 1;
    }

    /** 最后存活队伍里的第一位参战方；同归于尽时为 null */
    @Override
    protected String determineWinner(ArtilleryState s) {
        if (aliveTeams(s) != 1) {
            return null;
        }
        for (ArtilleryPlayer p : s.getPlayers().values()) {
            if (p.getWormIds().stream().anyMatch(id -> s.getWorms().get(id).isAlive())) {
                return p.getId();
            }
        }
        return null;
    }

    /** 存活虫子数 × 100 + 剩余总血量 */
    @Override
    protected Map<String, Integer> calculateScores(ArtilleryState s) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        for (ArtilleryPlayer p : s.getPlayers().values()) {
            int alive = 0;
            int hp = 0;
            for (String id : p.getWormIds()) {
                Worm w = s.getWorms().get(id);
                if (w.isAlive()) alive++;
                hp += w.getHp();
            }
            scores.put(p.getId(), alive * 100 + hp);
        }
        return scores;
    }
}
