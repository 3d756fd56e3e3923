package com.arenahub.gameservice.platform.catalog;

import com.arenahub.gameservice.engine.core.UnifiedGame;
import com.arenahub.gameservice.games.artillery.ArtilleryConfig;
import com.arenahub.gameservice.games.artillery.ArtilleryGame;
import com.arenahub.gameservice.games.brawler.BrawlerConfig;
import com.arenahub.gameservice.games.brawler.BrawlerGame;
import com.arenahub.gameservice.games.dungeon.DungeonConfig;
import com.arenahub.gameservice.games.dungeon.DungeonGame;
import com.arenahub.gameservice.games.sumo.SumoConfig;
import com.arenahub.gameservice.games.sumo.SumoGame;
import com.arenahub.gameservice.games.wrestler.WrestlerConfig;
import com.arenahub.gameservice.games.wrestler.WrestlerGame;
import com.arenahub.gameservice.platform.config.ArenaProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 游戏目录：slug → 模块。
 * 负责把“默认配置 + 请求配置”合并、补种子、转换为模块的强类型配置，再构造一个全新的游戏实例。
 * 每个会话各自一份配置对象，覆盖项不会在会话之间串味。
 */
@Slf4j
@Component
public class GameCatalog {

    public static final String SEED_KEY = "seed";

    private final Map<String, GameDescriptor<?>> modules = new LinkedHashMap<>();
    private final ObjectMapper mapper;
    private final ArenaProperties props;

    public GameCatalog(ObjectMapper mapper, ArenaProperties props) {
        this.mapper = mapper;
        this.props = props;
        register(new GameDescriptor<>(DungeonGame.SLUG, "地牢探险", DungeonConfig.class, DungeonGame::new));
        register(new GameDescriptor<>(BrawlerGame.SLUG, "街头乱斗", BrawlerConfig.class, BrawlerGame::new));
        register(new GameDescriptor<>(WrestlerGame.SLUG, "摔角擂台", WrestlerConfig.class, WrestlerGame::new));
        register(new GameDescriptor<>(SumoGame.SLUG, "相扑", SumoConfig.class, SumoGame::new));
        register(new GameDescriptor<>(ArtilleryGame.SLUG, "地形炮战", ArtilleryConfig.class, ArtilleryGame::new));
    }

    private void register(GameDescriptor<?> d) {
        modules.put(d.slug(), d);
    }

    public Collection<GameDescriptor<?>> all() {
        return Collections.unmodifiableCollection(modules.values());
    }

    public GameDescriptor<?> require(String slug) {
        GameDescriptor<?> d = slug == null ? null : modules.get(slug);
        if (d == null) {
            throw new IllegalArgumentException("未知游戏: " + slug);
        }
        return d;
    }

    /**
     * 合并默认配置与请求配置；缺少 seed 时生成一个并写回，保证快照可重放。
     */
    public Map<String, Object> resolveConfig(String slug, Map<String, Object> requested) {
        require(slug);
        Map<String, Object> merged = deepMerge(props.defaultsOf(slug), requested == null ? Map.of() : requested);
        if (!(merged.get(SEED_KEY) instanceof Number)) {
            merged.put(SEED_KEY, ThreadLocalRandom.current().nextLong(1L << 48));
        }
        return merged;
    }

    /**
     * 用已解析的配置构造游戏实例（未初始化）。
     * 配置字段类型不符时 Jackson 抛出 IllegalArgumentException，由上层映射为 400。
     */
    public UnifiedGame create(String slug, Map<String, Object> resolvedConfig) {
        GameDescriptor<?> d = require(slug);
        Object config = mapper.convertValue(resolvedConfig, d.configType());
        log.debug("[catalog] 构造游戏 slug={} config={}", slug, resolvedConfig);
        return d.create(config);
    }

    /** 递归合并，override 优先；嵌套 Map 逐层合并，其余值整体替换 */
    @SuppressWarnings("unchecked")
    static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> override) {
        Map<String, Object> out = new LinkedHashMap<>(base);
        override.forEach((k, v) -> {
            Object existing = out.get(k);
            if (existing instanceof Map<?, ?> em && v instanceof Map<?, ?> vm) {
                out.put(k, deepMerge((Map<String, Object>) em, (Map<String, Object>) vm));
            } else {
                out.put(k, v);
            }
        });
        return out;
    }
}
